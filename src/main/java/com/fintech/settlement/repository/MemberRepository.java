package com.fintech.settlement.repository;

import com.fintech.settlement.entity.Member;
import com.fintech.settlement.service.RecipientDirectory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Repository
public interface MemberRepository extends JpaRepository<Member, UUID>, RecipientDirectory {

    @Override
    default Optional<Member> findMember(UUID memberId) {
        return memberId == null ? Optional.empty() : findById(memberId);
    }

    @Override
    default Map<UUID, Member> findMembers(Collection<UUID> memberIds) {
        if (memberIds == null || memberIds.isEmpty()) {
            return Map.of();
        }
        return findAllById(memberIds).stream()
                .collect(Collectors.toMap(Member::getId, Function.identity()));
    }
}
