package com.fintech.settlement.service;

import com.fintech.settlement.entity.Member;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Read access to members: payers and their delegate/coordinator assignments, and the
 * contact details of commission recipients.
 */
public interface RecipientDirectory {

    Optional<Member> findMember(UUID memberId);

    /**
     * Members found among the given ids, keyed by id. Unknown ids are absent from the map.
     */
    Map<UUID, Member> findMembers(Collection<UUID> memberIds);
}
