package com.fintech.settlement.service;

import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process mutex per settlement, held while a settlement's payouts or transfers are
 * being driven.
 */
@Component
public class SettlementRunLock {

    private final Set<UUID> running = ConcurrentHashMap.newKeySet();

    public boolean tryAcquire(UUID settlementId) {
        return running.add(settlementId);
    }

    public void release(UUID settlementId) {
        running.remove(settlementId);
    }

    public boolean isHeld(UUID settlementId) {
        return running.contains(settlementId);
    }
}
