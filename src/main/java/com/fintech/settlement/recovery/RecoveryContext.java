package com.fintech.settlement.recovery;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.springframework.transaction.TransactionStatus;

import java.util.Map;

/**
 * Caller-supplied context of a wrapped operation: identifiers for logging and,
 * optionally, the transaction that rollback actions act on.
 */
@Value
@Builder
public class RecoveryContext {

    private static final RecoveryContext EMPTY = RecoveryContext.builder().build();

    @Singular
    Map<String, Object> attributes;

    TransactionStatus transaction;

    public static RecoveryContext empty() {
        return EMPTY;
    }

    public static RecoveryContext of(String key, Object value) {
        return RecoveryContext.builder().attribute(key, value).build();
    }

    public Object get(String key) {
        return attributes.get(key);
    }

    @Override
    public String toString() {
        return attributes.toString();
    }
}
