package com.fintech.settlement.recovery;

/**
 * Body of a recovery action.
 */
@FunctionalInterface
public interface RecoveryHandler {

    /**
     * @param context context of the failed operation
     * @param failure the failure of the last attempt
     * @return true if the action succeeded
     */
    boolean handle(RecoveryContext context, Throwable failure) throws Exception;
}
