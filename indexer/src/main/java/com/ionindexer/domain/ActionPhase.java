package com.ionindexer.domain;

/**
 * Action phase; present on a transaction only when it produced output actions.
 * {@code resultArg} is the signed 32-bit argument of {@code resultCode}, null when none was set.
 * Fee totals are null when the phase did not report them.
 */
public record ActionPhase(
        boolean success,
        boolean valid,
        boolean noFunds,
        StatusChange statusChange,
        Long totalFwdFees,
        Long totalActionFees,
        int resultCode,
        Integer resultArg,
        int totActions,
        int specActions,
        int skippedActions,
        int msgsCreated,
        String actionListHash,
        long totMsgSizeCells,
        long totMsgSizeBits
) {
}
