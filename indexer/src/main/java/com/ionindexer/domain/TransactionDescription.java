package com.ionindexer.domain;

/**
 * Decoded ordinary-transaction description. {@code actionPhase} is null when no action phase ran.
 */
public record TransactionDescription(
        boolean creditFirst,
        StoragePhase storagePhase,
        CreditPhase creditPhase,
        ComputePhase computePhase,
        ActionPhase actionPhase,
        boolean aborted,
        boolean bounce,
        boolean destroyed
) {

    public boolean hasActionPhase() {
        return actionPhase != null;
    }
}
