package com.ionindexer.domain;

/**
 * Compute phase that did not run the VM. {@code reason} is the ledger's skip reason code.
 */
public record SkippedComputePhase(int reason) implements ComputePhase {

    @Override
    public boolean isSkipped() {
        return true;
    }
}
