package com.ionindexer.domain;

/**
 * Compute phase of a transaction: either {@link SkippedComputePhase} or {@link VmComputePhase}.
 */
public interface ComputePhase {

    boolean isSkipped();
}
