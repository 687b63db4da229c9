package com.ionindexer.domain;

/**
 * Compute phase that ran the TVM. {@code exitArg} is the signed 32-bit argument of the exit code, null when the
 * VM set none; {@code gasCredit} is null outside external messages.
 */
public record VmComputePhase(
        boolean success,
        boolean msgStateUsed,
        boolean accountActivated,
        long gasFees,
        long gasUsed,
        long gasLimit,
        Long gasCredit,
        int mode,
        int exitCode,
        Integer exitArg,
        long vmSteps,
        String vmInitStateHash,
        String vmFinalStateHash
) implements ComputePhase {

    @Override
    public boolean isSkipped() {
        return false;
    }
}
