package com.ionindexer.domain;

public record StoragePhase(long feesCollected, Long feesDue, StatusChange statusChange) {
}
