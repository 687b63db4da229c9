package com.ionindexer.domain;

public record CreditPhase(Long dueFeesCollected, long credit) {
}
