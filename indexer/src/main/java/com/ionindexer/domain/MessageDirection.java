package com.ionindexer.domain;

public enum MessageDirection {
    IN,
    OUT
}
