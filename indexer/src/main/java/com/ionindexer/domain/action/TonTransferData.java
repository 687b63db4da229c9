package com.ionindexer.domain.action;

public record TonTransferData(String content, boolean encrypted) {
}
