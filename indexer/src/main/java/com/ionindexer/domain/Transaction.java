package com.ionindexer.domain;

import java.util.List;

/**
 * One decoded blockchain state transition. Immutable after decoding.
 * Messages are ordered: all outbound messages first, the single inbound message last.
 */
public record Transaction(
        String hash,
        long lt,
        String account,
        String prevTransHash,
        long prevTransLt,
        long now,
        AccountStatus origStatus,
        AccountStatus endStatus,
        long totalFees,
        String accountStateHashBefore,
        String accountStateHashAfter,
        boolean emulated,
        TransactionDescription description,
        List<Message> messages
) {

    public Transaction {
        messages = List.copyOf(messages);
    }

    public Message inMessage() {
        return messages.get(messages.size() - 1);
    }

    public List<Message> outMessages() {
        return messages.subList(0, messages.size() - 1);
    }
}
