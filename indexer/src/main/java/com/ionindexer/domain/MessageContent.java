package com.ionindexer.domain;

/**
 * Serialized cell content (base64 BoC) referenced by a message body or init state.
 * The cell hash is assigned by the persistence layer, not here.
 */
public record MessageContent(String body) {
}
