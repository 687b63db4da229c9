package com.ionindexer.ingestion.action;

import lombok.Getter;

/**
 * Thrown when a structurally required payload key is absent (or null where a value is mandatory).
 */
@Getter
public class MissingRequiredFieldException extends ActionExtractionException {

    private final String key;

    public MissingRequiredFieldException(String btype, String key) {
        super(btype, "missing required field '" + key + "'");
        this.key = key;
    }
}
