package com.ionindexer.ingestion.action;

import lombok.Getter;

/**
 * Thrown when a block's payload cannot be turned into an action. Fatal to that action only.
 */
@Getter
public class ActionExtractionException extends RuntimeException {

    private final String btype;

    public ActionExtractionException(String btype, String message) {
        super(btype + ": " + message);
        this.btype = btype;
    }
}
