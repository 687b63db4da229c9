package com.ionindexer.ingestion.action;

import com.ionindexer.domain.action.Action;
import com.ionindexer.domain.action.ActionType;
import com.ionindexer.domain.block.Block;

import java.util.Set;

/**
 * Fills the type-specific fields of an action from one block's payload.
 * Each call gets a fresh builder already holding the base fields; extractors share no state.
 */
public interface ActionExtractor {

    /**
     * Block types this extractor handles. Across all extractors every {@link ActionType} is covered exactly once.
     */
    Set<ActionType> supportedTypes();

    /**
     * @param block   classified block
     * @param traceId trace the block belongs to (for diagnostics)
     * @param action  builder to populate
     * @throws ActionExtractionException when the payload lacks a required field or has the wrong shape
     */
    void extract(Block block, String traceId, Action.ActionBuilder action);
}
