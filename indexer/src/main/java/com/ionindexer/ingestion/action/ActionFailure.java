package com.ionindexer.ingestion.action;

import com.ionindexer.domain.block.Block;

/**
 * A block whose action could not be produced, with the error that aborted it.
 */
public record ActionFailure(Block block, RuntimeException error) {
}
