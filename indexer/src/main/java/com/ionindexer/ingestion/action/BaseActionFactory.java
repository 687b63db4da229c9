package com.ionindexer.ingestion.action;

import com.ionindexer.domain.action.Action;
import com.ionindexer.domain.block.Block;
import com.ionindexer.domain.block.EventNode;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Starts an action with the fields every block type shares: identity, trace, contributing transactions,
 * lt/utime bounds and success.
 */
@Component
public class BaseActionFactory {

    public Action.ActionBuilder base(Block block, String traceId) {
        Set<String> txHashes = new LinkedHashSet<>();
        for (EventNode node : block.getEventNodes()) {
            txHashes.add(node.txHash());
        }
        return Action.builder()
                .traceId(traceId)
                .type(block.getBtype())
                .actionId(ActionIdCalculator.actionId(block))
                .txHashes(Collections.unmodifiableSet(txHashes))
                .startLt(block.getMinLt())
                .endLt(block.getMaxLt())
                .startUtime(block.getMinUtime())
                .endUtime(block.getMaxUtime())
                .success(!block.isFailed());
    }
}
