package com.ionindexer.ingestion.action;

import com.ionindexer.domain.action.Action;
import com.ionindexer.domain.block.Block;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts the blocks classified for one trace into actions. A block that fails extraction is logged and
 * reported; the remaining blocks are unaffected.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ActionService {

    private final BlockActionConverter blockActionConverter;

    public ActionBatchResult convertAll(String traceId, List<Block> blocks) {
        List<Action> actions = new ArrayList<>(blocks.size());
        List<ActionFailure> failures = new ArrayList<>();
        for (Block block : blocks) {
            try {
                actions.add(blockActionConverter.convert(block, traceId));
            } catch (RuntimeException e) {
                log.error("Action extraction failed for {} block in trace {}: {}",
                        block.getBtype(), traceId, e.getMessage(), e);
                failures.add(new ActionFailure(block, e));
            }
        }
        return new ActionBatchResult(actions, failures);
    }
}
