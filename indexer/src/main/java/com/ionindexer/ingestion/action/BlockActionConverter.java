package com.ionindexer.ingestion.action;

import com.ionindexer.domain.action.Action;
import com.ionindexer.domain.action.ActionType;
import com.ionindexer.domain.block.Block;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Converts one classified block into an action: base fields, then the extractor registered for its btype.
 * Unknown btypes yield a base-only action. Fails at startup if any {@link ActionType} lacks an extractor
 * or has more than one.
 */
@Component
@Slf4j
public class BlockActionConverter {

    private final Map<ActionType, ActionExtractor> extractors = new EnumMap<>(ActionType.class);
    private final BaseActionFactory baseActionFactory;

    public BlockActionConverter(List<ActionExtractor> extractors, BaseActionFactory baseActionFactory) {
        this.baseActionFactory = baseActionFactory;
        for (ActionExtractor extractor : extractors) {
            for (ActionType type : extractor.supportedTypes()) {
                ActionExtractor previous = this.extractors.put(type, extractor);
                if (previous != null) {
                    throw new IllegalStateException("Duplicate extractors for " + type.code() + ": "
                            + previous.getClass().getSimpleName() + ", " + extractor.getClass().getSimpleName());
                }
            }
        }
        Set<ActionType> missing = EnumSet.allOf(ActionType.class);
        missing.removeAll(this.extractors.keySet());
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No extractor registered for " + missing);
        }
    }

    /**
     * @throws ActionExtractionException when the block's payload is incomplete for its type
     */
    public Action convert(Block block, String traceId) {
        Action.ActionBuilder action = baseActionFactory.base(block, traceId);
        Optional<ActionType> type = ActionType.fromCode(block.getBtype());
        if (type.isEmpty()) {
            log.debug("No extractor for block type {} in trace {}; emitting base action", block.getBtype(), traceId);
            return action.build();
        }
        extractors.get(type.get()).extract(block, traceId, action);
        return action.build();
    }
}
