package com.ionindexer.ingestion.action.extractor;

import com.ionindexer.domain.action.Action;
import com.ionindexer.domain.action.ActionType;
import com.ionindexer.domain.action.TonTransferData;
import com.ionindexer.domain.block.AccountId;
import com.ionindexer.domain.block.Block;
import com.ionindexer.ingestion.action.ActionExtractor;
import com.ionindexer.ingestion.action.ActionIdCalculator;
import com.ionindexer.ingestion.action.BlockData;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;

import static com.ionindexer.ingestion.action.AddressNormalizer.address;

/**
 * Native coin transfer with optional text comment.
 * A null destination is an upstream classifier anomaly: logged, and the action is still produced.
 */
@Component
@Slf4j
public class TonTransferActionExtractor implements ActionExtractor {

    @Override
    public Set<ActionType> supportedTypes() {
        return Set.of(ActionType.TON_TRANSFER);
    }

    @Override
    public void extract(Block block, String traceId, Action.ActionBuilder action) {
        BlockData data = BlockData.of(block);
        AccountId destination = data.nullableAccount("destination");
        if (destination == null) {
            log.warn("ton_transfer without destination in trace {}, action {}",
                    traceId, ActionIdCalculator.actionId(block));
        }
        String comment = data.nullableString("comment");
        action.value(data.amount("value").value())
                .source(address(data.account("source")))
                .destination(address(destination))
                .tonTransferData(new TonTransferData(
                        comment != null ? Comments.stripNulls(comment) : null,
                        data.bool("encrypted")));
    }
}
