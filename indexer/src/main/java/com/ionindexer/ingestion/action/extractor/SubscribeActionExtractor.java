package com.ionindexer.ingestion.action.extractor;

import com.ionindexer.domain.action.Action;
import com.ionindexer.domain.action.ActionType;
import com.ionindexer.domain.block.Block;
import com.ionindexer.ingestion.action.ActionExtractor;
import com.ionindexer.ingestion.action.BlockData;
import org.springframework.stereotype.Component;

import java.util.Set;

import static com.ionindexer.ingestion.action.AddressNormalizer.address;

/**
 * Subscription payment: subscriber pays beneficiary through the subscription contract.
 */
@Component
public class SubscribeActionExtractor implements ActionExtractor {

    @Override
    public Set<ActionType> supportedTypes() {
        return Set.of(ActionType.SUBSCRIBE);
    }

    @Override
    public void extract(Block block, String traceId, Action.ActionBuilder action) {
        BlockData data = BlockData.of(block);
        action.source(address(data.account("subscriber")))
                .destination(address(data.nullableAccount("beneficiary")))
                .destinationSecondary(address(data.account("subscription")))
                .amount(data.amount("amount").value());
    }
}
