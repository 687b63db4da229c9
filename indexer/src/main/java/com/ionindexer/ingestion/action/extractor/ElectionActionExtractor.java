package com.ionindexer.ingestion.action.extractor;

import com.ionindexer.domain.action.Action;
import com.ionindexer.domain.action.ActionType;
import com.ionindexer.domain.block.Amount;
import com.ionindexer.domain.block.Block;
import com.ionindexer.ingestion.action.ActionExtractor;
import com.ionindexer.ingestion.action.BlockData;
import org.springframework.stereotype.Component;

import java.util.Set;

import static com.ionindexer.ingestion.action.AddressNormalizer.address;

/**
 * Validator stake deposit to / recovery from the elector. Amount is absent when the elector did not report it.
 */
@Component
public class ElectionActionExtractor implements ActionExtractor {

    @Override
    public Set<ActionType> supportedTypes() {
        return Set.of(ActionType.ELECTION_DEPOSIT, ActionType.ELECTION_RECOVER);
    }

    @Override
    public void extract(Block block, String traceId, Action.ActionBuilder action) {
        BlockData data = BlockData.of(block);
        Amount amount = data.optionalAmount("amount");
        action.source(address(data.account("stake_holder")))
                .amount(amount != null ? amount.value() : null);
    }
}
