package com.ionindexer.ingestion.action.extractor;

import com.ionindexer.domain.action.Action;
import com.ionindexer.domain.action.ActionType;
import com.ionindexer.domain.block.Block;
import com.ionindexer.ingestion.action.ActionExtractor;
import com.ionindexer.ingestion.action.BlockData;
import org.springframework.stereotype.Component;

import java.util.Set;

import static com.ionindexer.ingestion.action.AddressNormalizer.address;
import static com.ionindexer.ingestion.action.AddressNormalizer.asset;

@Component
public class JettonBurnActionExtractor implements ActionExtractor {

    @Override
    public Set<ActionType> supportedTypes() {
        return Set.of(ActionType.JETTON_BURN);
    }

    @Override
    public void extract(Block block, String traceId, Action.ActionBuilder action) {
        BlockData data = BlockData.of(block);
        action.source(address(data.account("owner")))
                .sourceSecondary(address(data.account("jetton_wallet")))
                .asset(asset(data.asset("asset")))
                .amount(data.amount("amount").value());
    }
}
