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
 * Bid on an NFT auction; the bid amount is the action value.
 */
@Component
public class AuctionBidActionExtractor implements ActionExtractor {

    @Override
    public Set<ActionType> supportedTypes() {
        return Set.of(ActionType.AUCTION_BID);
    }

    @Override
    public void extract(Block block, String traceId, Action.ActionBuilder action) {
        BlockData data = BlockData.of(block);
        action.source(address(data.account("bidder")))
                .destination(address(data.account("auction")))
                .assetSecondary(address(data.account("nft_address")))
                .value(data.amount("amount").value());
    }
}
