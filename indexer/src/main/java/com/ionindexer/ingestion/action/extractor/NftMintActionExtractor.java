package com.ionindexer.ingestion.action.extractor;

import com.ionindexer.domain.action.Action;
import com.ionindexer.domain.action.ActionType;
import com.ionindexer.domain.action.NftMintData;
import com.ionindexer.domain.block.Block;
import com.ionindexer.ingestion.action.ActionExtractor;
import com.ionindexer.ingestion.action.BlockData;
import org.springframework.stereotype.Component;

import java.util.Set;

import static com.ionindexer.ingestion.action.AddressNormalizer.address;

/**
 * NFT item deployment. The minted item is both the destination and {@code asset_secondary}.
 */
@Component
public class NftMintActionExtractor implements ActionExtractor {

    @Override
    public Set<ActionType> supportedTypes() {
        return Set.of(ActionType.NFT_MINT);
    }

    @Override
    public void extract(Block block, String traceId, Action.ActionBuilder action) {
        BlockData data = BlockData.of(block);
        String item = address(data.account("address"));
        action.source(address(data.nullableAccount("source")))
                .destination(item)
                .assetSecondary(item)
                .asset(address(data.nullableAccount("collection")))
                .nftMintData(new NftMintData(data.nullableBigInteger("index")));
    }
}
