package com.ionindexer.ingestion.action.extractor;

import com.ionindexer.domain.action.Action;
import com.ionindexer.domain.action.ActionType;
import com.ionindexer.domain.action.NftTransferData;
import com.ionindexer.domain.block.Amount;
import com.ionindexer.domain.block.Block;
import com.ionindexer.ingestion.action.ActionExtractor;
import com.ionindexer.ingestion.action.BlockData;
import org.springframework.stereotype.Component;

import java.util.Set;

import static com.ionindexer.ingestion.action.AddressNormalizer.address;

/**
 * NFT ownership change, including marketplace purchases. {@code asset_secondary} is the item,
 * {@code asset} its collection when it has one.
 */
@Component
public class NftTransferActionExtractor implements ActionExtractor {

    @Override
    public Set<ActionType> supportedTypes() {
        return Set.of(ActionType.NFT_TRANSFER);
    }

    @Override
    public void extract(Block block, String traceId, Action.ActionBuilder action) {
        BlockData data = BlockData.of(block);
        BlockData nft = data.nested("nft");
        BlockData collection = nft.nullableNested("collection");
        boolean purchase = data.bool("is_purchase");
        Amount price = purchase ? data.optionalAmount("price") : null;
        Amount forwardAmount = data.nullableAmount("forward_amount");

        action.source(address(data.optionalAccount("prev_owner")))
                .destination(address(data.account("new_owner")))
                .assetSecondary(address(nft.account("address")))
                .asset(collection != null ? address(collection.account("address")) : null)
                .nftTransferData(new NftTransferData(
                        data.nullableBigInteger("query_id"),
                        purchase,
                        price != null ? price.value() : null,
                        nft.nullableBigInteger("index"),
                        forwardAmount != null ? forwardAmount.value() : null,
                        data.nullablePayload("custom_payload"),
                        data.nullablePayload("forward_payload"),
                        address(data.nullableAccount("response_destination"))));
    }
}
