package com.ionindexer.ingestion.action.extractor;

import com.ionindexer.domain.action.Action;
import com.ionindexer.domain.action.ActionType;
import com.ionindexer.domain.action.JettonTransferData;
import com.ionindexer.domain.block.Block;
import com.ionindexer.ingestion.action.ActionExtractor;
import com.ionindexer.ingestion.action.BlockData;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Set;

import static com.ionindexer.ingestion.action.AddressNormalizer.address;
import static com.ionindexer.ingestion.action.AddressNormalizer.asset;

/**
 * Jetton transfer between owners. Source/destination are the owners, the secondary fields their jetton wallets.
 * An encrypted comment is kept as base64 of the raw bytes.
 */
@Component
public class JettonTransferActionExtractor implements ActionExtractor {

    @Override
    public Set<ActionType> supportedTypes() {
        return Set.of(ActionType.JETTON_TRANSFER);
    }

    @Override
    public void extract(Block block, String traceId, Action.ActionBuilder action) {
        BlockData data = BlockData.of(block);
        boolean encrypted = data.bool("encrypted_comment");
        action.source(address(data.account("sender")))
                .sourceSecondary(address(data.account("sender_wallet")))
                .destination(address(data.account("receiver")))
                .destinationSecondary(address(data.optionalAccount("receiver_wallet")))
                .amount(data.amount("amount").value())
                .asset(asset(data.nullableAsset("asset")))
                .jettonTransferData(new JettonTransferData(
                        data.nullableBigInteger("query_id"),
                        address(data.nullableAccount("response_address")),
                        data.amount("forward_amount").value(),
                        data.nullablePayload("custom_payload"),
                        data.nullablePayload("forward_payload"),
                        comment(data.nullableBytes("comment"), encrypted),
                        encrypted));
    }

    private static String comment(byte[] raw, boolean encrypted) {
        if (raw == null) {
            return null;
        }
        if (encrypted) {
            return Base64.getEncoder().encodeToString(raw);
        }
        return Comments.stripNulls(new String(raw, StandardCharsets.UTF_8));
    }
}
