package com.ionindexer.ingestion.action.extractor;

import com.ionindexer.domain.action.Action;
import com.ionindexer.domain.action.ActionType;
import com.ionindexer.domain.action.JettonSwapData;
import com.ionindexer.domain.action.SwapTransfer;
import com.ionindexer.domain.block.Block;
import com.ionindexer.ingestion.action.ActionExtractor;
import com.ionindexer.ingestion.action.BlockData;
import org.springframework.stereotype.Component;

import java.util.Set;

import static com.ionindexer.ingestion.action.AddressNormalizer.address;
import static com.ionindexer.ingestion.action.AddressNormalizer.asset;

/**
 * DEX swap. The incoming leg (user to DEX) supplies asset, source and source wallet; the outgoing leg
 * (DEX to user) supplies asset2, destination and destination wallet.
 */
@Component
public class JettonSwapActionExtractor implements ActionExtractor {

    @Override
    public Set<ActionType> supportedTypes() {
        return Set.of(ActionType.JETTON_SWAP);
    }

    @Override
    public void extract(Block block, String traceId, Action.ActionBuilder action) {
        BlockData data = BlockData.of(block);
        SwapTransfer incoming = transfer(data.nested("dex_incoming_transfer"));
        SwapTransfer outgoing = transfer(data.nested("dex_outgoing_transfer"));
        action.asset(incoming.asset())
                .asset2(outgoing.asset())
                .source(incoming.source())
                .sourceSecondary(incoming.sourceJettonWallet())
                .destination(outgoing.destination())
                .destinationSecondary(outgoing.destinationJettonWallet())
                .jettonSwapData(new JettonSwapData(
                        data.nullableString("dex"),
                        address(data.nullableAccount("sender")),
                        incoming,
                        outgoing));
    }

    private static SwapTransfer transfer(BlockData leg) {
        return new SwapTransfer(
                leg.amount("amount").value(),
                address(leg.nullableAccount("source")),
                address(leg.nullableAccount("source_jetton_wallet")),
                address(leg.nullableAccount("destination")),
                address(leg.nullableAccount("destination_jetton_wallet")),
                asset(leg.nullableAsset("asset")));
    }
}
