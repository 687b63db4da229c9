package com.ionindexer.ingestion.action;

import com.ionindexer.domain.action.Action;
import com.ionindexer.domain.action.ActionType;
import com.ionindexer.domain.block.Amount;
import com.ionindexer.domain.block.Block;
import com.ionindexer.ingestion.action.extractor.AuctionBidActionExtractor;
import com.ionindexer.ingestion.action.extractor.CallContractActionExtractor;
import com.ionindexer.ingestion.action.extractor.ChangeDnsActionExtractor;
import com.ionindexer.ingestion.action.extractor.DeleteDnsActionExtractor;
import com.ionindexer.ingestion.action.extractor.ElectionActionExtractor;
import com.ionindexer.ingestion.action.extractor.JettonBurnActionExtractor;
import com.ionindexer.ingestion.action.extractor.JettonSwapActionExtractor;
import com.ionindexer.ingestion.action.extractor.JettonTransferActionExtractor;
import com.ionindexer.ingestion.action.extractor.NftMintActionExtractor;
import com.ionindexer.ingestion.action.extractor.NftTransferActionExtractor;
import com.ionindexer.ingestion.action.extractor.SubscribeActionExtractor;
import com.ionindexer.ingestion.action.extractor.TonTransferActionExtractor;
import com.ionindexer.ingestion.action.extractor.UnsubscribeActionExtractor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BlockActionConverterTest {

    static List<ActionExtractor> allExtractors() {
        return List.of(
                new CallContractActionExtractor(),
                new TonTransferActionExtractor(),
                new JettonTransferActionExtractor(),
                new NftTransferActionExtractor(),
                new NftMintActionExtractor(),
                new JettonBurnActionExtractor(),
                new JettonSwapActionExtractor(),
                new ChangeDnsActionExtractor(),
                new DeleteDnsActionExtractor(),
                new SubscribeActionExtractor(),
                new UnsubscribeActionExtractor(),
                new ElectionActionExtractor(),
                new AuctionBidActionExtractor());
    }

    @Test
    void dispatchesByBtype() {
        BlockActionConverter converter = new BlockActionConverter(allExtractors(), new BaseActionFactory());
        Block block = Blocks.block("election_recover", Map.of(
                "stake_holder", Blocks.SENDER,
                "amount", Amount.of(42)));

        Action action = converter.convert(block, "trace-1");

        assertThat(action.getType()).isEqualTo("election_recover");
        assertThat(action.getTraceId()).isEqualTo("trace-1");
        assertThat(action.getSource()).isEqualTo(Blocks.SENDER.asStr());
        assertThat(action.getAmount()).isEqualTo(BigInteger.valueOf(42));
    }

    @Test
    @DisplayName("unknown btype yields an action with base fields only")
    void unknownBtypeIsBaseOnly() {
        BlockActionConverter converter = new BlockActionConverter(allExtractors(), new BaseActionFactory());
        Block block = Blocks.block("stake_deposit", Map.of("pool", Blocks.RECEIVER));

        Action action = converter.convert(block, "trace-1");

        assertThat(action.getType()).isEqualTo("stake_deposit");
        assertThat(action.getActionId()).isNotBlank();
        assertThat(action.getTxHashes()).containsExactly("txA", "txB");
        assertThat(action.getSource()).isNull();
        assertThat(action.getDestination()).isNull();
        assertThat(action.getValue()).isNull();
    }

    @Test
    void missingExtractorFailsConstruction() {
        List<ActionExtractor> extractors = new ArrayList<>(allExtractors());
        extractors.removeIf(e -> e instanceof AuctionBidActionExtractor);

        assertThatThrownBy(() -> new BlockActionConverter(extractors, new BaseActionFactory()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("AUCTION_BID");
    }

    @Test
    void duplicateExtractorFailsConstruction() {
        List<ActionExtractor> extractors = new ArrayList<>(allExtractors());
        extractors.add(new ActionExtractor() {
            @Override
            public Set<ActionType> supportedTypes() {
                return Set.of(ActionType.TON_TRANSFER);
            }

            @Override
            public void extract(Block block, String traceId, Action.ActionBuilder action) {
            }
        });

        assertThatThrownBy(() -> new BlockActionConverter(extractors, new BaseActionFactory()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate extractors for ton_transfer");
    }

    @Test
    void extractionErrorsPropagate() {
        BlockActionConverter converter = new BlockActionConverter(allExtractors(), new BaseActionFactory());
        Block block = Blocks.block("jetton_burn", Map.of("owner", Blocks.SENDER));

        assertThatThrownBy(() -> converter.convert(block, "trace-1"))
                .isInstanceOfSatisfying(MissingRequiredFieldException.class,
                        e -> assertThat(e.getKey()).isEqualTo("jetton_wallet"));
    }
}
