package com.ionindexer.ingestion.action;

import com.ionindexer.domain.action.Action;
import com.ionindexer.domain.block.Block;
import com.ionindexer.domain.block.EventNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BaseActionFactoryTest {

    private final BaseActionFactory factory = new BaseActionFactory();

    @Test
    void copiesSharedFieldsFromBlock() {
        Action action = factory.base(Blocks.block("ton_transfer").build(), "trace-1").build();

        assertThat(action.getTraceId()).isEqualTo("trace-1");
        assertThat(action.getType()).isEqualTo("ton_transfer");
        assertThat(action.getActionId()).isEqualTo(ActionIdCalculator.actionId("msgA", "ton_transfer"));
        assertThat(action.getTxHashes()).containsExactly("txA", "txB");
        assertThat(action.getStartLt()).isEqualTo(100L);
        assertThat(action.getEndLt()).isEqualTo(101L);
        assertThat(action.getStartUtime()).isEqualTo(1_717_000_000L);
        assertThat(action.getEndUtime()).isEqualTo(1_717_000_005L);
        assertThat(action.isSuccess()).isTrue();
        assertThat(action.getSource()).isNull();
        assertThat(action.getTonTransferData()).isNull();
    }

    @Test
    void failedBlockIsUnsuccessful() {
        Action action = factory.base(Blocks.block("ton_transfer").failed(true).build(), "t").build();

        assertThat(action.isSuccess()).isFalse();
    }

    @Test
    void repeatedTransactionsAreListedOnce() {
        Block block = Block.builder()
                .btype("jetton_swap")
                .eventNode(new EventNode(10L, "tx1", "m1"))
                .eventNode(new EventNode(11L, "tx2", "m2"))
                .eventNode(new EventNode(10L, "tx1", "m3"))
                .build();

        assertThat(factory.base(block, "t").build().getTxHashes()).containsExactly("tx1", "tx2");
    }
}
