package com.ionindexer.ingestion.decoder;

import com.fasterxml.jackson.databind.JsonNode;
import com.ionindexer.domain.ActionPhase;
import com.ionindexer.domain.SkippedComputePhase;
import com.ionindexer.domain.StatusChange;
import com.ionindexer.domain.TransactionDescription;
import com.ionindexer.domain.VmComputePhase;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;

import static com.ionindexer.ingestion.decoder.TransactionRecords.actionPhase;
import static com.ionindexer.ingestion.decoder.TransactionRecords.description;
import static com.ionindexer.ingestion.decoder.TransactionRecords.skippedComputePhase;
import static com.ionindexer.ingestion.decoder.TransactionRecords.vmComputePhase;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransactionDescriptionDecoderTest {

    private final TransactionDescriptionDecoder decoder = new TransactionDescriptionDecoder();

    @Test
    void decodesVmComputeAndActionPhases() throws IOException {
        TransactionDescription d = decoder.decode(tree(description(vmComputePhase(), actionPhase())), "tx=");

        assertThat(d.creditFirst()).isFalse();
        assertThat(d.storagePhase().feesCollected()).isEqualTo(12L);
        assertThat(d.storagePhase().feesDue()).isNull();
        assertThat(d.storagePhase().statusChange()).isEqualTo(StatusChange.UNCHANGED);
        assertThat(d.creditPhase().dueFeesCollected()).isNull();
        assertThat(d.creditPhase().credit()).isEqualTo(1_000_000_000L);

        assertThat(d.computePhase().isSkipped()).isFalse();
        VmComputePhase vm = (VmComputePhase) d.computePhase();
        assertThat(vm.success()).isTrue();
        assertThat(vm.gasFees()).isEqualTo(2_000_000L);
        assertThat(vm.gasUsed()).isEqualTo(5_000L);
        assertThat(vm.gasLimit()).isEqualTo(1_000_000L);
        assertThat(vm.gasCredit()).isNull();
        assertThat(vm.exitCode()).isZero();
        assertThat(vm.exitArg()).isNull();
        assertThat(vm.vmSteps()).isEqualTo(96L);
        assertThat(vm.vmInitStateHash()).isEqualTo("vmInitHash=");
        assertThat(vm.vmFinalStateHash()).isEqualTo("vmFinalHash=");

        ActionPhase action = d.actionPhase();
        assertThat(action.success()).isTrue();
        assertThat(action.valid()).isTrue();
        assertThat(action.noFunds()).isFalse();
        assertThat(action.statusChange()).isEqualTo(StatusChange.UNCHANGED);
        assertThat(action.totalFwdFees()).isEqualTo(266_669L);
        assertThat(action.totalActionFees()).isEqualTo(133_331L);
        assertThat(action.totActions()).isEqualTo(1);
        assertThat(action.msgsCreated()).isEqualTo(1);
        assertThat(action.actionListHash()).isEqualTo("actionListHash=");
        assertThat(action.totMsgSizeCells()).isEqualTo(1L);
        assertThat(action.totMsgSizeBits()).isEqualTo(705L);
    }

    @Test
    void decodesSkippedComputePhaseWithoutActionPhase() throws IOException {
        TransactionDescription d = decoder.decode(tree(description(skippedComputePhase(2), null)), "tx=");

        assertThat(d.computePhase()).isEqualTo(new SkippedComputePhase(2));
        assertThat(d.computePhase().isSkipped()).isTrue();
        assertThat(d.actionPhase()).isNull();
    }

    @ParameterizedTest
    @CsvSource({"0,UNCHANGED", "1,FROZEN", "2,DELETED"})
    void mapsStorageStatusChange(int code, StatusChange expected) throws IOException {
        List<Object> descr = description(vmComputePhase(), null);
        descr.set(1, Arrays.asList(12L, 3L, code));

        assertThat(decoder.decode(tree(descr), "tx=").storagePhase().statusChange()).isEqualTo(expected);
    }

    @Test
    void rejectsUnknownStatusChange() throws IOException {
        List<Object> descr = description(vmComputePhase(), null);
        descr.set(1, Arrays.asList(12L, null, 3));

        assertThatThrownBy(() -> decoder.decode(tree(descr), "tx="))
                .isInstanceOf(MalformedPhaseException.class)
                .hasMessageContaining("status change code 3");
    }

    @Test
    void rejectsUnknownComputeTag() throws IOException {
        List<Object> descr = description(Arrays.asList(7, Arrays.asList(1)), null);

        assertThatThrownBy(() -> decoder.decode(tree(descr), "tx="))
                .isInstanceOf(MalformedPhaseException.class)
                .hasMessageContaining("compute phase tag 7");
    }

    @Test
    void rejectsShortVmPayload() throws IOException {
        List<Object> descr = description(Arrays.asList(1, Arrays.asList(true, false, false)), null);

        assertThatThrownBy(() -> decoder.decode(tree(descr), "tx="))
                .isInstanceOf(MalformedPhaseException.class)
                .hasMessageContaining("expected 13 elements, got 3")
                .extracting(e -> ((DecodeException) e).getRecordHash()).isEqualTo("tx=");
    }

    @Test
    void rejectsMalformedMessageSizePair() throws IOException {
        List<Object> action = actionPhase();
        action.set(13, Arrays.asList(1L));

        assertThatThrownBy(() -> decoder.decode(tree(description(vmComputePhase(), action)), "tx="))
                .isInstanceOf(MalformedPhaseException.class)
                .hasMessageContaining("tot_msg_size");
    }

    @Test
    @SuppressWarnings("unchecked")
    void resultArgumentsAreSigned32Bit() throws IOException {
        List<Object> compute = vmComputePhase();
        ((List<Object>) compute.get(1)).set(9, -1);
        List<Object> action = actionPhase();
        action.set(7, Integer.MIN_VALUE);

        TransactionDescription d = decoder.decode(tree(description(compute, action)), "tx=");

        assertThat(((VmComputePhase) d.computePhase()).exitArg()).isEqualTo(-1);
        assertThat(d.actionPhase().resultArg()).isEqualTo(Integer.MIN_VALUE);

        action.set(7, 1L << 32);
        assertThatThrownBy(() -> decoder.decode(tree(description(vmComputePhase(), action)), "tx="))
                .isInstanceOf(MalformedPhaseException.class)
                .hasMessageContaining("expected 32-bit integer");
    }

    private static JsonNode tree(Object value) throws IOException {
        return TransactionRecords.MSGPACK.readTree(TransactionRecords.pack(value));
    }
}
