package com.ionindexer.ingestion.decoder;

import com.fasterxml.jackson.databind.JsonNode;
import com.ionindexer.domain.ActionPhase;
import com.ionindexer.domain.ComputePhase;
import com.ionindexer.domain.CreditPhase;
import com.ionindexer.domain.SkippedComputePhase;
import com.ionindexer.domain.StatusChange;
import com.ionindexer.domain.StoragePhase;
import com.ionindexer.domain.TransactionDescription;
import com.ionindexer.domain.VmComputePhase;
import org.springframework.stereotype.Component;

/**
 * Decodes the positional transaction description:
 * {@code (credit_first, storage_ph, credit_ph, compute_ph, action_ph | nil, aborted, bounce, destroyed)}.
 * Any layout violation is reported as {@link MalformedPhaseException}.
 */
@Component
public class TransactionDescriptionDecoder {

    static final int DESCRIPTION_ARITY = 8;
    static final int STORAGE_ARITY = 3;
    static final int CREDIT_ARITY = 2;
    static final int COMPUTE_ARITY = 2;
    static final int SKIPPED_ARITY = 1;
    static final int VM_ARITY = 13;
    static final int ACTION_ARITY = 14;
    static final int MSG_SIZE_ARITY = 2;

    private static final int COMPUTE_SKIPPED = 0;
    private static final int COMPUTE_VM = 1;

    public TransactionDescription decode(JsonNode node, String recordHash) {
        try {
            return decodeDescription(node, recordHash);
        } catch (MalformedPhaseException e) {
            throw e;
        } catch (DecodeException e) {
            throw new MalformedPhaseException("Malformed transaction description: " + e.getDetail(), recordHash, e);
        }
    }

    private TransactionDescription decodeDescription(JsonNode node, String recordHash) {
        TupleReader descr = TupleReader.of(node, DESCRIPTION_ARITY, "description", recordHash);
        return new TransactionDescription(
                descr.bool(0),
                storagePhase(descr.tuple(1, STORAGE_ARITY, "storage_ph")),
                creditPhase(descr.tuple(2, CREDIT_ARITY, "credit_ph")),
                computePhase(descr.tuple(3, COMPUTE_ARITY, "compute_ph")),
                actionPhase(descr.nullableTuple(4, ACTION_ARITY, "action_ph")),
                descr.bool(5),
                descr.bool(6),
                descr.bool(7));
    }

    private static StoragePhase storagePhase(TupleReader t) {
        return new StoragePhase(t.longValue(0), t.nullableLong(1), statusChange(t.intValue(2), t.recordHash()));
    }

    private static CreditPhase creditPhase(TupleReader t) {
        return new CreditPhase(t.nullableLong(0), t.longValue(1));
    }

    private static ComputePhase computePhase(TupleReader t) {
        int tag = t.intValue(0);
        if (tag == COMPUTE_SKIPPED) {
            TupleReader skipped = t.tuple(1, SKIPPED_ARITY, "skipped");
            return new SkippedComputePhase(skipped.intValue(0));
        }
        if (tag != COMPUTE_VM) {
            throw new MalformedPhaseException("Unknown compute phase tag " + tag, t.recordHash());
        }
        TupleReader vm = t.tuple(1, VM_ARITY, "vm");
        return new VmComputePhase(
                vm.bool(0),
                vm.bool(1),
                vm.bool(2),
                vm.longValue(3),
                vm.longValue(4),
                vm.longValue(5),
                vm.nullableLong(6),
                vm.intValue(7),
                vm.intValue(8),
                vm.nullableInt(9),
                vm.longValue(10),
                vm.text(11),
                vm.text(12));
    }

    private static ActionPhase actionPhase(TupleReader t) {
        if (t == null) {
            return null;
        }
        TupleReader msgSize = t.tuple(13, MSG_SIZE_ARITY, "tot_msg_size");
        return new ActionPhase(
                t.bool(0),
                t.bool(1),
                t.bool(2),
                statusChange(t.intValue(3), t.recordHash()),
                t.nullableLong(4),
                t.nullableLong(5),
                t.intValue(6),
                t.nullableInt(7),
                t.intValue(8),
                t.intValue(9),
                t.intValue(10),
                t.intValue(11),
                t.text(12),
                msgSize.longValue(0),
                msgSize.longValue(1));
    }

    static StatusChange statusChange(int code, String recordHash) {
        return switch (code) {
            case 0 -> StatusChange.UNCHANGED;
            case 1 -> StatusChange.FROZEN;
            case 2 -> StatusChange.DELETED;
            default -> throw new MalformedPhaseException("Unknown status change code " + code, recordHash);
        };
    }
}
