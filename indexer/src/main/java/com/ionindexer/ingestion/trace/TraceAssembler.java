package com.ionindexer.ingestion.trace;

import com.ionindexer.domain.ClassificationState;
import com.ionindexer.domain.Message;
import com.ionindexer.domain.Trace;
import com.ionindexer.domain.TraceEdge;
import com.ionindexer.domain.TraceState;
import com.ionindexer.domain.Transaction;
import com.ionindexer.ingestion.config.TraceProperties;
import com.ionindexer.ingestion.decoder.TransactionDecoder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rebuilds a trace from its root: decodes the root record, then follows every outbound message to the
 * transaction it created. The lookup table maps a hash (root transaction hash or message hash) to the raw
 * record of the transaction that hash identifies.
 * <p>
 * Walks with an explicit stack so deep traces do not consume call stack; size is bounded by
 * {@link TraceProperties#getMaxTransactions()}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TraceAssembler {

    private final TransactionDecoder transactionDecoder;
    private final TraceProperties traceProperties;

    /**
     * @param traceId  root transaction hash
     * @param records  read-only lookup of raw transaction records by hash
     * @return complete, unclassified trace
     * @throws MissingTransactionException when a referenced transaction is not in {@code records}
     * @throws TraceAssemblyException      on cycles, linkage mismatch or oversized traces
     * @throws com.ionindexer.ingestion.decoder.DecodeException when a record is malformed
     */
    public Trace assemble(String traceId, Map<String, byte[]> records) {
        byte[] rootRecord = records.get(traceId);
        if (rootRecord == null) {
            throw new MissingTransactionException(traceId, traceId, null);
        }
        Transaction root = transactionDecoder.decode(rootRecord);

        List<Transaction> transactions = new ArrayList<>();
        List<TraceEdge> edges = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        transactions.add(root);
        seen.add(root.hash());

        Deque<Transaction> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            Transaction parent = pending.pop();
            for (Message out : parent.outMessages()) {
                Transaction child = loadChild(traceId, parent, out, records);
                if (!seen.add(child.hash())) {
                    throw new TraceAssemblyException(traceId, "transaction " + child.hash() + " reached twice");
                }
                if (transactions.size() >= traceProperties.getMaxTransactions()) {
                    throw new TraceAssemblyException(traceId,
                            "exceeds " + traceProperties.getMaxTransactions() + " transactions");
                }
                edges.add(new TraceEdge(parent.hash(), child.hash(), out.msgHash(), traceId));
                transactions.add(child);
                pending.push(child);
            }
        }
        log.debug("Assembled trace {}: {} transactions, {} edges", traceId, transactions.size(), edges.size());
        return new Trace(traceId, transactions, edges, ClassificationState.UNCLASSIFIED, TraceState.COMPLETE);
    }

    private Transaction loadChild(String traceId, Transaction parent, Message out, Map<String, byte[]> records) {
        byte[] record = records.get(out.msgHash());
        if (record == null) {
            throw new MissingTransactionException(traceId, out.msgHash(), parent.hash());
        }
        Transaction child = transactionDecoder.decode(record);
        String inHash = child.inMessage().msgHash();
        if (!out.msgHash().equals(inHash)) {
            throw new TraceAssemblyException(traceId, "message " + out.msgHash() + " of " + parent.hash()
                    + " resolved to " + child.hash() + " whose inbound message is " + inHash);
        }
        return child;
    }
}
