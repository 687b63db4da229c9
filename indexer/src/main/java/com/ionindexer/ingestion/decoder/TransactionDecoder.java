package com.ionindexer.ingestion.decoder;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ionindexer.domain.AccountStatus;
import com.ionindexer.domain.Message;
import com.ionindexer.domain.MessageContent;
import com.ionindexer.domain.MessageDirection;
import com.ionindexer.domain.Transaction;
import com.ionindexer.domain.TransactionDescription;
import com.ionindexer.ingestion.config.IndexerCoreConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Decodes one MessagePack transaction record {@code (transaction_tuple, emulated)} into a {@link Transaction}.
 * Phase decoding is delegated to {@link TransactionDescriptionDecoder}.
 */
@Component
@Slf4j
public class TransactionDecoder {

    static final int RECORD_ARITY = 2;
    static final int TRANSACTION_ARITY = 14;
    static final int MESSAGE_ARITY = 15;

    private static final AccountStatus[] ACCOUNT_STATUSES = {
            AccountStatus.UNINIT, AccountStatus.FROZEN, AccountStatus.ACTIVE, AccountStatus.NONEXIST
    };

    private final ObjectMapper msgpackMapper;
    private final TransactionDescriptionDecoder descriptionDecoder;

    public TransactionDecoder(@Qualifier(IndexerCoreConfig.MSGPACK_OBJECT_MAPPER) ObjectMapper msgpackMapper,
                              TransactionDescriptionDecoder descriptionDecoder) {
        this.msgpackMapper = msgpackMapper;
        this.descriptionDecoder = descriptionDecoder;
    }

    /**
     * @param data raw record bytes
     * @return decoded transaction with its messages (outbound first, inbound last)
     * @throws DecodeException when the record does not match the expected layout
     */
    public Transaction decode(byte[] data) {
        JsonNode root = parse(data);
        String hash = peekHash(root);
        TupleReader record = TupleReader.of(root, RECORD_ARITY, "record", hash);
        TupleReader tx = record.tuple(0, TRANSACTION_ARITY, "transaction");
        boolean emulated = record.bool(1);

        String txHash = tx.text(0);
        long lt = tx.longValue(2);
        TransactionDescription description = descriptionDecoder.decode(tx.raw(13), txHash);

        List<JsonNode> outMsgs = tx.list(9);
        List<Message> messages = new ArrayList<>(outMsgs.size() + 1);
        for (int i = 0; i < outMsgs.size(); i++) {
            messages.add(message(TupleReader.of(outMsgs.get(i), MESSAGE_ARITY, "out_msgs[" + i + "]", txHash),
                    txHash, lt, MessageDirection.OUT));
        }
        messages.add(message(tx.tuple(8, MESSAGE_ARITY, "in_msg"), txHash, lt, MessageDirection.IN));

        return new Transaction(
                txHash,
                lt,
                tx.text(1),
                tx.text(3),
                tx.longValue(4),
                tx.longValue(5),
                accountStatus(tx.intValue(6), txHash),
                accountStatus(tx.intValue(7), txHash),
                tx.longValue(10),
                tx.text(11),
                tx.text(12),
                emulated,
                description,
                messages);
    }

    static AccountStatus accountStatus(int code, String recordHash) {
        if (code < 0 || code >= ACCOUNT_STATUSES.length) {
            throw new DecodeException("Unknown account status code " + code, recordHash);
        }
        return ACCOUNT_STATUSES[code];
    }

    private static Message message(TupleReader m, String txHash, long txLt, MessageDirection direction) {
        String initState = m.nullableText(14);
        String body = m.nullableText(13);
        return new Message(
                m.text(0),
                txHash,
                txLt,
                direction,
                m.nullableText(1),
                m.nullableText(2),
                m.nullableLong(3),
                m.nullableLong(4),
                m.nullableLong(5),
                m.nullableLong(6),
                m.nullableLong(7),
                m.nullableLong(8),
                m.nullableBool(9),
                m.nullableBool(10),
                m.nullableBool(11),
                m.nullableLong(12),
                body != null ? new MessageContent(body) : null,
                initState != null ? new MessageContent(initState) : null);
    }

    private JsonNode parse(byte[] data) {
        if (data == null || data.length == 0) {
            throw new DecodeException("Empty transaction record", null);
        }
        try {
            return msgpackMapper.readTree(data);
        } catch (IOException e) {
            throw new DecodeException("Unreadable transaction record: " + e.getMessage(), null, e);
        }
    }

    /** Best-effort read of the transaction hash so that layout errors can name the record. */
    private static String peekHash(JsonNode root) {
        JsonNode hash = root.path(0).path(0);
        if (hash.isTextual()) {
            return hash.textValue();
        }
        if (hash.isBinary()) {
            try {
                return Base64.getEncoder().encodeToString(hash.binaryValue());
            } catch (IOException e) {
                log.debug("Unreadable binary transaction hash: {}", e.getMessage());
            }
        }
        return null;
    }
}
