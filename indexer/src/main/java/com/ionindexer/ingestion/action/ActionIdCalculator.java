package com.ionindexer.ingestion.action;

import com.ionindexer.domain.block.Block;
import com.ionindexer.domain.block.EventNode;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.Comparator;

/**
 * Deterministic action identity: base64(SHA-256(key || btype)), where key is the originating message hash of the
 * block's earliest event node, or that node's transaction hash when it has no message.
 * Re-indexing the same block yields the same id.
 */
public final class ActionIdCalculator {

    private ActionIdCalculator() {
    }

    public static String actionId(Block block) {
        EventNode root = block.getEventNodes().stream()
                .min(Comparator.comparingLong(EventNode::lt))
                .orElseThrow(() -> new ActionExtractionException(block.getBtype(), "block has no event nodes"));
        String key = root.hasMessage() ? root.msgHash() : root.txHash();
        return actionId(key, block.getBtype());
    }

    static String actionId(String key, String btype) {
        byte[] digest = sha256().digest((key + btype).getBytes(StandardCharsets.UTF_8));
        return Base64.getEncoder().encodeToString(digest);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
