package com.ionindexer.ingestion.decoder;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Strict positional access to one MessagePack array decoded as a Jackson tree.
 * Every accessor fails with {@link DecodeException} instead of defaulting.
 */
final class TupleReader {

    private final JsonNode node;
    private final String name;
    private final String recordHash;

    private TupleReader(JsonNode node, String name, String recordHash) {
        this.node = node;
        this.name = name;
        this.recordHash = recordHash;
    }

    /**
     * Wraps {@code node}, requiring it to be an array of exactly {@code arity} elements.
     */
    static TupleReader of(JsonNode node, int arity, String name, String recordHash) {
        if (node == null || !node.isArray()) {
            throw new DecodeException(name + ": expected array, got " + describe(node), recordHash);
        }
        if (node.size() != arity) {
            throw new DecodeException(name + ": expected " + arity + " elements, got " + node.size(), recordHash);
        }
        return new TupleReader(node, name, recordHash);
    }

    TupleReader tuple(int index, int arity, String childName) {
        return of(element(index), arity, name + "." + childName, recordHash);
    }

    /** Same as {@link #tuple} but returns null for a nil element. */
    TupleReader nullableTuple(int index, int arity, String childName) {
        JsonNode value = element(index);
        return value.isNull() ? null : of(value, arity, name + "." + childName, recordHash);
    }

    /** Variable-length array of nodes. */
    List<JsonNode> list(int index) {
        JsonNode value = element(index);
        if (!value.isArray()) {
            throw fail(index, "array", value);
        }
        List<JsonNode> out = new ArrayList<>(value.size());
        value.forEach(out::add);
        return out;
    }

    JsonNode raw(int index) {
        return element(index);
    }

    /**
     * Text field. MessagePack {@code bin} values are rendered as standard base64.
     */
    String text(int index) {
        String value = nullableText(index);
        if (value == null) {
            throw fail(index, "string", element(index));
        }
        return value;
    }

    String nullableText(int index) {
        JsonNode value = element(index);
        if (value.isNull()) {
            return null;
        }
        if (value.isTextual()) {
            return value.textValue();
        }
        if (value.isBinary()) {
            try {
                return Base64.getEncoder().encodeToString(value.binaryValue());
            } catch (IOException e) {
                throw new DecodeException(name + "[" + index + "]: unreadable binary", recordHash, e);
            }
        }
        throw fail(index, "string", value);
    }

    long longValue(int index) {
        Long value = nullableLong(index);
        if (value == null) {
            throw fail(index, "integer", element(index));
        }
        return value;
    }

    Long nullableLong(int index) {
        JsonNode value = element(index);
        if (value.isNull()) {
            return null;
        }
        if (!value.isIntegralNumber() || !value.canConvertToLong()) {
            throw fail(index, "64-bit integer", value);
        }
        return value.longValue();
    }

    int intValue(int index) {
        Integer value = nullableInt(index);
        if (value == null) {
            throw fail(index, "integer", element(index));
        }
        return value;
    }

    Integer nullableInt(int index) {
        JsonNode value = element(index);
        if (value.isNull()) {
            return null;
        }
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw fail(index, "32-bit integer", value);
        }
        return value.intValue();
    }

    boolean bool(int index) {
        Boolean value = nullableBool(index);
        if (value == null) {
            throw fail(index, "boolean", element(index));
        }
        return value;
    }

    Boolean nullableBool(int index) {
        JsonNode value = element(index);
        if (value.isNull()) {
            return null;
        }
        if (!value.isBoolean()) {
            throw fail(index, "boolean", value);
        }
        return value.booleanValue();
    }

    String recordHash() {
        return recordHash;
    }

    private JsonNode element(int index) {
        return node.get(index);
    }

    private DecodeException fail(int index, String expected, JsonNode actual) {
        return new DecodeException(name + "[" + index + "]: expected " + expected + ", got " + describe(actual), recordHash);
    }

    private static String describe(JsonNode node) {
        return node == null ? "nothing" : node.getNodeType().name().toLowerCase();
    }
}
