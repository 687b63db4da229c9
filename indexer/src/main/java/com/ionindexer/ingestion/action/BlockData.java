package com.ionindexer.ingestion.action;

import com.ionindexer.domain.block.AccountId;
import com.ionindexer.domain.block.Amount;
import com.ionindexer.domain.block.Asset;
import com.ionindexer.domain.block.Block;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;

/**
 * Typed reader over a block's loosely-typed payload map. Three access modes per key:
 * <ul>
 *     <li>required ({@code account}, {@code amount}, ...): key present and value non-null</li>
 *     <li>nullable ({@code nullableAccount}, ...): key present, value may be null</li>
 *     <li>optional ({@code optionalAccount}, ...): key may be absent; absent reads as null</li>
 * </ul>
 * A missing key raises {@link MissingRequiredFieldException}; a value of the wrong type raises
 * {@link ActionExtractionException}. Nested objects are maps and are read through {@link #nested}.
 */
public final class BlockData {

    private final Map<String, ?> values;
    private final String btype;
    private final String path;

    private BlockData(Map<String, ?> values, String btype, String path) {
        this.values = values;
        this.btype = btype;
        this.path = path;
    }

    public static BlockData of(Block block) {
        Map<String, Object> data = block.getData();
        return new BlockData(data != null ? data : Map.of(), block.getBtype(), "");
    }

    public boolean has(String key) {
        return values.containsKey(key);
    }

    public AccountId account(String key) {
        return required(key, AccountId.class);
    }

    public AccountId nullableAccount(String key) {
        return nullable(key, AccountId.class);
    }

    public AccountId optionalAccount(String key) {
        return has(key) ? nullableAccount(key) : null;
    }

    public Amount amount(String key) {
        return required(key, Amount.class);
    }

    public Amount nullableAmount(String key) {
        return nullable(key, Amount.class);
    }

    public Amount optionalAmount(String key) {
        return has(key) ? nullableAmount(key) : null;
    }

    public Asset asset(String key) {
        return required(key, Asset.class);
    }

    public Asset nullableAsset(String key) {
        return nullable(key, Asset.class);
    }

    public String string(String key) {
        return required(key, String.class);
    }

    public String nullableString(String key) {
        return nullable(key, String.class);
    }

    public boolean bool(String key) {
        return required(key, Boolean.class);
    }

    public Integer nullableInt(String key) {
        BigInteger n = nullableBigInteger(key);
        if (n == null) {
            return null;
        }
        try {
            return n.intValueExact();
        } catch (ArithmeticException e) {
            throw new ActionExtractionException(btype, "field '" + path + key + "' out of 32-bit range: " + n);
        }
    }

    public Long nullableLong(String key) {
        BigInteger n = nullableBigInteger(key);
        if (n == null) {
            return null;
        }
        try {
            return n.longValueExact();
        } catch (ArithmeticException e) {
            throw new ActionExtractionException(btype, "field '" + path + key + "' out of 64-bit range: " + n);
        }
    }

    /**
     * Integral number of any width. Fractional numbers ({@code Double}, {@code BigDecimal}, ...) are rejected.
     */
    public BigInteger nullableBigInteger(String key) {
        Number n = nullable(key, Number.class);
        if (n == null) {
            return null;
        }
        if (n instanceof BigInteger big) {
            return big;
        }
        if (n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte) {
            return BigInteger.valueOf(n.longValue());
        }
        throw wrongType(key, BigInteger.class, n);
    }

    public byte[] bytes(String key) {
        byte[] value = nullableBytes(key);
        if (value == null) {
            throw new MissingRequiredFieldException(btype, path + key);
        }
        return value;
    }

    /**
     * Raw bytes; a string value is taken as its UTF-8 encoding.
     */
    public byte[] nullableBytes(String key) {
        Object value = nullable(key, Object.class);
        if (value == null) {
            return null;
        }
        if (value instanceof byte[] b) {
            return b;
        }
        if (value instanceof String s) {
            return s.getBytes(StandardCharsets.UTF_8);
        }
        throw wrongType(key, byte[].class, value);
    }

    /**
     * Serialized cell payload as a string; raw bytes are rendered as base64.
     */
    public String nullablePayload(String key) {
        Object value = nullable(key, Object.class);
        if (value == null) {
            return null;
        }
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof byte[] b) {
            return Base64.getEncoder().encodeToString(b);
        }
        throw wrongType(key, String.class, value);
    }

    public BlockData nested(String key) {
        return wrap(key, required(key, Map.class));
    }

    public BlockData nullableNested(String key) {
        Map<?, ?> value = nullable(key, Map.class);
        return value == null ? null : wrap(key, value);
    }

    @SuppressWarnings("unchecked")
    private BlockData wrap(String key, Map<?, ?> value) {
        return new BlockData((Map<String, ?>) value, btype, path + key + ".");
    }

    private <T> T required(String key, Class<T> type) {
        T value = nullable(key, type);
        if (value == null) {
            throw new MissingRequiredFieldException(btype, path + key);
        }
        return value;
    }

    private <T> T nullable(String key, Class<T> type) {
        if (!values.containsKey(key)) {
            throw new MissingRequiredFieldException(btype, path + key);
        }
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        if (!type.isInstance(value)) {
            throw wrongType(key, type, value);
        }
        return type.cast(value);
    }

    private ActionExtractionException wrongType(String key, Class<?> expected, Object actual) {
        return new ActionExtractionException(btype, "field '" + path + key + "' expected "
                + expected.getSimpleName() + ", got " + actual.getClass().getSimpleName());
    }
}
