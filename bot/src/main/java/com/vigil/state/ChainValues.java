package com.vigil.state;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;
import java.util.Map;

/**
 * Normalizes the several encodings the chain uses for the same logical value.
 *
 * <p>Observed shapes:
 * <ul>
 *   <li>integers as JSON numbers, decimal strings or {@code 0x} hex strings</li>
 *   <li>booleans as JSON booleans, {@code 0/1}, {@code "0x0"/"0x1"}, {@code "true"}, or Cairo
 *       enums: {@code {"True":{}}}, {@code {"variant":{"True":{},"False":null}}},
 *       {@code {"activeVariant":"True"}}</li>
 *   <li>enums (tier, slot, item type) as plain strings, numeric indices or the same
 *       Cairo enum objects</li>
 * </ul>
 * Anything unparseable degrades to zero / false / "None" instead of throwing.
 */
public final class ChainValues {

    public static final String NONE = "None";

    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private ChainValues() {
    }

    // ========================================================================
    // Numbers
    // ========================================================================

    public static long toLong(JsonElement value) {
        if (value == null || value.isJsonNull()) {
            return 0;
        }
        if (value.isJsonPrimitive()) {
            return primitiveToLong(value.getAsJsonPrimitive());
        }
        if (value.isJsonObject()) {
            // Some encoders wrap u256/u128 as {"low": .., "high": ..}
            JsonObject object = value.getAsJsonObject();
            if (object.has("low")) {
                return toLong(object.get("low"));
            }
        }
        return 0;
    }

    public static int toInt(JsonElement value) {
        long parsed = toLong(value);
        if (parsed > Integer.MAX_VALUE) {
            return Integer.MAX_VALUE;
        }
        if (parsed < Integer.MIN_VALUE) {
            return Integer.MIN_VALUE;
        }
        return (int) parsed;
    }

    public static int toInt(JsonObject parent, String key) {
        return parent == null ? 0 : toInt(parent.get(key));
    }

    public static long toLong(JsonObject parent, String key) {
        return parent == null ? 0 : toLong(parent.get(key));
    }

    /**
     * Parse a decimal or {@code 0x} hex string. Returns 0 for anything else.
     */
    public static long parseNumeric(String raw) {
        if (raw == null) {
            return 0;
        }
        String text = raw.trim();
        if (text.isEmpty()) {
            return 0;
        }
        try {
            if (text.startsWith("0x") || text.startsWith("0X")) {
                if (text.length() == 2) {
                    return 0;
                }
                return clampToLong(new BigInteger(text.substring(2), 16));
            }
            return clampToLong(new BigDecimal(text).toBigInteger());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static long primitiveToLong(JsonPrimitive primitive) {
        if (primitive.isBoolean()) {
            return primitive.getAsBoolean() ? 1 : 0;
        }
        if (primitive.isNumber()) {
            try {
                return clampToLong(primitive.getAsBigDecimal().toBigInteger());
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return parseNumeric(primitive.getAsString());
    }

    private static long clampToLong(BigInteger value) {
        if (value.compareTo(LONG_MAX) > 0) {
            return Long.MAX_VALUE;
        }
        if (value.signum() < 0 && value.compareTo(BigInteger.valueOf(Long.MIN_VALUE)) < 0) {
            return Long.MIN_VALUE;
        }
        return value.longValue();
    }

    // ========================================================================
    // Booleans
    // ========================================================================

    public static boolean toBoolean(JsonElement value) {
        if (value == null || value.isJsonNull()) {
            return false;
        }
        if (value.isJsonPrimitive()) {
            JsonPrimitive primitive = value.getAsJsonPrimitive();
            if (primitive.isBoolean()) {
                return primitive.getAsBoolean();
            }
            if (primitive.isNumber()) {
                return toLong(primitive) != 0;
            }
            String text = primitive.getAsString().trim().toLowerCase(Locale.ROOT);
            if (text.equals("true")) {
                return true;
            }
            if (text.equals("false") || text.isEmpty()) {
                return false;
            }
            return parseNumeric(text) != 0;
        }
        if (value.isJsonObject()) {
            return "true".equalsIgnoreCase(enumKey(value));
        }
        return false;
    }

    // ========================================================================
    // Enums
    // ========================================================================

    /**
     * Name of the active variant of an enum-like value, or {@value #NONE}.
     */
    public static String enumKey(JsonElement value) {
        if (value == null || value.isJsonNull()) {
            return NONE;
        }
        if (value.isJsonPrimitive()) {
            String text = value.getAsString().trim();
            return text.isEmpty() ? NONE : text;
        }
        if (!value.isJsonObject()) {
            return NONE;
        }
        JsonObject object = value.getAsJsonObject();

        JsonElement variant = object.get("variant");
        if (variant != null && variant.isJsonObject()) {
            for (Map.Entry<String, JsonElement> entry : variant.getAsJsonObject().entrySet()) {
                if (entry.getValue() != null && !entry.getValue().isJsonNull()) {
                    return entry.getKey();
                }
            }
        }

        JsonElement active = object.get("activeVariant");
        if (active != null && active.isJsonPrimitive()) {
            String name = active.getAsString().trim();
            if (!name.isEmpty()) {
                return name;
            }
        }

        for (Map.Entry<String, JsonElement> entry : object.entrySet()) {
            if (!"variant".equals(entry.getKey()) && !"activeVariant".equals(entry.getKey())) {
                return entry.getKey();
            }
        }
        return NONE;
    }

    /**
     * Item tier from "T1".."T5", "1".."5" or a Cairo enum. 0 when unknown.
     */
    public static int toTier(JsonElement value) {
        String key = enumKey(value).toUpperCase(Locale.ROOT);
        if (key.startsWith("T")) {
            key = key.substring(1);
        }
        long tier = parseNumeric(key);
        return tier >= 1 && tier <= 5 ? (int) tier : 0;
    }
}
