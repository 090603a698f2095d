package im.arun.tiki.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Typed value of an inline metadata entry such as {@code [mastery: 85%]}.
 *
 * <p>The set of kinds is closed; every value carries exactly one of them.
 */
@Getter
@EqualsAndHashCode
public final class MetadataValue {

    public enum Kind {
        STRING,
        INTEGER,
        FLOAT,
        BOOLEAN,
        REFERENCE
    }

    private static final String REFERENCE_PREFIX = "*";

    private final Kind kind;
    private final Object value;

    private MetadataValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = Objects.requireNonNull(value, "value");
    }

    public static MetadataValue ofString(String value) {
        return new MetadataValue(Kind.STRING, value);
    }

    public static MetadataValue ofInteger(long value) {
        return new MetadataValue(Kind.INTEGER, value);
    }

    public static MetadataValue ofFloat(double value) {
        return new MetadataValue(Kind.FLOAT, value);
    }

    public static MetadataValue ofBoolean(boolean value) {
        return new MetadataValue(Kind.BOOLEAN, value);
    }

    /**
     * A cross-reference to another concept id, e.g. {@code *1**2}. Stored as an opaque string.
     */
    public static MetadataValue ofReference(String target) {
        if (!target.startsWith(REFERENCE_PREFIX)) {
            throw new IllegalArgumentException("Reference must start with '*': " + target);
        }
        return new MetadataValue(Kind.REFERENCE, target);
    }

    /**
     * Rebuilds a value from its JSON form. Strings beginning with {@code *} are references.
     */
    public static MetadataValue fromJson(Object raw) {
        if (raw instanceof Boolean) {
            return ofBoolean((Boolean) raw);
        }
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof BigInteger) {
            return ofInteger(((Number) raw).longValue());
        }
        if (raw instanceof Double || raw instanceof Float || raw instanceof BigDecimal) {
            return ofFloat(((Number) raw).doubleValue());
        }
        if (raw instanceof String) {
            String text = (String) raw;
            return text.startsWith(REFERENCE_PREFIX) ? ofReference(text) : ofString(text);
        }
        throw new IllegalArgumentException("Unsupported metadata value: " + raw);
    }

    public String asString() {
        requireKind(Kind.STRING, Kind.REFERENCE);
        return (String) value;
    }

    public long asInteger() {
        requireKind(Kind.INTEGER);
        return (Long) value;
    }

    public double asFloat() {
        requireKind(Kind.FLOAT);
        return (Double) value;
    }

    public boolean asBoolean() {
        requireKind(Kind.BOOLEAN);
        return (Boolean) value;
    }

    @JsonValue
    public Object toJsonValue() {
        return value;
    }

    private void requireKind(Kind... allowed) {
        for (Kind k : allowed) {
            if (kind == k) {
                return;
            }
        }
        throw new IllegalStateException("Metadata value is " + kind + ", not " + allowed[0]);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
