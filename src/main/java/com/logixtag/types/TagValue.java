package com.logixtag.types;

import com.logixtag.error.ErrorType;
import com.logixtag.error.TagCodecException;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.math.BigInteger;
import java.util.Locale;

/**
 * A typed value of one atomic tag member.
 */
public abstract class TagValue {

    public abstract AtomicKind getKind();
    public abstract String toText();
    public abstract boolean equals(Object obj);
    public abstract int hashCode();

    @Override
    public String toString() {
        return toText();
    }

    // Factory methods
    public static TagValue fromBool(boolean value) {
        return value ? BoolValue.TRUE : BoolValue.FALSE;
    }

    public static TagValue fromSint(byte value) {
        return new SintValue(value);
    }

    public static TagValue fromInt(short value) {
        return new IntValue(value);
    }

    public static TagValue fromDint(int value) {
        return new DintValue(value);
    }

    public static TagValue fromLint(long value) {
        return new LintValue(value);
    }

    public static TagValue fromReal(float value) {
        return new RealValue(value);
    }

    /**
     * Parses the textual form test cases use for a value of the given kind.
     * Bools accept {@code 1/0/true/false}, integer kinds accept decimal text and are
     * range checked, reals accept decimal and exponent notation.
     */
    public static TagValue parse(AtomicKind kind, String text) throws TagCodecException {
        if (text == null) {
            throw new TagCodecException(ErrorType.TYPE_MISMATCH, "Cannot parse null as " + kind.getTypeName());
        }
        var trimmed = text.trim();
        switch (kind) {
            case BOOL:
                switch (trimmed.toLowerCase(Locale.ROOT)) {
                    case "1":
                    case "true":
                        return BoolValue.TRUE;
                    case "0":
                    case "false":
                        return BoolValue.FALSE;
                    default:
                        throw new TagCodecException(ErrorType.TYPE_MISMATCH, null, -1, text,
                                "Not a BOOL value: '" + text + "'");
                }
            case SINT8:
            case INT16:
            case DINT32:
            case LINT64:
                return fromLong(kind, parseInteger(kind, trimmed));
            case REAL32:
                return new RealValue(parseReal(trimmed));
            default:
                throw new TagCodecException(ErrorType.UNSUPPORTED_TYPE, kind.getTypeName(),
                        "Values of " + kind.getTypeName() + " are not handled by the binary codec");
        }
    }

    private static long parseInteger(AtomicKind kind, String text) throws TagCodecException {
        BigInteger parsed;
        try {
            parsed = new BigInteger(text.startsWith("+") ? text.substring(1) : text);
        } catch (NumberFormatException e) {
            throw new TagCodecException(ErrorType.TYPE_MISMATCH, null, -1, text,
                    "Not an integer value for " + kind.getTypeName() + ": '" + text + "'");
        }
        if (parsed.compareTo(BigInteger.valueOf(kind.minValue())) < 0
                || parsed.compareTo(BigInteger.valueOf(kind.maxValue())) > 0) {
            throw new TagCodecException(ErrorType.VALUE_RANGE, null, -1, text,
                    "Value " + text + " is out of range for " + kind.getTypeName());
        }
        return parsed.longValue();
    }

    private static float parseReal(String text) throws TagCodecException {
        double parsed;
        try {
            parsed = Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new TagCodecException(ErrorType.TYPE_MISMATCH, null, -1, text,
                    "Not a REAL value: '" + text + "'");
        }
        float narrowed = (float) parsed;
        if ((Float.isInfinite(narrowed) && !Double.isInfinite(parsed)) || (narrowed == 0f && parsed != 0d)) {
            throw new TagCodecException(ErrorType.VALUE_RANGE, null, -1, text,
                    "Value " + text + " is out of range for REAL");
        }
        return narrowed;
    }

    private static TagValue fromLong(AtomicKind kind, long value) {
        switch (kind) {
            case SINT8: return new SintValue((byte) value);
            case INT16: return new IntValue((short) value);
            case DINT32: return new DintValue((int) value);
            case LINT64: return new LintValue(value);
            case BOOL: return fromBool(value != 0);
            default: throw new IllegalArgumentException("Not an integer kind: " + kind);
        }
    }

    /**
     * Converts this value into the given kind when it is exactly representable there.
     *
     * @throws TagCodecException {@code VALUE_RANGE} when the value does not fit the target kind,
     *                           {@code TYPE_MISMATCH} when the kinds are not convertible
     */
    public TagValue coerceTo(AtomicKind target) throws TagCodecException {
        if (getKind() == target) return this;
        if (target == AtomicKind.STR || getKind() == AtomicKind.STR) {
            throw mismatch(target);
        }
        if (this instanceof RealValue) {
            throw mismatch(target);
        }
        long integral = ((IntegralValue) this).asLong();
        if (target == AtomicKind.REAL32) {
            if (getKind() == AtomicKind.BOOL) throw mismatch(target);
            float asFloat = (float) integral;
            if ((long) asFloat != integral || integral == Long.MAX_VALUE) {
                throw new TagCodecException(ErrorType.VALUE_RANGE, null, -1, integral,
                        "Value " + integral + " cannot be represented exactly as REAL");
            }
            return new RealValue(asFloat);
        }
        if (integral < target.minValue() || integral > target.maxValue()) {
            throw new TagCodecException(ErrorType.VALUE_RANGE, null, -1, integral,
                    "Value " + integral + " is out of range for " + target.getTypeName());
        }
        return fromLong(target, integral);
    }

    private TagCodecException mismatch(AtomicKind target) {
        return new TagCodecException(ErrorType.TYPE_MISMATCH, null, -1, this,
                getKind().getTypeName() + " value " + toText() + " cannot be stored as " + target.getTypeName());
    }

    /**
     * Values that are stored as two's-complement integers (bools count as 0/1).
     */
    public abstract static class IntegralValue extends TagValue {
        public abstract long asLong();
    }

    // Bool Value
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static class BoolValue extends IntegralValue {
        static final BoolValue TRUE = new BoolValue(true);
        static final BoolValue FALSE = new BoolValue(false);

        private final boolean value;

        private BoolValue(boolean value) {
            this.value = value;
        }

        public boolean getValue() { return value; }

        @Override
        public long asLong() { return value ? 1 : 0; }

        @Override
        public AtomicKind getKind() { return AtomicKind.BOOL; }

        @Override
        public String toText() {
            return value ? "1" : "0";
        }
    }

    // Sint Value
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static class SintValue extends IntegralValue {
        private final byte value;

        public SintValue(byte value) {
            this.value = value;
        }

        @Override
        public long asLong() { return value; }

        @Override
        public AtomicKind getKind() { return AtomicKind.SINT8; }

        @Override
        public String toText() {
            return String.valueOf(value);
        }
    }

    // Int Value
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static class IntValue extends IntegralValue {
        private final short value;

        public IntValue(short value) {
            this.value = value;
        }

        @Override
        public long asLong() { return value; }

        @Override
        public AtomicKind getKind() { return AtomicKind.INT16; }

        @Override
        public String toText() {
            return String.valueOf(value);
        }
    }

    // Dint Value
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static class DintValue extends IntegralValue {
        private final int value;

        public DintValue(int value) {
            this.value = value;
        }

        @Override
        public long asLong() { return value; }

        @Override
        public AtomicKind getKind() { return AtomicKind.DINT32; }

        @Override
        public String toText() {
            return String.valueOf(value);
        }
    }

    // Lint Value
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static class LintValue extends IntegralValue {
        private final long value;

        public LintValue(long value) {
            this.value = value;
        }

        @Override
        public long asLong() { return value; }

        @Override
        public AtomicKind getKind() { return AtomicKind.LINT64; }

        @Override
        public String toText() {
            return String.valueOf(value);
        }
    }

    // Real Value
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static class RealValue extends TagValue {
        private final float value;

        public RealValue(float value) {
            this.value = value;
        }

        @Override
        public AtomicKind getKind() { return AtomicKind.REAL32; }

        @Override
        public String toText() {
            return String.valueOf(value);
        }
    }
}
