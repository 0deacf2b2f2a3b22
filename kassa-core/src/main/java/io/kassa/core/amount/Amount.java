package io.kassa.core.amount;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Currency-tagged fixed-point amount. {@code fraction} is in units of 1/{@link #FRACTION_BASE}
 * and always kept below the base; {@code value} never exceeds {@link #MAX_VALUE}.
 */
public record Amount(String currency, long value, int fraction) implements Comparable<Amount> {
    public static final int FRACTION_BASE = 100_000_000;
    public static final int FRACTION_DIGITS = 8;
    public static final long MAX_VALUE = 1L << 52;
    public static final int CURRENCY_LENGTH = 12;
    public static final int NBO_SIZE = 8 + 4 + CURRENCY_LENGTH;

    public Amount {
        Objects.requireNonNull(currency, "currency must not be null");
        if (currency.isBlank() || currency.length() >= CURRENCY_LENGTH) {
            throw new AmountFormatException(currency);
        }
        if (value < 0 || fraction < 0) {
            throw new AmountFormatException(currency + ":" + value + "." + fraction);
        }
        if (fraction >= FRACTION_BASE) {
            value += fraction / FRACTION_BASE;
            fraction = fraction % FRACTION_BASE;
        }
        if (value > MAX_VALUE) {
            throw new AmountOverflowException("amount value exceeds " + MAX_VALUE);
        }
        currency = currency.toUpperCase(Locale.ROOT);
    }

    public static Amount zero(String currency) {
        return new Amount(currency, 0, 0);
    }

    @JsonCreator
    public static Amount parse(String raw) {
        if (raw == null) {
            throw new AmountFormatException("null");
        }
        int colon = raw.indexOf(':');
        if (colon <= 0 || colon == raw.length() - 1) {
            throw new AmountFormatException(raw);
        }
        String currency = raw.substring(0, colon);
        String number = raw.substring(colon + 1);
        int dot = number.indexOf('.');
        String whole = dot < 0 ? number : number.substring(0, dot);
        String frac = dot < 0 ? "" : number.substring(dot + 1);
        if (whole.isEmpty() || !digitsOnly(whole) || !digitsOnly(frac)
            || (dot >= 0 && frac.isEmpty()) || frac.length() > FRACTION_DIGITS) {
            throw new AmountFormatException(raw);
        }
        long value;
        try {
            value = Long.parseLong(whole);
        } catch (NumberFormatException e) {
            throw new AmountOverflowException("amount value too large: " + raw);
        }
        int fraction = 0;
        int scale = FRACTION_BASE / 10;
        for (int i = 0; i < frac.length(); i++) {
            fraction += (frac.charAt(i) - '0') * scale;
            scale /= 10;
        }
        return new Amount(currency, value, fraction);
    }

    public boolean isZero() {
        return value == 0 && fraction == 0;
    }

    public boolean sameCurrency(Amount other) {
        return currency.equals(other.currency);
    }

    public Amount add(Amount other) {
        requireSameCurrency(other);
        long sumValue = value + other.value;
        long sumFraction = (long) fraction + other.fraction;
        sumValue += sumFraction / FRACTION_BASE;
        if (sumValue > MAX_VALUE || sumValue < 0) {
            throw new AmountOverflowException("sum of " + this + " and " + other + " overflows");
        }
        return new Amount(currency, sumValue, (int) (sumFraction % FRACTION_BASE));
    }

    /**
     * Returns {@code this - other}, or empty when the result would be negative.
     */
    public Optional<Amount> subtract(Amount other) {
        requireSameCurrency(other);
        if (compareTo(other) < 0) {
            return Optional.empty();
        }
        long diffValue = value - other.value;
        int diffFraction = fraction - other.fraction;
        if (diffFraction < 0) {
            diffFraction += FRACTION_BASE;
            diffValue--;
        }
        return Optional.of(new Amount(currency, diffValue, diffFraction));
    }

    public Amount subtractOrZero(Amount other) {
        return subtract(other).orElseGet(() -> zero(currency));
    }

    /**
     * Divides by {@code divisor}, rounding down to the smallest fraction unit.
     */
    public Amount divide(int divisor) {
        if (divisor <= 0) {
            throw new IllegalArgumentException("divisor must be positive");
        }
        if (divisor == 1) {
            return this;
        }
        long remainder = value % divisor;
        long quotient = value / divisor;
        long scaled = remainder * FRACTION_BASE + fraction;
        return new Amount(currency, quotient, (int) (scaled / divisor));
    }

    @Override
    public int compareTo(Amount other) {
        requireSameCurrency(other);
        int byValue = Long.compare(value, other.value);
        return byValue != 0 ? byValue : Integer.compare(fraction, other.fraction);
    }

    public boolean greaterThan(Amount other) {
        return compareTo(other) > 0;
    }

    public boolean atLeast(Amount other) {
        return compareTo(other) >= 0;
    }

    /**
     * Network byte order form used inside signed payloads: value, fraction, NUL padded currency.
     */
    public byte[] toNbo() {
        ByteBuffer buffer = ByteBuffer.allocate(NBO_SIZE);
        buffer.putLong(value);
        buffer.putInt(fraction);
        byte[] name = currency.getBytes(StandardCharsets.US_ASCII);
        buffer.put(name);
        return buffer.array();
    }

    @JsonValue
    @Override
    public String toString() {
        if (fraction == 0) {
            return currency + ":" + value;
        }
        StringBuilder digits = new StringBuilder(String.valueOf(fraction + FRACTION_BASE).substring(1));
        while (digits.charAt(digits.length() - 1) == '0') {
            digits.setLength(digits.length() - 1);
        }
        return currency + ":" + value + "." + digits;
    }

    private void requireSameCurrency(Amount other) {
        Objects.requireNonNull(other, "other must not be null");
        if (!currency.equals(other.currency)) {
            throw new CurrencyMismatchException(currency, other.currency);
        }
    }

    private static boolean digitsOnly(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
