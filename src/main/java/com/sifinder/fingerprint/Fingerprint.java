package com.sifinder.fingerprint;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Fixed-width 64-bit perceptual fingerprint. The canonical serialized form is 16 lowercase hex
 * digits, most significant bit first.
 */
public record Fingerprint(long bits) {
    public static final int BITS = Long.SIZE;
    private static final int HEX_LENGTH = BITS / 4;
    private static final Pattern HEX = Pattern.compile("[0-9a-fA-F]{" + HEX_LENGTH + "}");

    public int distanceTo(Fingerprint other) {
        return Long.bitCount(bits ^ other.bits);
    }

    public String toHex() {
        return String.format(Locale.ROOT, "%016x", bits);
    }

    public static Fingerprint fromHex(String hex) {
        if (hex == null || !HEX.matcher(hex).matches()) {
            throw new IllegalArgumentException("Fingerprint must be " + HEX_LENGTH + " hex digits: " + hex);
        }
        return new Fingerprint(Long.parseUnsignedLong(hex, 16));
    }

    @Override
    public String toString() {
        return toHex();
    }
}
