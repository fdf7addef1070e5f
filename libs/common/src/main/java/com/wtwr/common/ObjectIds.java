package com.wtwr.common;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Document identifiers: 12 bytes rendered as 24 lowercase hexadecimal characters, the first
 * four bytes being the creation time in epoch seconds.
 */
public final class ObjectIds {

    private static final Pattern FORMAT = Pattern.compile("^[0-9a-fA-F]{24}$");
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final HexFormat HEX = HexFormat.of();

    private ObjectIds() {
        // utility class
    }

    /** True if the value is exactly 24 hexadecimal characters. */
    public static boolean isValid(String value) {
        return value != null && FORMAT.matcher(value).matches();
    }

    /** Generates a new identifier stamped with the current time. */
    public static String generate() {
        return generate(Instant.now());
    }

    static String generate(Instant now) {
        byte[] bytes = new byte[12];
        int seconds = (int) now.getEpochSecond();
        bytes[0] = (byte) (seconds >>> 24);
        bytes[1] = (byte) (seconds >>> 16);
        bytes[2] = (byte) (seconds >>> 8);
        bytes[3] = (byte) seconds;
        byte[] tail = new byte[8];
        RANDOM.nextBytes(tail);
        System.arraycopy(tail, 0, bytes, 4, tail.length);
        return HEX.formatHex(bytes);
    }
}
