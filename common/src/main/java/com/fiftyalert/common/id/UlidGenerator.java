package com.fiftyalert.common.id;

import java.security.SecureRandom;
import java.time.Clock;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Generates ULIDs, used as dispatch run ids so log lines of one run sort together.
 * Format: 10-char timestamp (48-bit ms since epoch) + 16-char randomness (80-bit),
 * Crockford Base32.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class UlidGenerator {

    private static final char[] ENCODING = "0123456789ABCDEFGHJKMNPQRSTVWXYZ".toCharArray();
    private static final int TIMESTAMP_CHARS = 10;
    private static final int RANDOM_CHARS = 16;
    private static final SecureRandom RANDOM = new SecureRandom();

    public static String generate() {
        return generate(Clock.systemUTC());
    }

    public static String generate(Clock clock) {
        byte[] randomness = new byte[10];
        RANDOM.nextBytes(randomness);
        return encode(clock.millis(), randomness);
    }

    static String encode(long timestamp, byte[] randomness) {
        var chars = new char[TIMESTAMP_CHARS + RANDOM_CHARS];
        for (int i = TIMESTAMP_CHARS - 1; i >= 0; i--) {
            chars[i] = ENCODING[(int) (timestamp & 0x1F)];
            timestamp >>>= 5;
        }
        // 80 random bits, consumed 5 at a time from the most significant end
        int buffer = 0;
        int bits = 0;
        int next = TIMESTAMP_CHARS;
        for (byte b : randomness) {
            buffer = (buffer << 8) | (b & 0xFF);
            bits += 8;
            while (bits >= 5) {
                bits -= 5;
                chars[next++] = ENCODING[(buffer >>> bits) & 0x1F];
            }
        }
        return new String(chars);
    }
}
