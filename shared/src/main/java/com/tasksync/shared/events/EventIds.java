package com.tasksync.shared.events;

import java.security.SecureRandom;
import java.time.Clock;

/**
 * ULID generator for event and task identifiers.
 *
 * Layout: 48-bit millisecond timestamp followed by 80 bits of randomness, encoded as
 * 26 Crockford base32 characters. Lexical order equals creation order. Ids minted in the
 * same millisecond by this JVM increment the random part, so they stay strictly ordered
 * within one command batch.
 */
public final class EventIds {

    private static final char[] ALPHABET = "0123456789ABCDEFGHJKMNPQRSTVWXYZ".toCharArray();
    private static final int LENGTH = 26;
    private static final long MAX_TIMESTAMP = (1L << 48) - 1;
    private static final long RANDOM_HIGH_MASK = 0xFFFFL;

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final EventIds INSTANCE = new EventIds(Clock.systemUTC());

    private final Clock clock;
    private long lastTimestamp = -1;
    private long randomHigh;
    private long randomLow;

    EventIds(Clock clock) {
        this.clock = clock;
    }

    public static String next() {
        return INSTANCE.nextId();
    }

    /**
     * Next id that sorts strictly after {@code floor}. Another process with a faster clock may
     * have written the floor; the generator then continues from it instead of from the local
     * clock, so ids appended to one stream keep increasing.
     */
    public static String nextAfter(String floor) {
        return INSTANCE.nextIdAfter(floor);
    }

    synchronized String nextId() {
        long now = clock.millis();
        if (now > MAX_TIMESTAMP) {
            throw new IllegalStateException("Clock beyond ULID range: " + now);
        }
        if (now <= lastTimestamp) {
            // same (or rewound) millisecond: keep the previous timestamp and increment
            randomLow++;
            if (randomLow == 0) {
                randomHigh = (randomHigh + 1) & RANDOM_HIGH_MASK;
                if (randomHigh == 0) {
                    throw new IllegalStateException("ULID random component overflow within one millisecond");
                }
            }
        } else {
            lastTimestamp = now;
            randomHigh = RANDOM.nextInt() & RANDOM_HIGH_MASK;
            randomLow = RANDOM.nextLong();
        }
        return encode(lastTimestamp, randomHigh, randomLow);
    }

    synchronized String nextIdAfter(String floor) {
        String candidate = nextId();
        if (floor == null || candidate.compareTo(floor) > 0) {
            return candidate;
        }
        if (!isValid(floor)) {
            throw new IllegalArgumentException("Not a ULID: " + floor);
        }
        long high = 0;
        long low = 0;
        for (int i = 10; i < LENGTH; i++) {
            high = ((high << 5) | (low >>> 59)) & RANDOM_HIGH_MASK;
            low = (low << 5) | indexOf(floor.charAt(i));
        }
        // the floor is at or ahead of the local clock, so nextId() increments from it
        lastTimestamp = timestampOf(floor);
        randomHigh = high;
        randomLow = low;
        return nextId();
    }

    static String encode(long timestamp, long high, long low) {
        char[] out = new char[LENGTH];
        long ts = timestamp;
        for (int i = 9; i >= 0; i--) {
            out[i] = ALPHABET[(int) (ts & 31)];
            ts >>>= 5;
        }
        for (int i = LENGTH - 1; i >= 10; i--) {
            out[i] = ALPHABET[(int) (low & 31)];
            low = (low >>> 5) | ((high & 31) << 59);
            high >>>= 5;
        }
        return new String(out);
    }

    public static boolean isValid(String id) {
        if (id == null || id.length() != LENGTH) {
            return false;
        }
        // first character carries only 3 significant bits
        if (id.charAt(0) > '7') {
            return false;
        }
        for (int i = 0; i < LENGTH; i++) {
            if (indexOf(id.charAt(i)) < 0) {
                return false;
            }
        }
        return true;
    }

    /** Millisecond timestamp embedded in a valid id. */
    public static long timestampOf(String id) {
        if (!isValid(id)) {
            throw new IllegalArgumentException("Not a ULID: " + id);
        }
        long ts = 0;
        for (int i = 0; i < 10; i++) {
            ts = (ts << 5) | indexOf(id.charAt(i));
        }
        return ts;
    }

    /** Strictly-newer comparison used for idempotent application of redelivered events. */
    public static boolean isAfter(String candidate, String reference) {
        return reference == null || candidate.compareTo(reference) > 0;
    }

    private static int indexOf(char c) {
        for (int i = 0; i < ALPHABET.length; i++) {
            if (ALPHABET[i] == c) {
                return i;
            }
        }
        return -1;
    }
}
