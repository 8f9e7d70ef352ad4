package com.streamfleet.core.hash;

import com.google.common.hash.HashCode;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * Stable hash functions for consistent hashing and key distribution.
 * <p>
 * Murmur3 is fast and well-distributed, and gives the same value on every
 * JVM, so a client id always lands on the same ring position.
 * </p>
 */
public final class Hashers {
    private Hashers() {
    }

    /**
     * Computes Murmur3 128-bit hash and returns the lower 64 bits as a long.
     *
     * @param data Input bytes
     * @return 64-bit hash value (signed long)
     */
    public static long murmur3Hash(byte[] data) {
        HashCode hash = Hashing.murmur3_128().hashBytes(data);
        return hash.asLong(); // Returns lower 64 bits
    }

    /**
     * Computes Murmur3 hash of a UTF-8 string.
     *
     * @param str Input string
     * @return 64-bit hash value
     */
    public static long murmur3Hash(String str) {
        return murmur3Hash(str.getBytes(StandardCharsets.UTF_8));
    }
}
