package com.metrics.indexer.codec;

/**
 * Encodes 63-bit ids from {@link IdGenerator} so that they are spread evenly
 * across a range-partitioned key space.
 *
 * <p>Encoding reverses all 64 bits of the id and then subtracts 2^63, which
 * moves the unsigned result into the signed 64-bit range. Sequential ids
 * differ mostly in their low bits; after reversal those become the high
 * bits, so neighbouring ids land far apart in the store.</p>
 *
 * <p>Decoding adds 2^63 back and reverses again. Both steps are modular
 * 64-bit arithmetic, so adding or subtracting 2^63 is a flip of the sign bit.</p>
 */
public final class IdCodec implements Codec<Long, Long> {

    // 2^63 mod 2^64
    private static final long SIGN_BIT = Long.MIN_VALUE;

    /**
     * Encodes a decoded id.
     *
     * @param decoded an id in {@code [0, 2^63)}
     * @return the value to store
     * @throws IllegalArgumentException if {@code decoded} is negative
     */
    public long encode(long decoded) {
        if (decoded < 0) {
            throw new IllegalArgumentException("Decoded id must be in [0, 2^63), got " + decoded);
        }
        return Long.reverse(decoded) ^ SIGN_BIT;
    }

    /**
     * Decodes a stored id.
     *
     * @param encoded a value previously produced by {@link #encode(long)}
     * @return the original id
     * @throws IllegalArgumentException if {@code encoded} is not the image of any id in the domain
     */
    public long decode(long encoded) {
        long decoded = Long.reverse(encoded ^ SIGN_BIT);
        if (decoded < 0) {
            throw new IllegalArgumentException("Encoded id " + encoded + " does not decode into [0, 2^63)");
        }
        return decoded;
    }

    /**
     * Returns true if {@code encoded} is the encoding of some valid id.
     * Every valid encoding is even because the top bit of a valid id is clear.
     */
    public boolean isValidEncoded(long encoded) {
        return (encoded & 1L) == 0;
    }

    @Override
    public Long encode(Long value) {
        return encode(value.longValue());
    }

    @Override
    public Long decode(Long value) {
        return decode(value.longValue());
    }
}
