package com.supplier.matching.image;

import java.util.Arrays;
import java.util.Locale;

/**
 * Fixed-length bit vector summarizing an image's coarse visual structure.
 * Bit 0 is the most significant bit of the hex form.
 */
public final class PerceptualHash {

    private static final String HEX_DIGITS = "0123456789abcdef";

    private final long[] words;
    private final int bitLength;

    private PerceptualHash(long[] words, int bitLength) {
        this.words = words;
        this.bitLength = bitLength;
    }

    /**
     * Creates a 64-bit hash from a long, most significant bit first.
     */
    public static PerceptualHash ofLong(long value) {
        boolean[] bits = new boolean[Long.SIZE];
        for (int i = 0; i < Long.SIZE; i++) {
            bits[i] = ((value >>> (Long.SIZE - 1 - i)) & 1L) == 1L;
        }
        return fromBits(bits);
    }

    /**
     * Parses a hex string; every digit contributes four bits.
     */
    public static PerceptualHash fromHex(String hex) {
        if (hex == null || hex.isBlank()) {
            throw new IllegalArgumentException("hex must not be blank");
        }
        String digits = hex.strip().toLowerCase(Locale.ROOT);
        boolean[] bits = new boolean[digits.length() * 4];
        for (int j = 0; j < digits.length(); j++) {
            int nibble = HEX_DIGITS.indexOf(digits.charAt(j));
            if (nibble < 0) {
                throw new IllegalArgumentException("Not a hex string: " + hex);
            }
            for (int k = 0; k < 4; k++) {
                bits[j * 4 + k] = ((nibble >>> (3 - k)) & 1) == 1;
            }
        }
        return fromBits(bits);
    }

    public static PerceptualHash fromBits(boolean[] bits) {
        if (bits == null || bits.length == 0) {
            throw new IllegalArgumentException("A perceptual hash needs at least one bit");
        }
        long[] words = new long[(bits.length + Long.SIZE - 1) / Long.SIZE];
        for (int i = 0; i < bits.length; i++) {
            if (bits[i]) {
                words[i / Long.SIZE] |= 1L << (i % Long.SIZE);
            }
        }
        return new PerceptualHash(words, bits.length);
    }

    public int bitLength() {
        return bitLength;
    }

    public boolean bit(int index) {
        if (index < 0 || index >= bitLength) {
            throw new IndexOutOfBoundsException("bit " + index + " of " + bitLength);
        }
        return ((words[index / Long.SIZE] >>> (index % Long.SIZE)) & 1L) == 1L;
    }

    /**
     * Number of differing bits.
     *
     * @throws HashVersionMismatchException if the hashes have different lengths
     */
    public int hammingDistance(PerceptualHash other) {
        if (other.bitLength != bitLength) {
            throw new HashVersionMismatchException(bitLength, other.bitLength);
        }
        int distance = 0;
        for (int i = 0; i < words.length; i++) {
            distance += Long.bitCount(words[i] ^ other.words[i]);
        }
        return distance;
    }

    public String toHex() {
        StringBuilder sb = new StringBuilder((bitLength + 3) / 4);
        for (int j = 0; j * 4 < bitLength; j++) {
            int nibble = 0;
            for (int k = 0; k < 4; k++) {
                int index = j * 4 + k;
                nibble <<= 1;
                if (index < bitLength && bit(index)) {
                    nibble |= 1;
                }
            }
            sb.append(HEX_DIGITS.charAt(nibble));
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PerceptualHash that = (PerceptualHash) o;
        return bitLength == that.bitLength && Arrays.equals(words, that.words);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(words) + bitLength;
    }

    @Override
    public String toString() {
        return "PerceptualHash{" + bitLength + " bits, " + toHex() + '}';
    }
}
