package com.supplier.matching.image;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PerceptualHash Tests")
class PerceptualHashTest {

    @Test
    @DisplayName("Hex form keeps bit order, most significant first")
    void hexBitOrder() {
        PerceptualHash hash = PerceptualHash.fromHex("8000000000000001");
        assertEquals(64, hash.bitLength());
        assertTrue(hash.bit(0));
        assertFalse(hash.bit(1));
        assertTrue(hash.bit(63));
        assertEquals("8000000000000001", hash.toHex());
    }

    @Test
    @DisplayName("ofLong and fromHex agree")
    void ofLongMatchesHex() {
        assertEquals(PerceptualHash.fromHex("00000000000000ff"), PerceptualHash.ofLong(0xFFL));
        assertEquals("ffffffffffffffff", PerceptualHash.ofLong(-1L).toHex());
    }

    @Test
    @DisplayName("Hamming distance counts differing bits")
    void hamming() {
        PerceptualHash a = PerceptualHash.fromHex("ff00");
        PerceptualHash b = PerceptualHash.fromHex("0f0f");
        assertEquals(8, a.hammingDistance(b));
        assertEquals(0, a.hammingDistance(a));
    }

    @Test
    @DisplayName("Hashes longer than one word are supported")
    void multiWord() {
        PerceptualHash a = PerceptualHash.fromHex("0".repeat(32));
        PerceptualHash b = PerceptualHash.fromHex("1" + "0".repeat(30) + "1");
        assertEquals(128, a.bitLength());
        assertEquals(2, a.hammingDistance(b));
    }

    @Test
    @DisplayName("Comparing different lengths throws")
    void lengthMismatch() {
        assertThrows(HashVersionMismatchException.class,
                () -> PerceptualHash.fromHex("ff").hammingDistance(PerceptualHash.fromHex("ffff")));
    }

    @Test
    @DisplayName("Invalid input is rejected")
    void invalidInput() {
        assertThrows(IllegalArgumentException.class, () -> PerceptualHash.fromHex(""));
        assertThrows(IllegalArgumentException.class, () -> PerceptualHash.fromHex("xyz"));
        assertThrows(IllegalArgumentException.class, () -> PerceptualHash.fromBits(new boolean[0]));
        assertThrows(IndexOutOfBoundsException.class, () -> PerceptualHash.ofLong(0L).bit(64));
    }

    @Test
    @DisplayName("Upper-case hex parses the same under any default locale")
    void upperCaseHex() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertEquals(PerceptualHash.fromHex("abcdef01"), PerceptualHash.fromHex("ABCDEF01"));
        } finally {
            Locale.setDefault(previous);
        }
    }
}
