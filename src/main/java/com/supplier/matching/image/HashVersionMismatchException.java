package com.supplier.matching.image;

/**
 * Thrown when two perceptual hashes of different bit lengths are compared,
 * which means they were produced by different hash algorithms or versions.
 */
public class HashVersionMismatchException extends RuntimeException {

    private final int leftBitLength;
    private final int rightBitLength;

    public HashVersionMismatchException(int leftBitLength, int rightBitLength) {
        super("Cannot compare perceptual hashes of " + leftBitLength + " and " + rightBitLength + " bits");
        this.leftBitLength = leftBitLength;
        this.rightBitLength = rightBitLength;
    }

    public int getLeftBitLength() {
        return leftBitLength;
    }

    public int getRightBitLength() {
        return rightBitLength;
    }
}
