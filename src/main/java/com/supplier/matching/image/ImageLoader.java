package com.supplier.matching.image;

import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * Resolves an opaque image reference into a decoded image.
 */
public interface ImageLoader {

    /**
     * Loads the referenced image.
     *
     * @param imageRef the reference carried on the product
     * @return the decoded image
     * @throws IOException if the image cannot be read or decoded
     */
    BufferedImage load(String imageRef) throws IOException;
}
