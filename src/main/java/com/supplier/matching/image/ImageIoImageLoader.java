package com.supplier.matching.image;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Loads images through {@link ImageIO}. References starting with {@code http://},
 * {@code https://} or {@code file:} are read as URLs, anything else as a local path.
 */
public class ImageIoImageLoader implements ImageLoader {
    private static final Logger log = LoggerFactory.getLogger(ImageIoImageLoader.class);

    @Override
    public BufferedImage load(String imageRef) throws IOException {
        if (imageRef == null || imageRef.isBlank()) {
            throw new IOException("Empty image reference");
        }

        BufferedImage image;
        if (isUrl(imageRef)) {
            URL url;
            try {
                url = new URI(imageRef).toURL();
            } catch (URISyntaxException | IllegalArgumentException e) {
                throw new IOException("Malformed image URL: " + imageRef, e);
            }
            log.debug("image.load url={}", imageRef);
            image = ImageIO.read(url);
        } else {
            Path path = Path.of(imageRef);
            if (!Files.isRegularFile(path)) {
                throw new IOException("Image file not found: " + imageRef);
            }
            image = ImageIO.read(path.toFile());
        }

        if (image == null) {
            throw new IOException("Unsupported or corrupt image: " + imageRef);
        }
        return image;
    }

    private boolean isUrl(String imageRef) {
        String lower = imageRef.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://") || lower.startsWith("file:");
    }
}
