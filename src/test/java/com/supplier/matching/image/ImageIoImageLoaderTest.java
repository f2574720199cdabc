package com.supplier.matching.image;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ImageIoImageLoader Tests")
class ImageIoImageLoaderTest {

    private final ImageIoImageLoader loader = new ImageIoImageLoader();

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Loads a PNG by path and by file URL")
    void loadsPng() throws IOException {
        Path file = tempDir.resolve("mouse.png");
        ImageIO.write(PerceptualHasherTest.leftHalfWhite(32, 16), "png", file.toFile());

        BufferedImage byPath = loader.load(file.toString());
        BufferedImage byUrl = loader.load(file.toUri().toString());

        assertEquals(32, byPath.getWidth());
        assertEquals(16, byUrl.getHeight());
    }

    @Test
    @DisplayName("Missing file raises IOException")
    void missingFile() {
        assertThrows(IOException.class, () -> loader.load(tempDir.resolve("nope.png").toString()));
    }

    @Test
    @DisplayName("Non-image content raises IOException")
    void corruptFile() throws IOException {
        Path file = tempDir.resolve("broken.png");
        Files.writeString(file, "not an image");
        assertThrows(IOException.class, () -> loader.load(file.toString()));
    }

    @Test
    @DisplayName("Blank or malformed references raise IOException")
    void badReferences() {
        assertThrows(IOException.class, () -> loader.load(" "));
        assertThrows(IOException.class, () -> loader.load("http://bad host/x.png"));
    }
}
