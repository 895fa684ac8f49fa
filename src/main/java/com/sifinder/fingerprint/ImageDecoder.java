package com.sifinder.fingerprint;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import javax.imageio.ImageIO;

/**
 * Reads images through {@link ImageIO}. PNG and JPEG readers ship with the JDK, WEBP comes from the
 * TwelveMonkeys plugin discovered on the classpath.
 */
public class ImageDecoder {
    static {
        ImageIO.scanForPlugins();
        ImageIO.setUseCache(false);
    }

    public BufferedImage decode(Path path) throws DecodeException {
        if (!Files.isRegularFile(path)) {
            throw new DecodeException("Not a readable file: " + path);
        }
        BufferedImage image;
        try {
            image = ImageIO.read(path.toFile());
        } catch (IOException e) {
            throw new DecodeException("Unable to decode image " + path + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // Several ImageIO readers report truncated streams with unchecked exceptions.
            throw new DecodeException("Corrupt image " + path + ": " + e, e);
        }
        if (image == null) {
            throw new DecodeException("No image reader accepts " + path);
        }
        if (image.getWidth() <= 0 || image.getHeight() <= 0) {
            throw new DecodeException("Image has no pixels: " + path);
        }
        return image;
    }
}
