package com.sifinder.fingerprint;

import java.awt.image.BufferedImage;
import java.nio.file.Path;

public interface FingerprintExtractor {
    Fingerprint compute(Path image) throws DecodeException;

    Fingerprint compute(BufferedImage image);
}
