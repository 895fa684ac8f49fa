package com.sifinder.ingest;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Extension gate applied before any decode is attempted.
 */
public class SupportedFormats {
    public static final Set<String> DEFAULT_EXTENSIONS = Set.of("png", "jpg", "jpeg", "webp");

    private final Set<String> extensions;

    public SupportedFormats(Collection<String> extensions) {
        this.extensions = extensions.stream()
                .map(ext -> ext.toLowerCase(Locale.ROOT).replaceFirst("^\\.", ""))
                .filter(ext -> !ext.isBlank())
                .collect(Collectors.toUnmodifiableSet());
    }

    public static SupportedFormats defaults() {
        return new SupportedFormats(DEFAULT_EXTENSIONS);
    }

    public boolean supports(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return false;
        }
        return extensions.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    public Set<String> extensions() {
        return extensions;
    }
}
