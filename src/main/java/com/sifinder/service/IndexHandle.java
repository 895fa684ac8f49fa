package com.sifinder.service;

import java.nio.file.Path;

/**
 * Identifies one index for every finder operation. There is no implicit "current" index.
 */
public record IndexHandle(String name, Path sourceDirectory, Path databasePath) {
}
