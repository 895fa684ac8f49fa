package com.sifinder.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the writable directory where index databases live.
 */
public class AppDirectories {
    private static final Logger log = LoggerFactory.getLogger(AppDirectories.class);
    static final String APP_FOLDER = "SI-Finder";

    private final String osName;
    private final Map<String, String> environment;
    private final Path userHome;

    public AppDirectories() {
        this(System.getProperty("os.name", ""), System.getenv(), Path.of(System.getProperty("user.home", ".")));
    }

    AppDirectories(String osName, Map<String, String> environment, Path userHome) {
        this.osName = osName.toLowerCase(Locale.ROOT);
        this.environment = environment;
        this.userHome = userHome;
    }

    public Path resolveDataDir(String configured) throws IOException {
        if (configured != null && !configured.isBlank()) {
            Path explicit = Path.of(configured);
            Files.createDirectories(explicit);
            return explicit;
        }
        Path preferred = preferredDataDir();
        try {
            Files.createDirectories(preferred);
            return preferred;
        } catch (IOException e) {
            Path fallback = fallbackDataDir();
            log.warn("data.dir.unwritable path={} fallback={} reason={}", preferred, fallback, e.getMessage());
            Files.createDirectories(fallback);
            return fallback;
        }
    }

    Path preferredDataDir() {
        if (osName.startsWith("windows")) {
            String appData = environment.get("APPDATA");
            Path base = appData == null || appData.isBlank() ? userHome.resolve("AppData").resolve("Roaming") : Path.of(appData);
            return base.resolve(APP_FOLDER);
        }
        if (osName.startsWith("mac")) {
            return userHome.resolve("Library").resolve("Application Support").resolve(APP_FOLDER);
        }
        String xdgDataHome = environment.get("XDG_DATA_HOME");
        Path base = xdgDataHome == null || xdgDataHome.isBlank()
                ? userHome.resolve(".local").resolve("share")
                : Path.of(xdgDataHome);
        return base.resolve(APP_FOLDER);
    }

    Path fallbackDataDir() {
        String tmp = environment.getOrDefault("TMPDIR", System.getProperty("java.io.tmpdir", "/tmp"));
        return Path.of(tmp).resolve(APP_FOLDER + "_Data");
    }
}
