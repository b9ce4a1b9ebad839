package com.acme.grc.config;

import com.acme.grc.util.MapperUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

public final class SettingsLoader {
    private static final Logger log = LoggerFactory.getLogger(SettingsLoader.class);

    static final String DEFAULTS_RESOURCE = "/grc-defaults.yaml";

    private SettingsLoader() {}

    public static GrcSettings defaults() {
        try (InputStream in = SettingsLoader.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) throw new IllegalStateException("Missing classpath resource " + DEFAULTS_RESOURCE);
            return MapperUtil.YAML.readValue(in, GrcSettings.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + DEFAULTS_RESOURCE, e);
        }
    }

    /**
     * Loads the defaults and layers {@code override} on top when given.
     */
    public static GrcSettings load(Path override) throws IOException {
        GrcSettings settings = defaults();
        if (override == null) return settings;
        if (!Files.isRegularFile(override)) throw new IOException("Settings file not found: " + override);
        log.info("Applying settings overrides from {}", override);
        return MapperUtil.YAML.readerForUpdating(settings).readValue(override.toFile());
    }
}
