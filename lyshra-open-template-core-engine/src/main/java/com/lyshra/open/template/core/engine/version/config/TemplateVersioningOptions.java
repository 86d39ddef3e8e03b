package com.lyshra.open.template.core.engine.version.config;

import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Behaviour switches shared by the version registry, resolver and migration executor.
 *
 * <p>Properties keys (prefix {@value #PREFIX}):</p>
 * <ul>
 *   <li>{@code allow-prerelease} - resolve and report pre-release versions as latest (default false)</li>
 *   <li>{@code strict} - abort a migration on the first failing step (default true)</li>
 *   <li>{@code create-backups} - snapshot templates before migrating (default true)</li>
 *   <li>{@code auto-migrate} - migrate outdated templates when they are prepared (default false)</li>
 *   <li>{@code max-backup-size-bytes} - largest backup file accepted on rollback (default 2 MiB)</li>
 * </ul>
 */
@Slf4j
@Value
@Builder(toBuilder = true)
public class TemplateVersioningOptions {

    public static final String PREFIX = "lyshra.template.versioning.";
    public static final String DEFAULT_RESOURCE = "lyshra-template-versioning.properties";
    public static final long DEFAULT_MAX_BACKUP_SIZE_BYTES = 2L * 1024 * 1024;

    @Builder.Default
    boolean allowPreRelease = false;
    @Builder.Default
    boolean strict = true;
    @Builder.Default
    boolean createBackups = true;
    @Builder.Default
    boolean autoMigrate = false;
    @Builder.Default
    long maxBackupSizeBytes = DEFAULT_MAX_BACKUP_SIZE_BYTES;

    public static TemplateVersioningOptions defaults() {
        return TemplateVersioningOptions.builder().build();
    }

    /**
     * Reads options from properties, falling back to defaults for absent keys.
     *
     * @param properties source properties
     * @return options
     */
    public static TemplateVersioningOptions fromProperties(Properties properties) {
        TemplateVersioningOptions defaults = defaults();
        return TemplateVersioningOptions.builder()
                .allowPreRelease(readBoolean(properties, "allow-prerelease", defaults.isAllowPreRelease()))
                .strict(readBoolean(properties, "strict", defaults.isStrict()))
                .createBackups(readBoolean(properties, "create-backups", defaults.isCreateBackups()))
                .autoMigrate(readBoolean(properties, "auto-migrate", defaults.isAutoMigrate()))
                .maxBackupSizeBytes(readLong(properties, "max-backup-size-bytes", defaults.getMaxBackupSizeBytes()))
                .build();
    }

    /**
     * Loads options from {@value #DEFAULT_RESOURCE} on the classpath, or defaults if absent.
     *
     * @return options
     */
    public static TemplateVersioningOptions load() {
        return load(DEFAULT_RESOURCE);
    }

    public static TemplateVersioningOptions load(String resourceName) {
        ClassLoader classLoader = TemplateVersioningOptions.class.getClassLoader();
        try (InputStream in = classLoader.getResourceAsStream(resourceName)) {
            if (in == null) {
                log.debug("No [{}] on classpath, using default versioning options", resourceName);
                return defaults();
            }
            Properties properties = new Properties();
            properties.load(in);
            TemplateVersioningOptions options = fromProperties(properties);
            log.info("Loaded versioning options from [{}]: {}", resourceName, options);
            return options;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read versioning options from " + resourceName, e);
        }
    }

    private static boolean readBoolean(Properties properties, String key, boolean defaultValue) {
        String value = properties.getProperty(PREFIX + key);
        return value == null || value.isBlank() ? defaultValue : Boolean.parseBoolean(value.trim());
    }

    private static long readLong(Properties properties, String key, long defaultValue) {
        String value = properties.getProperty(PREFIX + key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + PREFIX + key + ": " + value, e);
        }
    }
}
