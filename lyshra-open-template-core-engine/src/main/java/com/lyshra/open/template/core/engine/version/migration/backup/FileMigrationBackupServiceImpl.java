package com.lyshra.open.template.core.engine.version.migration.backup;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lyshra.open.template.core.engine.version.config.TemplateVersioningOptions;
import com.lyshra.open.template.integration.document.TemplateDocument;
import com.lyshra.open.template.integration.models.version.migration.RollbackResult;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * File-system backed backup service.
 *
 * <p>Backups are written as {@code {templateId}_{timestamp}_backup.json}, where the timestamp is
 * the UTC instant in ISO-8601 form with {@code :} and {@code .} replaced by {@code -}, and the
 * content is the template as 2-space indented JSON. Blocking file I/O runs on the bounded
 * elastic scheduler.</p>
 */
@Slf4j
public class FileMigrationBackupServiceImpl implements IMigrationBackupService {

    static final String BACKUP_SUFFIX = "_backup.json";

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    private static final ObjectWriter BACKUP_WRITER = JSON_MAPPER.writer(backupPrettyPrinter());

    private final long maxBackupSizeBytes;
    private final Clock clock;

    public FileMigrationBackupServiceImpl() {
        this(TemplateVersioningOptions.defaults());
    }

    public FileMigrationBackupServiceImpl(TemplateVersioningOptions options) {
        this(options, Clock.systemUTC());
    }

    public FileMigrationBackupServiceImpl(TemplateVersioningOptions options, Clock clock) {
        this.maxBackupSizeBytes = options.getMaxBackupSizeBytes();
        this.clock = clock;
    }

    @Override
    public Mono<BackupResult> createBackup(String templateId, TemplateDocument template, Path backupDir) {
        return Mono.fromCallable(() -> {
            try {
                Files.createDirectories(backupDir);
                Path backupPath = backupDir.resolve(backupFileName(templateId));
                byte[] content = BACKUP_WRITER.writeValueAsBytes(template.getContent());
                Files.write(backupPath, content);

                log.info("Created backup [{}] for template [{}], size: {} bytes", backupPath, templateId, content.length);
                return BackupResult.success(templateId, backupPath, content.length);
            } catch (IOException e) {
                log.error("Failed to create backup for template [{}] in [{}]: {}", templateId, backupDir, e.getMessage(), e);
                return BackupResult.failed(templateId, describe(e));
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<RollbackResult> restoreBackup(Path backupPath) {
        return Mono.fromCallable(() -> {
            try {
                if (!Files.isRegularFile(backupPath)) {
                    return RollbackResult.failed(backupPath, "Backup file not found: " + backupPath);
                }
                long size = Files.size(backupPath);
                if (size > maxBackupSizeBytes) {
                    return RollbackResult.failed(backupPath,
                            "Backup file is " + size + " bytes, exceeding the maximum of " + maxBackupSizeBytes + " bytes");
                }

                String content = Files.readString(backupPath, StandardCharsets.UTF_8);
                JsonNode node = JSON_MAPPER.readTree(content);
                if (!(node instanceof ObjectNode)) {
                    return RollbackResult.failed(backupPath, "Backup does not contain a JSON object");
                }

                log.info("Restored template from backup [{}]", backupPath);
                return RollbackResult.success(backupPath, TemplateDocument.of((ObjectNode) node));
            } catch (JsonProcessingException e) {
                log.warn("Backup [{}] is not valid JSON: {}", backupPath, e.getOriginalMessage());
                return RollbackResult.failed(backupPath, "Backup is not valid JSON: " + e.getOriginalMessage());
            } catch (IOException e) {
                log.error("Failed to read backup [{}]: {}", backupPath, e.getMessage(), e);
                return RollbackResult.failed(backupPath, describe(e));
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    // Objects and arrays both break one element per line with 2-space indentation, "key": value
    private static DefaultPrettyPrinter backupPrettyPrinter() {
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
                .withSeparators(Separators.createDefaultInstance()
                        .withObjectFieldValueSpacing(Separators.Spacing.AFTER));
        printer.indentObjectsWith(indenter);
        printer.indentArraysWith(indenter);
        return printer;
    }

    String backupFileName(String templateId) {
        String timestamp = TIMESTAMP_FORMAT.format(clock.instant()).replace(':', '-').replace('.', '-');
        return templateId + "_" + timestamp + BACKUP_SUFFIX;
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
