package io.rconcron.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.rconcron.security.SensitiveDataMasker;
import io.rconcron.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSONL trail of operator actions and scheduled fires. Details are masked before
 * they are written.
 */
public final class AuditLogger {
    private static final Logger LOG = LoggerFactory.getLogger(AuditLogger.class);

    private final Path auditFile;
    private final Clock clock;

    public AuditLogger(Path auditFile, Clock clock) {
        this.auditFile = auditFile;
        this.clock = clock;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
    }

    /**
     * Writes one row. A write failure is logged and otherwise ignored so that auditing never
     * interrupts a dispatch.
     */
    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", clock.instant().toString());
        row.put("action", event.action());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", sanitizeDetails(event.details()));
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            LOG.error("Failed to write audit log {}: {}", auditFile, e.getMessage());
        }
    }

    public List<String> tail(int limit) throws IOException {
        if (!Files.exists(auditFile)) {
            return List.of();
        }
        List<String> lines = new ArrayList<>();
        for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
            if (line != null && !line.isBlank()) {
                lines.add(line);
            }
        }
        int safeLimit = Math.max(1, limit);
        return lines.subList(Math.max(0, lines.size() - safeLimit), lines.size());
    }

    public Path auditFile() {
        return auditFile;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.mapper().valueToTree(input);
        JsonNode masked = SensitiveDataMasker.masked(node);
        return Jsons.mapper().convertValue(masked, Map.class);
    }

    public record AuditEvent(
            String action,
            String resource,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String resource, String result, Map<String, Object> details) {
            return new AuditEvent(action, resource, result, details == null ? Map.of() : details);
        }
    }
}
