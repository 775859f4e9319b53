package com.jumbo.maintenance;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.stream.Stream;

/**
 * Repairs event files written with a legacy type name lacking the {@code Event} suffix:
 * the envelope's {@code type} is rewritten and the file renamed to match, e.g.
 * {@code 000002.GoalUpdated.json} becomes {@code 000002.GoalUpdatedEvent.json}.
 *
 * <p>This rewrites history in place, so it only runs when explicitly asked for. Projections
 * should be rebuilt afterwards.
 */
public class EventTypeNormalizer {

    private static final Logger log = LoggerFactory.getLogger(EventTypeNormalizer.class);

    static final String SUFFIX = "Event";

    private final Path eventsDir;
    private final ObjectMapper objectMapper;

    public EventTypeNormalizer(Path rootDir, ObjectMapper objectMapper) {
        this.eventsDir = rootDir.resolve("events");
        this.objectMapper = objectMapper;
    }

    public NormalizationResult normalize(boolean dryRun) {
        if (!Files.isDirectory(eventsDir)) {
            log.info("No events directory at {}, nothing to normalize", eventsDir);
            return new NormalizationResult(0, 0, 0, 0, dryRun);
        }

        int scanned = 0;
        int updated = 0;
        int skipped = 0;
        int errors = 0;
        for (Path file : jsonFiles()) {
            scanned++;
            try {
                if (normalizeFile(file, dryRun)) {
                    updated++;
                } else {
                    skipped++;
                }
            } catch (IOException | RuntimeException ex) {
                log.warn("Could not normalize {}: {}", file, ex.getMessage());
                errors++;
            }
        }

        log.info("Normalized event types{}: scanned={}, updated={}, skipped={}, errors={}",
            dryRun ? " (dry run)" : "", scanned, updated, skipped, errors);
        return new NormalizationResult(scanned, updated, skipped, errors, dryRun);
    }

    private boolean normalizeFile(Path file, boolean dryRun) throws IOException {
        JsonNode tree = objectMapper.readTree(file.toFile());
        if (!(tree instanceof ObjectNode document) || !document.hasNonNull("type")) {
            return false;
        }
        String oldType = document.get("type").asText();
        if (oldType.endsWith(SUFFIX)) {
            return false;
        }

        String newType = oldType + SUFFIX;
        String fileName = file.getFileName().toString();
        String marker = "." + oldType + ".";
        Path target = fileName.contains(marker)
            ? file.resolveSibling(fileName.replace(marker, "." + newType + "."))
            : file;
        log.info("{} type {} -> {}{}", fileName, oldType, newType,
            target.equals(file) ? "" : ", renamed to " + target.getFileName());
        if (dryRun) {
            return true;
        }

        document.put("type", newType);
        Path staging = file.resolveSibling(fileName + ".tmp");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(staging.toFile(), document);
        Files.move(staging, target, StandardCopyOption.REPLACE_EXISTING);
        if (!target.equals(file)) {
            Files.delete(file);
        }
        return true;
    }

    private List<Path> jsonFiles() {
        try (Stream<Path> paths = Files.walk(eventsDir)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> path.getFileName().toString().endsWith(".json"))
                .sorted()
                .toList();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to scan " + eventsDir, ex);
        }
    }
}
