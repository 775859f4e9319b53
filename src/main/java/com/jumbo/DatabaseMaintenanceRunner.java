package com.jumbo;

import com.jumbo.local.LocalInfrastructureModule;
import com.jumbo.maintenance.EventTypeNormalizer;
import com.jumbo.maintenance.NormalizationResult;
import com.jumbo.rebuild.DatabaseRebuildResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Handles the database maintenance commands:
 * {@code db rebuild} and {@code db normalize-event-types [--dry-run]}.
 * Any other arguments are left to other runners.
 */
@Component
public class DatabaseMaintenanceRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DatabaseMaintenanceRunner.class);

    private final LocalInfrastructureModule infrastructure;
    private final EventTypeNormalizer normalizer;

    public DatabaseMaintenanceRunner(LocalInfrastructureModule infrastructure, EventTypeNormalizer normalizer) {
        this.infrastructure = infrastructure;
        this.normalizer = normalizer;
    }

    @Override
    public void run(String... args) {
        List<String> arguments = Arrays.asList(args);
        if (arguments.size() < 2 || !"db".equals(arguments.get(0))) {
            return;
        }

        switch (arguments.get(1)) {
            case "rebuild" -> {
                DatabaseRebuildResult result = infrastructure.getDatabaseRebuildService().rebuild();
                log.info("Database rebuilt: {} event(s) replayed", result.eventsReplayed());
            }
            case "normalize-event-types" -> {
                NormalizationResult result = normalizer.normalize(arguments.contains("--dry-run"));
                log.info("Event types: {} scanned, {} updated, {} skipped, {} error(s){}",
                    result.scanned(), result.updated(), result.skipped(), result.errors(),
                    result.dryRun() && result.updated() > 0 ? " (dry run, nothing written)" : "");
                if (!result.dryRun() && result.updated() > 0) {
                    log.info("Run 'db rebuild' to bring the projections in line with the rewritten events");
                }
            }
            default -> log.warn("Unknown db command: {}", arguments.get(1));
        }
    }
}
