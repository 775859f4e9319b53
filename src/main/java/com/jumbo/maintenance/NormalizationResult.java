package com.jumbo.maintenance;

public record NormalizationResult(int scanned, int updated, int skipped, int errors, boolean dryRun) {
}
