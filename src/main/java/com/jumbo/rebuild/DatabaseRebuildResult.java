package com.jumbo.rebuild;

public record DatabaseRebuildResult(int eventsReplayed, boolean success) {
}
