package com.jumbo.maintenance;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jumbo.bus.FileSystemEventStore;
import com.jumbo.contract.EnvelopeValidator;
import com.jumbo.contract.EventEnvelope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventTypeNormalizerTest {

    @TempDir
    Path rootDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private Path goalDir;

    @BeforeEach
    void writeLegacyStream() throws IOException {
        goalDir = Files.createDirectories(rootDir.resolve("events/goal_1"));
        write("000001.GoalAddedEvent.json",
            "{\"type\":\"GoalAddedEvent\",\"aggregateId\":\"goal_1\",\"version\":1,"
                + "\"timestamp\":\"2025-01-01T00:00:00.000Z\",\"payload\":{\"objective\":\"x\"},\"seq\":1}");
        write("000002.GoalUpdated.json",
            "{\"type\":\"GoalUpdated\",\"aggregateId\":\"goal_1\",\"version\":2,"
                + "\"timestamp\":\"2025-01-01T00:00:01.000Z\",\"payload\":{\"objective\":\"y\"},\"seq\":2}");
    }

    @Test
    void dryRun_reportsWithoutTouchingFiles() throws IOException {
        NormalizationResult result = new EventTypeNormalizer(rootDir, objectMapper).normalize(true);

        assertEquals(new NormalizationResult(2, 1, 1, 0, true), result);
        assertTrue(Files.exists(goalDir.resolve("000002.GoalUpdated.json")));
        assertFalse(Files.exists(goalDir.resolve("000002.GoalUpdatedEvent.json")));
        assertTrue(Files.readString(goalDir.resolve("000002.GoalUpdated.json")).contains("\"GoalUpdated\""));
    }

    @Test
    void liveRun_rewritesTypeAndRenamesFile() {
        NormalizationResult result = new EventTypeNormalizer(rootDir, objectMapper).normalize(false);

        assertEquals(new NormalizationResult(2, 1, 1, 0, false), result);
        assertFalse(Files.exists(goalDir.resolve("000002.GoalUpdated.json")));
        assertTrue(Files.exists(goalDir.resolve("000002.GoalUpdatedEvent.json")));

        List<EventEnvelope> stream = new FileSystemEventStore(rootDir, objectMapper, new EnvelopeValidator())
            .readStream("goal_1");
        assertEquals(List.of("GoalAddedEvent", "GoalUpdatedEvent"), stream.stream().map(EventEnvelope::type).toList());
        assertEquals("y", stream.get(1).payloadText("objective"));
    }

    @Test
    void secondRun_findsNothingLeft() {
        EventTypeNormalizer normalizer = new EventTypeNormalizer(rootDir, objectMapper);
        normalizer.normalize(false);

        assertEquals(new NormalizationResult(2, 0, 2, 0, false), normalizer.normalize(false));
    }

    @Test
    void unreadableFile_isCountedAsError() throws IOException {
        write("000003.Broken.json", "{not json");

        NormalizationResult result = new EventTypeNormalizer(rootDir, objectMapper).normalize(false);

        assertEquals(3, result.scanned());
        assertEquals(1, result.errors());
        assertEquals(1, result.updated());
    }

    @Test
    void missingEventsDirectory_isEmptyResult(@TempDir Path emptyRoot) {
        assertEquals(new NormalizationResult(0, 0, 0, 0, true),
            new EventTypeNormalizer(emptyRoot, objectMapper).normalize(true));
    }

    private void write(String name, String json) throws IOException {
        Files.writeString(goalDir.resolve(name), json);
    }
}
