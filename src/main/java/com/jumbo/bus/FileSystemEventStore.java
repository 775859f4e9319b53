package com.jumbo.bus;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.jumbo.contract.EnvelopeValidator;
import com.jumbo.contract.EventEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Event store keeping one directory per stream and one JSON file per envelope:
 * {@code {rootDir}/events/{aggregateId}/{version:06d}.{type}.json}.
 *
 * <p>Appends are serialized store-wide, inside the JVM by a lock and across processes by a
 * {@link FileLock} on {@code events/.sequence}. That file holds the last allocated global
 * position; every envelope file records its own position, which fixes the order of the global log
 * independently of the timestamps callers put on envelopes. The event file is created with
 * create-new semantics, so an occupied slot can never be overwritten.
 */
public class FileSystemEventStore implements EventStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemEventStore.class);

    static final Pattern EVENT_FILE = Pattern.compile("^(\\d{6})\\.(.+)\\.json$");
    static final String SEQUENCE_FILE = ".sequence";
    static final String POSITION_FIELD = "position";
    private static final String SEQ_FIELD = "seq";

    private final Path eventsDir;
    private final ObjectMapper objectMapper;
    private final EnvelopeValidator validator;
    private final ReentrantLock appendLock = new ReentrantLock();

    public FileSystemEventStore(Path rootDir, ObjectMapper objectMapper, EnvelopeValidator validator) {
        this.eventsDir = rootDir.resolve("events");
        this.objectMapper = objectMapper;
        this.validator = validator;
    }

    public static String fileName(long version, String type) {
        return String.format("%06d.%s.json", version, type);
    }

    public Path getEventsDirectory() {
        return eventsDir;
    }

    @Override
    public AppendResult append(EventEnvelope event) {
        validator.validate(event);
        appendLock.lock();
        try {
            Files.createDirectories(eventsDir);
            try (FileChannel sequence = FileChannel.open(eventsDir.resolve(SEQUENCE_FILE),
                     StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
                 FileLock ignored = sequence.lock()) {
                return appendLocked(sequence, event);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to append " + event.type() + " to stream " + event.aggregateId(), ex);
        } finally {
            appendLock.unlock();
        }
    }

    private AppendResult appendLocked(FileChannel sequence, EventEnvelope event) throws IOException {
        Path streamDir = eventsDir.resolve(event.aggregateId());
        Files.createDirectories(streamDir);
        long expected = countEvents(streamDir) + 1;
        if (event.version() != expected) {
            throw new ConcurrencyConflictException(event.aggregateId(), expected, event.version());
        }

        // The position is reserved before the event file exists; a failed write leaves a gap, never a duplicate.
        long position = lastPosition(sequence) + 1;
        writePosition(sequence, position);

        ObjectNode document = objectMapper.valueToTree(event);
        document.put(SEQ_FIELD, event.version());
        document.put(POSITION_FIELD, position);
        byte[] bytes = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(document);

        Path target = streamDir.resolve(fileName(event.version(), event.type()));
        try (FileChannel channel = FileChannel.open(target, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
            ByteBuffer buffer = ByteBuffer.wrap(bytes);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        } catch (FileAlreadyExistsException ex) {
            throw new ConcurrencyConflictException(event.aggregateId(), expected, event.version());
        } catch (IOException ex) {
            Files.deleteIfExists(target);
            throw ex;
        }

        log.debug("Appended {} v{} to stream {} at position {}", event.type(), event.version(), event.aggregateId(), position);
        return new AppendResult(event.aggregateId(), event.version(), position);
    }

    /**
     * Last allocated position. A store written before positions existed has an empty counter;
     * it starts from the highest position found in the event files, 0 if none has one.
     */
    private long lastPosition(FileChannel sequence) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate((int) sequence.size());
        long offset = 0;
        while (buffer.hasRemaining()) {
            int read = sequence.read(buffer, offset);
            if (read < 0) {
                break;
            }
            offset += read;
        }
        String text = new String(buffer.array(), StandardCharsets.US_ASCII).trim();
        if (!text.isEmpty()) {
            return Long.parseLong(text);
        }
        long highest = 0;
        for (String aggregateId : listAggregateIds()) {
            for (RecordedEvent recorded : readRecorded(aggregateId)) {
                highest = Math.max(highest, recorded.position());
            }
        }
        return highest;
    }

    private static void writePosition(FileChannel sequence, long position) throws IOException {
        ByteBuffer buffer = ByteBuffer.wrap(Long.toString(position).getBytes(StandardCharsets.US_ASCII));
        sequence.truncate(0);
        long offset = 0;
        while (buffer.hasRemaining()) {
            offset += sequence.write(buffer, offset);
        }
        sequence.force(true);
    }

    @Override
    public List<EventEnvelope> readStream(String aggregateId) {
        validator.validateAggregateId(aggregateId);
        return readRecorded(aggregateId).stream().map(RecordedEvent::event).toList();
    }

    /**
     * Merges all streams by global position, which is the order the envelopes were appended in.
     * Envelopes written before positions were recorded carry none and sort first, by timestamp and
     * then aggregate id. A stream's cursor only advances past its own head, so per-stream order is
     * always kept.
     */
    @Override
    public List<EventEnvelope> getAllEvents() {
        PriorityQueue<StreamCursor> heads = new PriorityQueue<>(
            Comparator.comparingLong((StreamCursor cursor) -> cursor.head().position())
                .thenComparing(StreamCursor::headTimestamp)
                .thenComparing(cursor -> cursor.head().event().aggregateId()));
        int total = 0;
        for (String aggregateId : listAggregateIds()) {
            List<RecordedEvent> stream = readRecorded(aggregateId);
            total += stream.size();
            if (!stream.isEmpty()) {
                heads.add(new StreamCursor(stream));
            }
        }

        List<EventEnvelope> merged = new ArrayList<>(total);
        while (!heads.isEmpty()) {
            StreamCursor cursor = heads.poll();
            merged.add(cursor.head().event());
            if (cursor.advance()) {
                heads.add(cursor);
            }
        }
        return merged;
    }

    private List<RecordedEvent> readRecorded(String aggregateId) {
        Path streamDir = eventsDir.resolve(aggregateId);
        if (!Files.isDirectory(streamDir)) {
            return List.of();
        }
        try {
            List<RecordedEvent> events = new ArrayList<>();
            for (Path file : eventFiles(streamDir)) {
                JsonNode document = objectMapper.readTree(file.toFile());
                long position = document.path(POSITION_FIELD).asLong(0);
                events.add(new RecordedEvent(position, objectMapper.treeToValue(document, EventEnvelope.class)));
            }
            return events;
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read stream " + aggregateId, ex);
        }
    }

    public List<String> listAggregateIds() {
        if (!Files.isDirectory(eventsDir)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(eventsDir)) {
            return entries
                .filter(Files::isDirectory)
                .map(path -> path.getFileName().toString())
                .sorted()
                .toList();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to list streams under " + eventsDir, ex);
        }
    }

    /** Event files of one stream ordered by their sequence number. */
    static List<Path> eventFiles(Path streamDir) throws IOException {
        try (Stream<Path> entries = Files.list(streamDir)) {
            return entries
                .filter(path -> EVENT_FILE.matcher(path.getFileName().toString()).matches())
                .sorted(Comparator.comparingLong(FileSystemEventStore::sequenceOf))
                .toList();
        }
    }

    static long sequenceOf(Path file) {
        Matcher matcher = EVENT_FILE.matcher(file.getFileName().toString());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Not an event file: " + file);
        }
        return Long.parseLong(matcher.group(1));
    }

    private static long countEvents(Path streamDir) throws IOException {
        return eventFiles(streamDir).size();
    }

    private record RecordedEvent(long position, EventEnvelope event) {
    }

    private static final class StreamCursor {

        private final List<RecordedEvent> events;
        private int position;
        private Instant headTimestamp;

        StreamCursor(List<RecordedEvent> events) {
            this.events = events;
            this.headTimestamp = Instant.parse(events.get(0).event().timestamp());
        }

        RecordedEvent head() {
            return events.get(position);
        }

        Instant headTimestamp() {
            return headTimestamp;
        }

        boolean advance() {
            position++;
            if (position >= events.size()) {
                return false;
            }
            headTimestamp = Instant.parse(events.get(position).event().timestamp());
            return true;
        }
    }
}
