package com.jumbo.contract;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

public class EnvelopeValidator {

    private static final Pattern AGGREGATE_ID = Pattern.compile("^[A-Za-z0-9_.:-]+$");
    private static final Pattern EVENT_TYPE = Pattern.compile("^[A-Za-z][A-Za-z0-9_]*$");

    public void validate(EventEnvelope event) {
        if (event == null) {
            throw new ContractViolationException("event cannot be null");
        }
        requireString(event.type(), "type is required");
        if (!EVENT_TYPE.matcher(event.type()).matches()) {
            throw new ContractViolationException("type must be an identifier usable in a file name: " + event.type());
        }

        requireString(event.aggregateId(), "aggregateId is required");
        validateAggregateId(event.aggregateId());

        if (event.version() < 1) {
            throw new ContractViolationException("version must be >= 1, got " + event.version());
        }

        requireString(event.timestamp(), "timestamp is required");
        try {
            Instant.parse(event.timestamp());
        } catch (DateTimeParseException ex) {
            throw new ContractViolationException("timestamp must be an ISO-8601 instant: " + event.timestamp());
        }
    }

    /**
     * Stream ids become directory names, so anything that could escape the events
     * directory is rejected here.
     */
    public void validateAggregateId(String aggregateId) {
        requireString(aggregateId, "aggregateId is required");
        if (!AGGREGATE_ID.matcher(aggregateId).matches() || aggregateId.startsWith(".") || aggregateId.contains("..")) {
            throw new ContractViolationException("aggregateId contains illegal characters: " + aggregateId);
        }
    }

    private static void requireString(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new ContractViolationException(message);
        }
    }
}
