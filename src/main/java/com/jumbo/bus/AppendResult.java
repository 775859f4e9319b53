package com.jumbo.bus;

/**
 * Where a freshly appended envelope landed. {@code seq} equals the envelope's version inside its
 * stream; {@code position} is its place in the global log across all streams.
 */
public record AppendResult(String aggregateId, long seq, long position) {

    public long nextExpectedVersion() {
        return seq + 1;
    }
}
