package com.phodal.anthropicbridge.stream;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits arbitrarily chunked SSE text into raw event records delimited by a blank line.
 * <p>
 * Keeps the unterminated tail between calls. One instance per stream; not thread-safe.
 */
public class SseFramer {

    private static final String DELIMITER = "\n\n";

    private final StringBuilder buffer = new StringBuilder();

    /**
     * Adds a fragment and returns every record completed by it, in arrival order
     */
    public List<String> feed(String fragment) {
        if (fragment == null || fragment.isEmpty()) {
            return List.of();
        }
        buffer.append(fragment);
        normalizeLineEndings();

        List<String> records = new ArrayList<>();
        int start = 0;
        int end;
        while ((end = buffer.indexOf(DELIMITER, start)) >= 0) {
            records.add(buffer.substring(start, end));
            start = end + DELIMITER.length();
        }
        buffer.delete(0, start);
        return records;
    }

    /**
     * Length of the buffered, not yet delimited tail. It is dropped when the source ends.
     */
    public int pendingLength() {
        return buffer.length();
    }

    // CRLF servers; a lone trailing '\r' waits for the next fragment
    private void normalizeLineEndings() {
        int i;
        while ((i = buffer.indexOf("\r\n")) >= 0) {
            buffer.deleteCharAt(i);
        }
    }
}
