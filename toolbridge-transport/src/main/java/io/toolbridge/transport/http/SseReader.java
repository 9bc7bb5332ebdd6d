package io.toolbridge.transport.http;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import okio.BufferedSource;

/**
 * Minimal {@code text/event-stream} reader: collects {@code event}, {@code data} and {@code id} fields and
 * emits an event at each blank line.
 */
public final class SseReader {

    private SseReader() {
    }

    public static List<SseEvent> readAll(BufferedSource source) throws IOException {
        List<SseEvent> events = new ArrayList<>();
        String event = null;
        String id = null;
        StringBuilder data = null;

        String line;
        while ((line = source.readUtf8Line()) != null) {
            if (line.isEmpty()) {
                if (data != null) {
                    events.add(new SseEvent(event == null ? "message" : event, data.toString(), id));
                }
                event = null;
                data = null;
                continue;
            }
            if (line.startsWith(":")) {
                continue;
            }
            int colon = line.indexOf(':');
            String field = colon < 0 ? line : line.substring(0, colon);
            String value = colon < 0 ? "" : line.substring(colon + 1);
            if (value.startsWith(" ")) {
                value = value.substring(1);
            }
            switch (field) {
                case "event" -> event = value;
                case "id" -> id = value;
                case "data" -> {
                    if (data == null) {
                        data = new StringBuilder(value);
                    } else {
                        data.append('\n').append(value);
                    }
                }
                default -> {
                    // retry and unknown fields are ignored
                }
            }
        }
        if (data != null) {
            events.add(new SseEvent(event == null ? "message" : event, data.toString(), id));
        }
        return events;
    }
}
