package io.toolbridge.transport.http;

public record SseEvent(String event, String data, String id) {
}
