package io.toolbridge.core.catalog;

public record SchemaWarning(String sourceName, String rawName, String message) {
}
