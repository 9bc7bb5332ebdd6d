package io.toolbridge.core.source;

import java.util.List;
import java.util.Map;

/**
 * Fields shared by the HTTP-family sources (plain HTTP, SSE and streamable HTTP).
 */
public interface HttpEndpoint {
    String name();

    String url();

    String httpMethod();

    String contentType();

    SourceAuth auth();

    Map<String, String> headers();

    String bodyField();

    List<String> headerFields();
}
