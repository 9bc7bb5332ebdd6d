package io.toolbridge.transport.http;

import io.toolbridge.core.source.HttpEndpoint;
import io.toolbridge.core.source.SourceAuth;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The endpoint a single call goes to: the source's endpoint with the tool's own call template laid over it.
 */
record HttpTarget(
    String url,
    String method,
    String contentType,
    SourceAuth auth,
    Map<String, String> headers,
    String bodyField,
    List<String> headerFields
) {
    static HttpTarget of(HttpEndpoint endpoint) {
        return new HttpTarget(endpoint.url(), endpoint.httpMethod(), endpoint.contentType(), endpoint.auth(),
            endpoint.headers(), endpoint.bodyField(), endpoint.headerFields());
    }

    static HttpTarget of(HttpEndpoint endpoint, Map<String, Object> callTemplate) {
        HttpTarget base = of(endpoint);
        if (callTemplate == null || callTemplate.isEmpty()) {
            return base;
        }
        Map<String, String> headers = new LinkedHashMap<>(base.headers());
        if (callTemplate.get("headers") instanceof Map<?, ?> extra) {
            extra.forEach((k, v) -> headers.put(String.valueOf(k), String.valueOf(v)));
        }
        List<String> headerFields = base.headerFields();
        if (callTemplate.get("header_fields") instanceof List<?> fields) {
            headerFields = new ArrayList<>();
            for (Object field : fields) {
                headerFields.add(String.valueOf(field));
            }
        }
        return new HttpTarget(
            text(callTemplate, "url", base.url()),
            text(callTemplate, "http_method", base.method()).toUpperCase(Locale.ROOT),
            text(callTemplate, "content_type", base.contentType()),
            base.auth(),
            headers,
            text(callTemplate, "body_field", base.bodyField()),
            headerFields
        );
    }

    boolean sendsBody() {
        return method.equals("POST") || method.equals("PUT") || method.equals("PATCH");
    }

    private static String text(Map<String, Object> template, String key, String fallback) {
        Object value = template.get(key);
        return value instanceof String text && !text.isBlank() ? text : fallback;
    }
}
