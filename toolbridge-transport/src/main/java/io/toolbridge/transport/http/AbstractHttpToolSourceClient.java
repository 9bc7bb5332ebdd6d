package io.toolbridge.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolbridge.core.error.InvocationFailure;
import io.toolbridge.core.model.RawTool;
import io.toolbridge.core.source.HttpEndpoint;
import io.toolbridge.core.source.SourceDescriptor;
import io.toolbridge.core.spi.ToolSession;
import io.toolbridge.core.spi.ToolSourceClient;
import io.toolbridge.core.spi.ToolSourceException;
import io.toolbridge.transport.Payloads;
import io.toolbridge.transport.TransportErrors;
import io.toolbridge.transport.manual.ManualParser;
import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import okhttp3.FormBody;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Shared request plumbing for the HTTP-family sources. Discovery fetches the manual from the source URL;
 * invocation maps arguments onto path placeholders, header fields, the query string and the body.
 */
public abstract class AbstractHttpToolSourceClient implements ToolSourceClient {
    private static final MediaType JSON = MediaType.get("application/json");
    private static final Pattern PATH_PARAM = Pattern.compile("\\{([^{}/]+)}");

    protected final OkHttpClient client;
    protected final ObjectMapper mapper;
    private final HttpAuthenticator authenticator;
    private final ManualParser manualParser;

    protected AbstractHttpToolSourceClient(OkHttpClient client, ObjectMapper mapper, HttpAuthenticator authenticator) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.authenticator = Objects.requireNonNull(authenticator, "authenticator must not be null");
        this.manualParser = new ManualParser(mapper);
    }

    @Override
    public List<RawTool> discover(SourceDescriptor source, ToolSession session) throws ToolSourceException {
        HttpTarget target = HttpTarget.of(endpoint(source));
        HttpUrl.Builder url = parseUrl(target.url(), source).newBuilder();
        Request.Builder request = new Request.Builder();
        target.headers().forEach(request::header);
        authenticator.authorize(target.auth(), url, request);
        request.url(url.build()).method(target.method(), target.sendsBody() ? RequestBody.create("{}", JSON) : null);
        prepare(request);

        try (Response response = client.newCall(request.build()).execute()) {
            if (!response.isSuccessful()) {
                throw ToolSourceException.remote("Source " + source.name() + " answered HTTP " + response.code()
                    + " to the manual request " + Payloads.snippet(bodyText(response)));
            }
            return manualParser.parse(readManual(response), source);
        } catch (IOException e) {
            throw TransportErrors.translate("Manual request to source " + source.name(), e);
        }
    }

    @Override
    public Object invoke(SourceDescriptor source, ToolSession session, RawTool tool, Map<String, Object> arguments)
        throws ToolSourceException {
        HttpTarget target = HttpTarget.of(endpoint(source), tool.callTemplate());
        Map<String, Object> remaining = new LinkedHashMap<>(arguments);

        HttpUrl.Builder url = parseUrl(substitutePath(target.url(), remaining, tool), source).newBuilder();
        Request.Builder request = new Request.Builder();
        target.headers().forEach(request::header);
        for (String field : target.headerFields()) {
            Object value = remaining.remove(field);
            if (value != null) {
                request.header(field, String.valueOf(value));
            }
        }

        RequestBody body = null;
        try {
            if (target.sendsBody()) {
                Object payload = remaining;
                if (target.bodyField() != null) {
                    payload = remaining.remove(target.bodyField());
                    addQuery(url, remaining);
                }
                body = encodeBody(payload, target.contentType());
            } else {
                addQuery(url, remaining);
            }
        } catch (JsonProcessingException e) {
            throw ToolSourceException.malformed("Arguments for tool " + tool.rawName() + " cannot be encoded: "
                + e.getOriginalMessage(), e);
        }
        authenticator.authorize(target.auth(), url, request);
        request.url(url.build()).method(target.method(), body);
        prepare(request);

        try (Response response = client.newCall(request.build()).execute()) {
            if (!response.isSuccessful()) {
                throw ToolSourceException.remote("Tool " + tool.rawName() + " answered HTTP " + response.code()
                    + " " + Payloads.snippet(bodyText(response)));
            }
            return readResult(response, source);
        } catch (IOException e) {
            throw TransportErrors.translate("Call to tool " + tool.rawName() + " on source " + source.name(), e);
        }
    }

    /**
     * Decodes a successful call response.
     */
    protected abstract Object readResult(Response response, SourceDescriptor source) throws IOException, ToolSourceException;

    /**
     * @return the manual text carried by a successful discovery response
     */
    protected String readManual(Response response) throws IOException, ToolSourceException {
        return bodyText(response);
    }

    protected void prepare(Request.Builder request) {
    }

    protected static String bodyText(Response response) throws IOException {
        return response.body() == null ? "" : response.body().string();
    }

    protected static String contentType(Response response) {
        String value = response.header("Content-Type");
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }

    private HttpEndpoint endpoint(SourceDescriptor source) {
        if (source.kind() != kind() || !(source instanceof HttpEndpoint endpoint)) {
            throw new IllegalArgumentException("Source " + source.name() + " is not a " + kind().wireName() + " source");
        }
        return endpoint;
    }

    private static HttpUrl parseUrl(String url, SourceDescriptor source) throws ToolSourceException {
        HttpUrl parsed = HttpUrl.parse(url);
        if (parsed == null) {
            throw ToolSourceException.connection("Source " + source.name() + " has an invalid url: " + url, null);
        }
        return parsed;
    }

    private static String substitutePath(String url, Map<String, Object> remaining, RawTool tool) throws ToolSourceException {
        Matcher matcher = PATH_PARAM.matcher(url);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            if (!remaining.containsKey(name)) {
                throw new ToolSourceException(InvocationFailure.UNKNOWN,
                    "Missing path parameter '" + name + "' for tool " + tool.rawName());
            }
            String value = URLEncoder.encode(String.valueOf(remaining.remove(name)), StandardCharsets.UTF_8).replace("+", "%20");
            matcher.appendReplacement(out, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private void addQuery(HttpUrl.Builder url, Map<String, Object> arguments) throws JsonProcessingException {
        for (Map.Entry<String, Object> entry : arguments.entrySet()) {
            Object value = entry.getValue();
            if (value == null) {
                continue;
            }
            if (value instanceof Collection<?> values) {
                for (Object element : values) {
                    url.addQueryParameter(entry.getKey(), scalar(element));
                }
            } else {
                url.addQueryParameter(entry.getKey(), scalar(value));
            }
        }
    }

    private String scalar(Object value) throws JsonProcessingException {
        if (value instanceof Map<?, ?> || value instanceof Collection<?>) {
            return mapper.writeValueAsString(value);
        }
        return String.valueOf(value);
    }

    private RequestBody encodeBody(Object payload, String contentType) throws JsonProcessingException {
        MediaType mediaType = MediaType.parse(contentType);
        if (mediaType == null) {
            mediaType = JSON;
        }
        if (contentType.startsWith("application/x-www-form-urlencoded") && payload instanceof Map<?, ?> fields) {
            FormBody.Builder form = new FormBody.Builder();
            for (Map.Entry<?, ?> field : fields.entrySet()) {
                if (field.getValue() != null) {
                    form.add(String.valueOf(field.getKey()), scalar(field.getValue()));
                }
            }
            return form.build();
        }
        if (payload == null) {
            return RequestBody.create("", mediaType);
        }
        if (payload instanceof String text && !mediaType.subtype().contains("json")) {
            return RequestBody.create(text, mediaType);
        }
        return RequestBody.create(mapper.writeValueAsString(payload), mediaType);
    }
}
