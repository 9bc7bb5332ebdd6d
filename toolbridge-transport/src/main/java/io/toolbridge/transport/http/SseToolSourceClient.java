package io.toolbridge.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolbridge.core.source.ProtocolKind;
import io.toolbridge.core.source.SourceDescriptor;
import io.toolbridge.core.source.SseSource;
import io.toolbridge.transport.Payloads;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

/**
 * Calls return the decoded {@code data} payload of every event, filtered by the source's {@code event_type}
 * when one is configured.
 */
public final class SseToolSourceClient extends AbstractHttpToolSourceClient {

    public SseToolSourceClient(OkHttpClient client, ObjectMapper mapper, HttpAuthenticator authenticator) {
        super(client, mapper, authenticator);
    }

    @Override
    public ProtocolKind kind() {
        return ProtocolKind.SSE;
    }

    @Override
    protected void prepare(Request.Builder request) {
        request.header("Accept", "text/event-stream, application/json");
    }

    @Override
    protected Object readResult(Response response, SourceDescriptor source) throws IOException {
        if (!contentType(response).contains("text/event-stream") || response.body() == null) {
            return Payloads.decode(bodyText(response), mapper);
        }
        String eventType = ((SseSource) source).eventType();
        List<Object> payloads = new ArrayList<>();
        for (SseEvent event : SseReader.readAll(response.body().source())) {
            if (eventType == null || eventType.equals(event.event())) {
                payloads.add(Payloads.decode(event.data(), mapper));
            }
        }
        return payloads;
    }

    @Override
    protected String readManual(Response response) throws IOException {
        if (!contentType(response).contains("text/event-stream") || response.body() == null) {
            return bodyText(response);
        }
        for (SseEvent event : SseReader.readAll(response.body().source())) {
            Object decoded = Payloads.decode(event.data(), mapper);
            if (decoded instanceof Map<?, ?> map && map.containsKey("tools")) {
                return event.data();
            }
        }
        return "";
    }
}
