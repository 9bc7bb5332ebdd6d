package io.toolbridge.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolbridge.core.source.ProtocolKind;
import io.toolbridge.core.source.SourceDescriptor;
import io.toolbridge.transport.Payloads;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okio.BufferedSource;

/**
 * Newline-delimited JSON responses are collected chunk by chunk into a list; anything else is decoded whole.
 */
public final class StreamableHttpToolSourceClient extends AbstractHttpToolSourceClient {

    public StreamableHttpToolSourceClient(OkHttpClient client, ObjectMapper mapper, HttpAuthenticator authenticator) {
        super(client, mapper, authenticator);
    }

    @Override
    public ProtocolKind kind() {
        return ProtocolKind.STREAMABLE_HTTP;
    }

    @Override
    protected void prepare(Request.Builder request) {
        request.header("Accept", "application/x-ndjson, application/json");
    }

    @Override
    protected Object readResult(Response response, SourceDescriptor source) throws IOException {
        String contentType = contentType(response);
        if (response.body() == null || !(contentType.contains("ndjson") || contentType.contains("jsonl"))) {
            return Payloads.decode(bodyText(response), mapper);
        }
        List<Object> chunks = new ArrayList<>();
        BufferedSource body = response.body().source();
        String line;
        while ((line = body.readUtf8Line()) != null) {
            if (!line.isBlank()) {
                chunks.add(Payloads.decode(line, mapper));
            }
        }
        return chunks;
    }
}
