package io.toolbridge.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolbridge.core.source.ProtocolKind;
import io.toolbridge.core.source.SourceDescriptor;
import io.toolbridge.transport.Payloads;
import java.io.IOException;
import okhttp3.OkHttpClient;
import okhttp3.Response;

public final class HttpToolSourceClient extends AbstractHttpToolSourceClient {

    public HttpToolSourceClient(OkHttpClient client, ObjectMapper mapper, HttpAuthenticator authenticator) {
        super(client, mapper, authenticator);
    }

    @Override
    public ProtocolKind kind() {
        return ProtocolKind.HTTP;
    }

    @Override
    protected Object readResult(Response response, SourceDescriptor source) throws IOException {
        return Payloads.decode(bodyText(response), mapper);
    }
}
