package io.toolbridge.core.source;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One configured tool source (a call template). Each protocol kind has its own record carrying only the
 * fields that kind needs; instances are immutable and compared by identity wherever a live session is tracked.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "call_template_type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = HttpSource.class, name = "http"),
    @JsonSubTypes.Type(value = SseSource.class, name = "sse"),
    @JsonSubTypes.Type(value = StreamableHttpSource.class, name = "streamable_http"),
    @JsonSubTypes.Type(value = CliSource.class, name = "cli"),
    @JsonSubTypes.Type(value = GraphQlSource.class, name = "graphql"),
    @JsonSubTypes.Type(value = McpSource.class, name = "mcp"),
    @JsonSubTypes.Type(value = TcpSource.class, name = "tcp"),
    @JsonSubTypes.Type(value = UdpSource.class, name = "udp"),
    @JsonSubTypes.Type(value = TextSource.class, name = "text")
})
public sealed interface SourceDescriptor
    permits HttpSource, SseSource, StreamableHttpSource, CliSource, GraphQlSource, McpSource, TcpSource, UdpSource, TextSource {

    String name();

    @JsonIgnore
    ProtocolKind kind();
}
