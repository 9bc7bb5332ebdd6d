package io.toolbridge.core.tool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.toolbridge.core.error.ErrorKind;
import io.toolbridge.core.error.ToolAdapterException;
import io.toolbridge.core.model.AdaptedTool;
import io.toolbridge.core.model.RawTool;
import io.toolbridge.core.source.HttpSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AdaptedToolHandleTest {
    private static final Map<String, Object> SCHEMA = Map.of("type", "object", "properties", Map.of());
    private final AdaptedTool tool = new AdaptedTool("find_pets", "Find pets by status", SCHEMA,
        RawTool.of("find-pets", "Find pets by status", SCHEMA, HttpSource.of("petstore", "http://localhost")));

    @Test
    void exposesAdaptedMetadata() {
        AdaptedToolHandle handle = new AdaptedToolHandle(tool, (name, args) -> null);

        assertThat(handle.name()).isEqualTo("find_pets");
        assertThat(handle.description()).isEqualTo("Find pets by status");
        assertThat(handle.schema()).isEqualTo(SCHEMA);
        assertThat(handle.adaptedTool()).isSameAs(tool);
    }

    @Test
    void invokesByAdaptedName() {
        List<String> names = new ArrayList<>();
        AdaptedToolHandle handle = new AdaptedToolHandle(tool, (name, args) -> {
            names.add(name);
            return List.of(Map.of("id", 1, "status", args.get("status")));
        });

        ToolResult result = handle.run(new ToolUse("use-7", "find_pets", Map.of("status", "sold")));

        assertThat(names).containsExactly("find_pets");
        assertThat(result.isError()).isFalse();
        assertThat(result.text()).contains("\"status\" : \"sold\"");
        assertThat(result.toMap()).containsEntry("status", "success")
            .containsEntry("content", List.of(Map.of("text", result.text())));
    }

    @Test
    void adapterErrorsBecomeErrorResults() {
        AdaptedToolHandle handle = new AdaptedToolHandle(tool, (name, args) -> {
            throw ToolAdapterException.toolNotFound(name);
        });

        ToolResult result = handle.run(new ToolUse("use-8", "find_pets", null));

        assertThat(result.isError()).isTrue();
        assertThat(result.text()).isEqualTo("Error: Unknown tool: find_pets");
        assertThat(result.status().wireName()).isEqualTo("error");
    }

    @Test
    void formatsScalarResultsVerbatim() {
        assertThat(AdaptedToolHandle.format(null)).isEmpty();
        assertThat(AdaptedToolHandle.format("plain text")).isEqualTo("plain text");
        assertThat(AdaptedToolHandle.format(42)).isEqualTo("42");
        assertThat(AdaptedToolHandle.format(true)).isEqualTo("true");
    }

    @Test
    void errorKindSurvivesForDirectInvoke() {
        AdaptedToolHandle handle = new AdaptedToolHandle(tool, (name, args) -> {
            throw new ToolAdapterException(ErrorKind.LIFECYCLE_ERROR, "stopped");
        });

        assertThatThrownBy(() -> handle.invoke(Map.of()))
            .isInstanceOfSatisfying(ToolAdapterException.class,
                e -> assertThat(e.kind()).isEqualTo(ErrorKind.LIFECYCLE_ERROR));
    }
}
