package io.toolbridge.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.toolbridge.core.ToolAdapter;
import io.toolbridge.core.config.ConfigService;
import io.toolbridge.core.spi.ToolSourceRegistry;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class ToolBridgeCommandsTest {

    @TempDir
    Path tempDir;

    private CliContext context;

    @BeforeEach
    void setUp() throws IOException {
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "manual_call_templates": [
                {"name": "notes", "call_template_type": "text", "file_path": "notes.json"},
                {"name": "archive", "call_template_type": "text", "file_path": "archive.json"}
              ]
            }
            """, StandardCharsets.UTF_8);

        ToolSourceRegistry registry = new ToolSourceRegistry().register(new NotesToolSourceClient());
        context = new CliContext(new ConfigService(), configPath, config -> ToolAdapter.create(config, registry));
    }

    @Test
    void shouldListEveryToolWithItsSource() {
        Run run = run(new ListCommand(context));

        assertThat(run.code()).isEqualTo(0);
        assertThat(run.out())
            .contains("get_weather [notes] - Current weather for a city")
            .contains("search_docs [notes] - Full text search over notes")
            .contains("2 tool(s)");
    }

    @Test
    void shouldPrintSchemasWhenRequested() {
        Run run = run(new ListCommand(context), "--schema");

        assertThat(run.code()).isEqualTo(0);
        assertThat(run.out()).contains("\"required\" : [ \"city\" ]");
    }

    @Test
    void shouldSearchByDescription() {
        Run run = run(new SearchCommand(context), "weather");

        assertThat(run.code()).isEqualTo(0);
        assertThat(run.out()).contains("get_weather [notes]").doesNotContain("search_docs");
    }

    @Test
    void shouldReportWhenNothingMatches() {
        Run run = run(new SearchCommand(context), "calendar");

        assertThat(run.code()).isEqualTo(0);
        assertThat(run.out()).contains("No tools match 'calendar'");
    }

    @Test
    void shouldCallToolAndPrintResult() {
        Run run = run(new CallCommand(context), "get_weather", "--args", "{\"city\":\"Harare\"}");

        assertThat(run.code()).isEqualTo(0);
        assertThat(run.out()).contains("\"city\" : \"Harare\"").contains("\"temp\" : 21");
    }

    @Test
    void shouldCallToolByRawName() {
        Run run = run(new CallCommand(context), "search.docs");

        assertThat(run.code()).isEqualTo(1);
        assertThat(run.err()).contains("Error: Tool search_docs failed: index offline");
    }

    @Test
    void shouldRejectArgumentsThatAreNotAnObject() {
        Run run = run(new CallCommand(context), "get_weather", "--args", "[1, 2]");

        assertThat(run.code()).isEqualTo(2);
        assertThat(run.err()).contains("--args is not a JSON object");
    }

    @Test
    void shouldFailForUnknownTool() {
        Run run = run(new CallCommand(context), "nope");

        assertThat(run.code()).isEqualTo(1);
        assertThat(run.err()).contains("Call command failed: Unknown tool: nope");
    }

    @Test
    void shouldShowStatusWithUnreachableSources() {
        Run run = run(new StatusCommand(context));

        assertThat(run.code()).isEqualTo(0);
        assertThat(run.out())
            .contains("Config exists: true")
            .contains("Sources: 2")
            .contains("  notes (text)")
            .contains("Tools: 2")
            .contains("Unreachable sources: 1")
            .contains("  archive: ")
            .contains("Schema warnings: 0");
    }

    @Test
    void shouldUseConfigOverride() throws IOException {
        Path other = tempDir.resolve("other.json");
        Files.writeString(other, """
            {"manual_call_templates": []}
            """, StandardCharsets.UTF_8);

        Run run = run(new ListCommand(context), "--config", other.toString());

        assertThat(run.code()).isEqualTo(0);
        assertThat(run.out()).contains("0 tool(s)");
    }

    @Test
    void shouldListNothingWhenConfigIsMissing() {
        Run run = run(new ListCommand(context), "--config", tempDir.resolve("missing.json").toString());

        assertThat(run.code()).isEqualTo(0);
        assertThat(run.out()).contains("0 tool(s)");
    }

    @Test
    void shouldFailListWhenConfigIsMalformed() throws IOException {
        Path broken = tempDir.resolve("broken.json");
        Files.writeString(broken, "{\"manual_call_templates\": {}}", StandardCharsets.UTF_8);

        Run run = run(new ListCommand(context), "--config", broken.toString());

        assertThat(run.code()).isEqualTo(1);
        assertThat(run.err()).contains("List command failed: manual_call_templates must be an array");
    }

    private static Run run(Object command, String... args) {
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            int code = new CommandLine(command).execute(args);
            return new Run(code, out.toString(StandardCharsets.UTF_8), err.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private record Run(int code, String out, String err) {
    }
}
