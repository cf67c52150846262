package com.llamaservice.cli;

import com.llamaservice.config.AppConfig;
import com.llamaservice.model.GenerationResponse;
import com.llamaservice.service.HealthReporter;
import com.llamaservice.service.ModelAcquirer;
import com.llamaservice.service.ModelActivator;
import com.llamaservice.service.ModelLifecycleService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.ApplicationContext;
import picocli.CommandLine;

import java.io.ByteArrayInputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
class LlamaServiceCliTest {

    @Autowired ApplicationContext context;
    @Autowired AppConfig appConfig;
    @Autowired ModelLifecycleService lifecycleService;
    @Autowired HealthReporter healthReporter;

    @MockBean ModelAcquirer acquirer;
    @MockBean ModelActivator activator;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @BeforeEach
    void resetState() throws Exception {
        when(activator.unload(anyString())).thenReturn(true);
        lifecycleService.unloadActive();
        Files.deleteIfExists(appConfig.getRegistryPath());
        healthReporter.clearError();

        when(acquirer.download(any(), any())).thenReturn(true);
        when(activator.load(any())).thenReturn(true);
        when(activator.generate(any())).thenAnswer(inv -> new GenerationResponse(
                "and they lived happily", 4, 12, "gpt2-small", Instant.now()));
    }

    private int run(String... args) {
        CommandLine cli = LlamaServiceCli.commandLine(context);
        cli.setOut(new PrintWriter(out, true));
        cli.setErr(new PrintWriter(err, true));
        return cli.execute(args);
    }

    @Test
    void setupReportsProgressAndReadiness() {
        int exit = run("setup", "gpt2-small");

        assertThat(exit).isZero();
        assertThat(out.toString())
                .contains("Setting up model: gpt2-small")
                .contains("Model gpt2-small is ready");
    }

    @Test
    void setupOfUnknownModelFails() {
        int exit = run("setup", "no-such-model");

        assertThat(exit).isEqualTo(1);
        assertThat(err.toString()).contains("Setup failed:");
    }

    @Test
    void generateWithoutActiveModelFails() {
        int exit = run("generate", "-p", "Once upon a time");

        assertThat(exit).isEqualTo(1);
        assertThat(err.toString()).contains("Generation failed:");
    }

    @Test
    void generateWithModelOptionSetsUpFirst() {
        int exit = run("generate", "-m", "gpt2-small", "-p", "Once upon a time", "-t", "20");

        assertThat(exit).isZero();
        assertThat(out.toString())
                .contains("and they lived happily")
                .contains("Tokens: 4, Time: 12ms");
    }

    @Test
    void statusShowsNoModelWhenNothingIsActive() {
        run("status");

        assertThat(out.toString()).contains("Model: None").contains("Ready: no");
    }

    @Test
    void listShowsStoredRecordsWithState() {
        run("setup", "distilgpt2");
        out.getBuffer().setLength(0);

        int exit = run("list");

        assertThat(exit).isZero();
        assertThat(out.toString()).contains("distilgpt2 (loaded)");
    }

    @Test
    void registryFiltersByTag() {
        run("registry", "-t", "chat");

        assertThat(out.toString())
                .contains("Model registry (2 models):")
                .contains("llama-7b-chat")
                .contains("dialogpt-medium")
                .doesNotContain("gpt2-small");
    }

    @Test
    void searchMatchesNameAndDescription() {
        run("search", "t5");

        assertThat(out.toString()).contains("flan-t5-small").contains("t5-small").doesNotContain("gpt2-medium");
    }

    @Test
    void healthIsDegradedButNotFailingWithoutModel() {
        int exit = run("health");

        assertThat(exit).isZero();
        assertThat(out.toString()).contains("Status: DEGRADED");
    }

    @Test
    void interactiveSessionRunsCommandsUntilExit() {
        CommandLine cli = LlamaServiceCli.commandLine(context);
        cli.setOut(new PrintWriter(out, true));
        cli.setErr(new PrintWriter(err, true));
        InteractiveCommand session = cli.getSubcommands().get("interactive").getCommand();
        session.in = new ByteArrayInputStream(String.join("\n",
                "help",
                "setup gpt2-small",
                "generate Once upon a time",
                "status",
                "frobnicate",
                "exit",
                "list").getBytes(StandardCharsets.UTF_8));

        int exit = cli.execute("interactive");

        assertThat(exit).isZero();
        assertThat(out.toString())
                .contains("Available commands:")
                .contains("Model gpt2-small is ready")
                .contains("and they lived happily")
                .contains("Model: gpt2-small")
                .contains("Unknown command: frobnicate")
                .contains("Goodbye!")
                .doesNotContain("gpt2-small (loaded)");
    }

    @Test
    void interactiveSessionEndsAtEndOfInput() {
        CommandLine cli = LlamaServiceCli.commandLine(context);
        cli.setOut(new PrintWriter(out, true));
        cli.setErr(new PrintWriter(err, true));
        InteractiveCommand session = cli.getSubcommands().get("interactive").getCommand();
        session.in = new ByteArrayInputStream("generate Hello\n".getBytes(StandardCharsets.UTF_8));

        int exit = cli.execute("interactive");

        assertThat(exit).isZero();
        assertThat(err.toString()).contains("Generation failed:");
        assertThat(out.toString()).contains("Goodbye!");
    }

    @Test
    void unknownSubcommandIsAUsageError() {
        int exit = run("frobnicate");

        assertThat(exit).isEqualTo(2);
    }
}
