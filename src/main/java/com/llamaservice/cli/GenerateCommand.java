package com.llamaservice.cli;

import com.llamaservice.dto.GenerationResult;
import com.llamaservice.dto.SetupResult;
import com.llamaservice.model.GenerationRequest;
import com.llamaservice.model.GenerationResponse;
import com.llamaservice.service.ModelLifecycleService;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

@Command(name = "generate", description = "Generate text with a model")
class GenerateCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Option(names = { "-p", "--prompt" }, description = "Text prompt (read from stdin when omitted)")
    String prompt;

    @Option(names = { "-t", "--tokens" }, description = "Max tokens (default: ${DEFAULT-VALUE})", defaultValue = "100")
    int maxTokens;

    @Option(names = "--temperature", description = "Sampling temperature (default: ${DEFAULT-VALUE})",
            defaultValue = "0.7")
    double temperature;

    @Option(names = { "-m", "--model" }, description = "Set up this model first")
    String modelName;

    private final ModelLifecycleService lifecycleService;

    GenerateCommand(ModelLifecycleService lifecycleService) {
        this.lifecycleService = lifecycleService;
    }

    @Override
    public Integer call() throws IOException {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (modelName != null) {
            SetupResult setup = lifecycleService.setup(modelName, new SetupCommand.ProgressPrinter(out));
            if (!setup.success()) {
                err.println("Setup failed: " + setup.error());
                return 1;
            }
        }

        String text = prompt != null ? prompt : readPrompt();
        if (text == null || text.isBlank()) {
            err.println("Generation failed: prompt cannot be empty");
            return 1;
        }

        GenerationRequest request = new GenerationRequest(text);
        request.setMaxTokens(maxTokens);
        request.setTemperature(temperature);
        GenerationResult result = lifecycleService.generate(request);
        if (!result.success()) {
            err.println("Generation failed: " + result.error());
            return 1;
        }

        GenerationResponse response = result.response();
        out.println(response.text());
        out.println();
        out.println("Tokens: " + response.tokensUsed() + ", Time: " + response.processingTimeMs() + "ms");
        return 0;
    }

    private String readPrompt() throws IOException {
        spec.commandLine().getOut().println("Enter your prompt (end with Ctrl-D):");
        spec.commandLine().getOut().flush();
        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        return reader.lines().collect(Collectors.joining("\n")).trim();
    }
}
