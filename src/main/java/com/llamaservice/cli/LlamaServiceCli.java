package com.llamaservice.cli;

import com.llamaservice.LlamaServiceApplication;
import org.springframework.boot.Banner;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ConfigurableApplicationContext;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Command-line front end. Starts the Spring context without the web server
 * and runs one subcommand against the same services the REST API uses.
 */
@Command(
        name = "llama-service",
        version = "1.0.0",
        description = "Download, load and run text generation models",
        mixinStandardHelpOptions = true,
        subcommands = {
                SetupCommand.class,
                GenerateCommand.class,
                StatusCommand.class,
                ListCommand.class,
                SearchCommand.class,
                RegistryCommand.class,
                HealthCommand.class,
                InteractiveCommand.class
        },
        footerHeading = "%nExamples:%n",
        footer = {
                "  llama-service setup gpt2-small",
                "  llama-service generate -m gpt2-small -p \"Once upon a time\" -t 50",
                "  llama-service registry -t text-generation",
                "  llama-service interactive",
                ""
        })
public class LlamaServiceCli implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    public static void main(String[] args) {
        LlamaServiceApplication.prepareDataDirectory();
        int exitCode;
        try (ConfigurableApplicationContext context = new SpringApplicationBuilder(LlamaServiceApplication.class)
                .web(WebApplicationType.NONE)
                .bannerMode(Banner.Mode.OFF)
                .logStartupInfo(false)
                .run()) {
            exitCode = commandLine(context).execute(args);
        }
        System.exit(exitCode);
    }

    static CommandLine commandLine(ApplicationContext context) {
        return new CommandLine(LlamaServiceCli.class, new SpringCommandFactory(context));
    }
}
