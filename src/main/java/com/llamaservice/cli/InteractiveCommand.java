package com.llamaservice.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;

/**
 * Line-oriented shell over the setup, generate, status and list commands.
 * Each line runs against the sibling subcommand, so output and exit codes
 * match the one-shot invocations. Ends on exit, quit or end of input.
 */
@Command(name = "interactive", description = "Start an interactive session")
class InteractiveCommand implements Callable<Integer> {

    static final String PROMPT = "llama> ";

    @Spec
    CommandSpec spec;

    InputStream in = System.in;

    @Override
    public Integer call() throws IOException {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Llama model service interactive mode");
        out.println("Type \"help\" for available commands or \"exit\" to quit");

        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        while (true) {
            out.print(PROMPT);
            out.flush();
            String line = reader.readLine();
            if (line == null) {
                out.println();
                break;
            }
            String input = line.trim();
            if (input.isEmpty()) {
                continue;
            }
            if (input.equals("exit") || input.equals("quit")) {
                break;
            }
            dispatch(input, out);
        }
        out.println("Goodbye!");
        return 0;
    }

    private void dispatch(String input, PrintWriter out) {
        int space = input.indexOf(' ');
        String command = space < 0 ? input : input.substring(0, space);
        String argument = space < 0 ? "" : input.substring(space + 1).trim();

        switch (command) {
            case "help":
                printHelp(out);
                break;
            case "setup":
                if (argument.isEmpty()) {
                    out.println("Usage: setup <model>");
                } else {
                    sibling("setup").execute(argument);
                }
                break;
            case "generate":
                if (argument.isEmpty()) {
                    out.println("Usage: generate <prompt>");
                } else {
                    sibling("generate").execute("-p", argument);
                }
                break;
            case "status":
            case "list":
                sibling(command).execute();
                break;
            default:
                out.println("Unknown command: " + command + ". Type \"help\" for available commands.");
        }
        out.flush();
    }

    private CommandLine sibling(String name) {
        return spec.parent().subcommands().get(name);
    }

    private static void printHelp(PrintWriter out) {
        out.println("Available commands:");
        out.println("  setup <model>      Download (if needed) and load a model");
        out.println("  generate <prompt>  Generate text with the active model");
        out.println("  status             Show the active model");
        out.println("  list               List stored models and their states");
        out.println("  help               Show this help");
        out.println("  exit, quit         Leave interactive mode");
    }
}
