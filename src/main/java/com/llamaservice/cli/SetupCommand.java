package com.llamaservice.cli;

import com.llamaservice.dto.SetupResult;
import com.llamaservice.service.ModelLifecycleService;
import com.llamaservice.service.SetupProgressListener;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "setup", description = "Download (if needed) and load a model")
class SetupCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", paramLabel = "<model>", description = "Catalog name, e.g. gpt2-small")
    String modelName;

    private final ModelLifecycleService lifecycleService;

    SetupCommand(ModelLifecycleService lifecycleService) {
        this.lifecycleService = lifecycleService;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Setting up model: " + modelName);
        SetupResult result = lifecycleService.setup(modelName, new ProgressPrinter(out));
        if (!result.success()) {
            spec.commandLine().getErr().println("Setup failed: " + result.error());
            return 1;
        }
        out.println("Model " + modelName + " is ready");
        return 0;
    }

    /**
     * Prints one line per stage change or whole-percent step.
     */
    static final class ProgressPrinter implements SetupProgressListener {

        private final PrintWriter out;
        private String lastLine;

        ProgressPrinter(PrintWriter out) {
            this.out = out;
        }

        @Override
        public void onProgress(double percent, String stage) {
            String line = "  " + stage + " (" + Math.round(percent) + "%)";
            if (!line.equals(lastLine)) {
                out.println(line);
                out.flush();
                lastLine = line;
            }
        }
    }
}
