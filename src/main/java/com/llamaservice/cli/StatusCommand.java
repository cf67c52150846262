package com.llamaservice.cli;

import com.llamaservice.dto.ActiveModelStatus;
import com.llamaservice.service.ModelLifecycleService;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "status", description = "Show the active model")
class StatusCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    private final ModelLifecycleService lifecycleService;

    StatusCommand(ModelLifecycleService lifecycleService) {
        this.lifecycleService = lifecycleService;
    }

    @Override
    public Integer call() {
        ActiveModelStatus status = lifecycleService.status();
        PrintWriter out = spec.commandLine().getOut();
        out.println("Model: " + (status.model() != null ? status.model() : "None"));
        out.println("Status: " + (status.state() != null ? status.state().wireValue() : "No model"));
        out.println("Ready: " + (status.ready() ? "yes" : "no"));
        return 0;
    }
}
