package com.llamaservice.cli;

import com.llamaservice.dto.HealthStatusDto;
import com.llamaservice.service.HealthReporter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "health", description = "Show detailed health information")
class HealthCommand implements Callable<Integer> {

    private static final long MB = 1024L * 1024L;

    @Spec
    CommandSpec spec;

    private final HealthReporter healthReporter;

    HealthCommand(HealthReporter healthReporter) {
        this.healthReporter = healthReporter;
    }

    @Override
    public Integer call() {
        HealthStatusDto report = healthReporter.report();
        PrintWriter out = spec.commandLine().getOut();
        out.println("Status: " + report.getStatus());
        out.println("Uptime: " + report.getUptimeMs() / 1000 + "s");
        out.printf("Memory: %dMB / %dMB (%.1f%%)%n", report.getMemory().getUsed() / MB,
                report.getMemory().getTotal() / MB, report.getMemory().getPercentage());
        out.println("Models: " + report.getModels().getLoaded() + " loaded / " + report.getModels().getTotal()
                + " total");
        if (report.getModels().getCurrent() != null) {
            out.println("Current model: " + report.getModels().getCurrent());
        }
        if (report.getLastError() != null) {
            out.println("Last error: " + report.getLastError());
        }
        return report.getStatus() == HealthStatusDto.Status.UNHEALTHY ? 1 : 0;
    }
}
