package com.llamaservice.cli;

import com.llamaservice.model.ModelRecord;
import com.llamaservice.repository.PersistenceException;
import com.llamaservice.service.ModelLifecycleService;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "list", description = "List stored models and their states")
class ListCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    private final ModelLifecycleService lifecycleService;

    ListCommand(ModelLifecycleService lifecycleService) {
        this.lifecycleService = lifecycleService;
    }

    @Override
    public Integer call() {
        List<ModelRecord> records;
        try {
            records = lifecycleService.listModels();
        } catch (PersistenceException e) {
            spec.commandLine().getErr().println("Cannot read models: " + e.getMessage());
            return 1;
        }

        PrintWriter out = spec.commandLine().getOut();
        if (records.isEmpty()) {
            out.println("No models found");
            return 0;
        }
        for (ModelRecord record : records) {
            out.println(record.getName() + " (" + record.getState().wireValue() + ")");
            out.println("   " + record.getDescriptor().description());
            if (record.getErrorMessage() != null) {
                out.println("   error: " + record.getErrorMessage());
            }
        }
        return 0;
    }
}
