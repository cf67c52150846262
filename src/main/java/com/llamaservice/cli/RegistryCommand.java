package com.llamaservice.cli;

import com.llamaservice.model.CatalogEntry;
import com.llamaservice.service.ModelCatalog;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "registry", description = "Show the model catalog")
class RegistryCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Option(names = { "-t", "--tag" }, description = "Only entries with this tag")
    String tag;

    @Option(names = { "-v", "--verified" }, description = "Only verified entries")
    boolean verifiedOnly;

    private final ModelCatalog catalog;

    RegistryCommand(ModelCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public Integer call() {
        List<CatalogEntry> entries;
        if (tag != null) {
            entries = catalog.byTag(tag);
        } else if (verifiedOnly) {
            entries = catalog.verifiedOnly();
        } else {
            entries = catalog.all();
        }
        spec.commandLine().getOut().println("Model registry (" + entries.size() + " models):");
        CatalogPrinter.print(spec.commandLine().getOut(), entries);
        return 0;
    }
}
