package com.llamaservice.cli;

import com.llamaservice.service.ModelCatalog;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Command(name = "search", description = "Search the model catalog")
class SearchCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", paramLabel = "<query>", description = "Matched against name, description and tags")
    String query;

    private final ModelCatalog catalog;

    SearchCommand(ModelCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public Integer call() {
        spec.commandLine().getOut().println("Search results for \"" + query + "\":");
        CatalogPrinter.print(spec.commandLine().getOut(), catalog.search(query));
        return 0;
    }
}
