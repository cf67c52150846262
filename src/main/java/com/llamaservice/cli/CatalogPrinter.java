package com.llamaservice.cli;

import com.llamaservice.model.CatalogEntry;

import java.io.PrintWriter;
import java.util.List;

final class CatalogPrinter {

    private CatalogPrinter() {
    }

    static void print(PrintWriter out, List<CatalogEntry> entries) {
        if (entries.isEmpty()) {
            out.println("No models found");
            return;
        }
        for (CatalogEntry entry : entries) {
            String size = entry.descriptor().sizeGb() != null ? " (" + entry.descriptor().sizeGb() + "GB)" : "";
            out.println((entry.verified() ? "[verified] " : "[unverified] ") + entry.name() + size);
            out.println("   " + entry.descriptor().description());
            out.println("   Tags: " + String.join(", ", entry.tags()));
            out.println("   Popularity: " + entry.popularity() + "/100");
        }
    }
}
