package com.llamaservice.testsupport;

import com.llamaservice.model.GenerationKind;
import com.llamaservice.model.ModelDescriptor;

import java.nio.file.Path;
import java.util.List;

public final class TestModels {
    private TestModels() {}

    public static ModelDescriptor descriptor(String name, Path baseDir) {
        return ModelDescriptor.builder()
                .name(name)
                .acquisitionId("test/" + name)
                .version("1.0.0")
                .description("Test model " + name)
                .localPath(baseDir.resolve(name).toString())
                .kind(GenerationKind.TEXT_GENERATION)
                .sizeGb(0.1)
                .requiredArtifacts(List.of("config.json", "tokenizer.json"))
                .build();
    }
}
