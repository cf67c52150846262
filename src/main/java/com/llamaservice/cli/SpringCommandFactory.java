package com.llamaservice.cli;

import org.springframework.context.ApplicationContext;
import picocli.CommandLine;

/**
 * Creates picocli commands as Spring beans so they get constructor injection.
 */
class SpringCommandFactory implements CommandLine.IFactory {

    private final ApplicationContext context;
    private final CommandLine.IFactory fallback = CommandLine.defaultFactory();

    SpringCommandFactory(ApplicationContext context) {
        this.context = context;
    }

    @Override
    public <K> K create(Class<K> cls) throws Exception {
        if (cls.isAnnotationPresent(CommandLine.Command.class)) {
            return context.getAutowireCapableBeanFactory().createBean(cls);
        }
        return fallback.create(cls);
    }
}
