package com.llamaservice.service;

import org.springframework.context.ApplicationEvent;

/**
 * Published for every progress step of a model setup.
 */
public class ModelProgressEvent extends ApplicationEvent {

    private final String modelName;
    private final double percent;
    private final String stage;

    public ModelProgressEvent(Object source, String modelName, double percent, String stage) {
        super(source);
        this.modelName = modelName;
        this.percent = percent;
        this.stage = stage;
    }

    public String getModelName() {
        return modelName;
    }

    public double getPercent() {
        return percent;
    }

    public String getStage() {
        return stage;
    }

    public boolean isTerminal() {
        return ModelLifecycleService.STAGE_READY.equals(stage) || ModelLifecycleService.STAGE_FAILED.equals(stage);
    }
}
