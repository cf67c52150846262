package com.llamaservice.model;

/**
 * Thrown when a {@link ModelRecord} is asked to move to a state that is not
 * reachable from its current one.
 */
public class IllegalStateTransitionException extends IllegalStateException {

    private final String modelName;
    private final ModelState from;
    private final ModelState to;

    public IllegalStateTransitionException(String modelName, ModelState from, ModelState to) {
        super("Model " + modelName + " cannot move from " + from.wireValue() + " to " + to.wireValue());
        this.modelName = modelName;
        this.from = from;
        this.to = to;
    }

    public String getModelName() {
        return modelName;
    }

    public ModelState getFrom() {
        return from;
    }

    public ModelState getTo() {
        return to;
    }
}
