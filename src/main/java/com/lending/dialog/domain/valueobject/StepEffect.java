package com.lending.dialog.domain.valueobject;

/**
 * Side effect triggered when the orchestrator reaches a step.
 */
public enum StepEffect {

    NONE,

    /** Ask the decision gateway for offers built from the application answers */
    GENERATE_OFFERS,

    /** Ask the decision gateway for the final approval or rejection */
    FINAL_DECISION;

    public boolean callsGateway() {
        return this != NONE;
    }
}
