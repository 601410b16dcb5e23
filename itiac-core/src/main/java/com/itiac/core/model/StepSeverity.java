package com.itiac.core.model;

/**
 * How badly an impacted workflow step is hit.
 */
public enum StepSeverity {
    /** At least one alternative component is still online; the step is degraded */
    WARNING,

    /** No online alternative; the step is blocked */
    ERROR
}
