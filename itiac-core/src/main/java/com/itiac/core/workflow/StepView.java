package com.itiac.core.workflow;

/**
 * Which steps of an affected workflow a caller wants to see. Purely a presentation choice;
 * it never changes which steps are impacted.
 */
public enum StepView {
    /** Every step in order */
    ALL,

    /** Only impacted steps */
    IMPACTED_ONLY,

    /** Impacted steps plus their immediate predecessor and successor */
    IMPACTED_WITH_CONTEXT
}
