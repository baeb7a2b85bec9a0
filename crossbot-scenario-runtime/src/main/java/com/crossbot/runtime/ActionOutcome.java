package com.crossbot.runtime;

/**
 * Result of a side-effecting action reported back by the caller.
 */
public enum ActionOutcome {
    /** Action completed successfully (operator accepted, mail sent). */
    SUCCEEDED,
    /** Action failed or was declined. */
    FAILED,
    /** Form submitted or action finished without a success/failure distinction. */
    COMPLETED
}
