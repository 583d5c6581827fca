package com.project.pvb.core.event;

/**
 * Subscriber for ledger notifications. Callbacks run on the submitting thread,
 * in commit order, after the submission is durable in the ledger.
 */
public interface SubmissionListener {

    default void onDataSubmitted(DataSubmitted event) {
    }

    default void onSubmissionVerified(SubmissionVerified event) {
    }
}
