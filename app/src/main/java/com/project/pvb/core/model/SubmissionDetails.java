package com.project.pvb.core.model;

/**
 * A ledger record joined with the registry's current view of its device and verifier.
 * The verifier here may differ from {@link Submission#verifierAddress()} only if the registry was repointed.
 */
public record SubmissionDetails(Submission submission, Device device, Verifier verifier) {
}
