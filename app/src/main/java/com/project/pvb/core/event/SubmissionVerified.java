package com.project.pvb.core.event;

import com.project.pvb.core.model.DataHash;
import com.project.pvb.core.model.DeviceId;
import com.project.pvb.core.model.Submission;

/**
 * Emitted after {@link DataSubmitted} with the signature verification outcome.
 */
public record SubmissionVerified(DataHash dataHash, DeviceId deviceId, boolean isValid) {

    public static SubmissionVerified of(Submission submission) {
        return new SubmissionVerified(submission.dataHash(), submission.deviceId(), submission.verified());
    }
}
