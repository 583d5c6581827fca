package com.project.pvb.core.event;

import com.project.pvb.core.model.Address;
import com.project.pvb.core.model.DataHash;
import com.project.pvb.core.model.DeviceId;
import com.project.pvb.core.model.Submission;

import java.time.Instant;

/**
 * Emitted once a submission has been committed.
 */
public record DataSubmitted(
        DataHash dataHash,
        DeviceId deviceId,
        Address verifierAddress,
        Instant timestamp,
        String dataUri,
        long sequenceNumber
) {

    public static DataSubmitted of(Submission submission) {
        return new DataSubmitted(
                submission.dataHash(),
                submission.deviceId(),
                submission.verifierAddress(),
                submission.timestamp(),
                submission.dataUri(),
                submission.sequenceNumber()
        );
    }
}
