package com.project.pvb.core.model;

import java.util.List;

/**
 * One slice of the global submission history.
 *
 * @param totalSubmissions committed submissions when the slice was taken.
 * @param startIndex       sequence number of the first returned record.
 * @param returnedCount    number of records in this page.
 * @param submissions      records in sequence order.
 */
public record AuditPage(
        long totalSubmissions,
        long startIndex,
        int returnedCount,
        List<Submission> submissions
) {

    public AuditPage {
        submissions = List.copyOf(submissions);
    }

    public long endIndex() {
        return startIndex + returnedCount;
    }

    public boolean hasMore() {
        return endIndex() < totalSubmissions;
    }
}
