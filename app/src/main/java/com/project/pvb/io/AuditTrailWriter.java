package com.project.pvb.io;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.project.pvb.core.model.AuditPage;
import com.project.pvb.core.model.Submission;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Writes audit trail pages to JSON files for external review.
 * One file per page, named after the covered sequence range.
 */
public class AuditTrailWriter {

    private final Path outputDirectory;

    public AuditTrailWriter(Path outputDirectory) {
        this.outputDirectory = outputDirectory;
    }

    public Path write(AuditPage page) throws IOException {
        Files.createDirectories(outputDirectory);

        Path target = outputDirectory.resolve(buildFileName(page));
        LedgerJson.mapper().writerWithDefaultPrettyPrinter().writeValue(target.toFile(), toJson(page));
        return target;
    }

    private String buildFileName(AuditPage page) {
        return String.format("audit-%d-%d.json", page.startIndex(), page.endIndex());
    }

    ObjectNode toJson(AuditPage page) {
        ObjectNode root = LedgerJson.mapper().createObjectNode();
        root.put("submissionCount", page.totalSubmissions());
        root.put("startIndex", page.startIndex());
        root.put("returnedCount", page.returnedCount());
        root.put("exportedAt", Instant.now().toString());
        ArrayNode submissions = root.putArray("submissions");
        for (Submission submission : page.submissions()) {
            submissions.add(LedgerJson.toJson(submission));
        }
        return root;
    }
}
