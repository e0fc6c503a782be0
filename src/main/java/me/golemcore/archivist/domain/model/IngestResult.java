package me.golemcore.archivist.domain.model;

import lombok.Builder;

import java.util.List;

/**
 * Outcome of ingesting one conversation turn. Rejected input never touches
 * the ledger and carries the rejection reason.
 */
@Builder
public record IngestResult(boolean accepted, String itemId, List<CompressionAction> actions, String rejectionReason) {

    public IngestResult {
        actions = actions != null ? List.copyOf(actions) : List.of();
    }

    public static IngestResult rejected(String reason) {
        return new IngestResult(false, null, List.of(), reason);
    }
}
