package com.openforge.docrouter.knowledge;

import java.util.List;

/**
 * Result of one pass through the deduplication gate.
 *
 * @param factId      id of the stored fact that is now authoritative for the key
 * @param conflictIds conflict records written by this ingest (empty when none)
 */
public record IngestResult(IngestOutcome outcome, Long factId, List<Long> conflictIds, String rationale) {

    public static IngestResult of(IngestOutcome outcome, Long factId, String rationale) {
        return new IngestResult(outcome, factId, List.of(), rationale);
    }
}
