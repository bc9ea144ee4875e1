package com.openforge.docrouter.knowledge;

import com.openforge.docrouter.domain.ConflictRecord;
import com.openforge.docrouter.domain.ConflictResolution;
import com.openforge.docrouter.repository.ConflictRecordRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/** Human side of conflict handling: list what is pending, settle it. */
@Service
@RequiredArgsConstructor
public class ConflictReviewService {

    private final ConflictRecordRepository repository;
    private final DeduplicationGate        gate;

    public List<ConflictRecord> getPendingConflicts() {
        return repository.findByResolutionOrderByCreateTimeAsc(ConflictResolution.PENDING);
    }

    public List<ConflictRecord> resolveConflict(Long conflictId, ConflictResolution resolution, String resolvedBy) {
        return gate.resolveConflict(conflictId, resolution, resolvedBy == null ? "reviewer" : resolvedBy);
    }
}
