package com.openforge.docrouter.knowledge;

import com.openforge.docrouter.domain.ConflictRecord;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Endpoints:
 *   GET  /api/conflicts               - pending conflict records, oldest first
 *   POST /api/conflicts/{id}/resolve  - settle a conflict; every record written
 *                                       by the same ingest is settled with it
 */
@Slf4j
@RestController
@RequestMapping("/api/conflicts")
@RequiredArgsConstructor
public class ConflictController {

    private final ConflictReviewService conflictReviewService;

    @GetMapping
    public List<ConflictRecord> getPendingConflicts() {
        return conflictReviewService.getPendingConflicts();
    }

    @PostMapping("/{id}/resolve")
    public List<ConflictRecord> resolveConflict(@PathVariable Long id,
                                                @Valid @RequestBody ConflictResolutionRequest request) {
        log.info("[Controller] Resolving conflict {} as {}", id, request.resolution());
        return conflictReviewService.resolveConflict(id, request.resolution(), request.resolvedBy());
    }
}
