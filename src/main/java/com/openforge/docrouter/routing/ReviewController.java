package com.openforge.docrouter.routing;

import com.openforge.docrouter.domain.ReviewItem;
import com.openforge.docrouter.routing.dto.ReviewResolutionRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Human review queue.
 *
 *   GET  /api/review               - pending items, oldest first
 *   POST /api/review/{id}/resolve  - store (with corrected asset + category) or discard
 */
@RestController
@RequestMapping("/api/review")
@RequiredArgsConstructor
public class ReviewController {

    private final ReviewQueueService reviewQueue;

    @GetMapping
    public List<ReviewItem> pending() {
        return reviewQueue.pending();
    }

    @PostMapping("/{id}/resolve")
    public ReviewItem resolve(@PathVariable Long id, @Valid @RequestBody ReviewResolutionRequest request) {
        return reviewQueue.resolve(id, request);
    }
}
