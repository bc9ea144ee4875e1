package com.openforge.docrouter.routing.dto;

import com.openforge.docrouter.knowledge.IngestOutcome;

public record FeedbackReceipt(
        Long feedbackId,
        IngestOutcome feedbackOutcome,
        Long episodeId,
        IngestOutcome episodeOutcome,
        boolean senderLearned
) {}
