package com.openforge.docrouter.routing;

import com.openforge.docrouter.routing.dto.ClassifyAttachmentRequest;
import com.openforge.docrouter.routing.dto.EmailMessage;
import com.openforge.docrouter.routing.dto.EmailRoutingResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Endpoints:
 *   POST /api/routing/attachments  - route one attachment synchronously
 *   POST /api/routing/emails       - route every attachment of an email on the worker pools
 *
 * Decisions are also broadcast on /topic/routing.
 */
@RestController
@RequestMapping("/api/routing")
@RequiredArgsConstructor
public class RoutingController {

    private final RoutingService         routingService;
    private final EmailProcessingService emailProcessingService;

    @PostMapping("/attachments")
    public RoutingDecision classifyAttachment(@Valid @RequestBody ClassifyAttachmentRequest request) {
        return routingService.classifyAttachment(request.email(), request.attachment());
    }

    @PostMapping("/emails")
    public EmailRoutingResult processEmail(@Valid @RequestBody EmailMessage email) {
        return emailProcessingService.processEmail(email);
    }
}
