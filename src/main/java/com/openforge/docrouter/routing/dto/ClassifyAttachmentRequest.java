package com.openforge.docrouter.routing.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Body of POST /api/routing/attachments: the email context plus the one
 * attachment to route.
 */
public record ClassifyAttachmentRequest(
        String sender,
        String subject,
        String body,
        @Valid @NotNull Attachment attachment
) {

    public EmailMessage email() {
        return new EmailMessage(sender, subject, body, List.of(attachment));
    }
}
