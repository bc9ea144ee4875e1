package com.openforge.docrouter.routing.dto;

import jakarta.validation.Valid;

import java.util.List;

public record EmailMessage(
        String sender,
        String subject,
        String body,
        @Valid List<Attachment> attachments
) {

    public EmailMessage {
        attachments = attachments == null ? List.of() : attachments;
    }
}
