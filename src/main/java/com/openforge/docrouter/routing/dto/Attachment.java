package com.openforge.docrouter.routing.dto;

import jakarta.validation.constraints.NotBlank;

/** One attachment; content is base64 in JSON and may be absent for metadata-only routing. */
public record Attachment(
        @NotBlank String filename,
        byte[] content
) {

    public long size() {
        return content == null ? 0 : content.length;
    }
}
