package com.openforge.docrouter.routing;

import com.openforge.docrouter.routing.dto.Attachment;
import lombok.extern.slf4j.Slf4j;

/** Default sink when no file store is wired in: records where documents would go. */
@Slf4j
public class LoggingDocumentSink implements DocumentSink {

    @Override
    public void store(String location, Attachment attachment) {
        log.info("[Sink] {} ({} bytes) → {}", attachment.filename(), attachment.size(), location);
    }

    @Override
    public void relocate(String fromLocation, String filename, String toLocation) {
        log.info("[Sink] {} moved {} → {}", filename, fromLocation, toLocation);
    }

    @Override
    public void discard(String location, String filename) {
        log.info("[Sink] {} discarded from {}", filename, location);
    }
}
