package com.openforge.docrouter.routing;

import com.openforge.docrouter.routing.dto.Attachment;

/**
 * File persistence for routed documents. Locations are relative paths such
 * as "i3/loan_documents" or "to_be_reviewed/quarantined".
 */
public interface DocumentSink {

    void store(String location, Attachment attachment);

    /** Move a previously stored document after a human decided where it belongs. */
    void relocate(String fromLocation, String filename, String toLocation);

    void discard(String location, String filename);
}
