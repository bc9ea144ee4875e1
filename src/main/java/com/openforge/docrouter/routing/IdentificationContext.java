package com.openforge.docrouter.routing;

/** What identification looks at for one attachment. Missing parts are treated as empty. */
public record IdentificationContext(String senderAddress, String subject, String body, String filename) {

    public IdentificationContext {
        subject  = subject == null ? "" : subject;
        body     = body == null ? "" : body;
        filename = filename == null ? "" : filename;
    }

    /** Filename plus subject: the text similarity recall is keyed on. */
    public String recallQuery() {
        return subject.isBlank() ? filename : filename + " " + subject;
    }
}
