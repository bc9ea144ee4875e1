package com.openforge.docrouter.knowledge;

/**
 * A candidate fact is malformed or incomplete. Thrown before any lock is
 * taken or row touched, so the store is never mutated.
 */
public class KnowledgeValidationException extends RuntimeException {

    public KnowledgeValidationException(String message) {
        super(message);
    }
}
