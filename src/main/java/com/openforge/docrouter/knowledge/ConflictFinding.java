package com.openforge.docrouter.knowledge;

import com.openforge.docrouter.domain.ConflictType;

/** One contradiction between a stored fact and a candidate with the same identity key. */
public record ConflictFinding(ConflictType type, String detail) {

    public static ConflictFinding of(ConflictType type, String field, Object existing, Object candidate) {
        return new ConflictFinding(type, "%s: '%s' vs '%s'".formatted(field, existing, candidate));
    }
}
