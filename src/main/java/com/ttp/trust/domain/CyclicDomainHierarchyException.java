package com.ttp.trust.domain;

import java.util.List;

/**
 * A domain's parent chain loops back on itself. Raised when the forest is
 * built, never during traversal.
 */
public class CyclicDomainHierarchyException extends IllegalStateException {
    private final List<String> unresolved;

    public CyclicDomainHierarchyException(List<String> unresolved) {
        super("Cyclic domain hierarchy detected. Domains on or below a cycle: " + unresolved);
        this.unresolved = List.copyOf(unresolved);
    }

    public List<String> unresolved() {
        return unresolved;
    }
}
