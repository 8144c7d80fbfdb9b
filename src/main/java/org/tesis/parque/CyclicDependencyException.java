package org.tesis.parque;

import java.util.List;

/**
 * The work-package graph handed to the timeline estimator is not acyclic.
 * Generated graphs never are; seeing this means a generator defect.
 */
public class CyclicDependencyException extends SitePlanException {

    private static final long serialVersionUID = 1L;

    private final List<String> unresolved;

    public CyclicDependencyException(List<String> unresolved) {
        super("work-package graph has a cycle through " + unresolved);
        this.unresolved = List.copyOf(unresolved);
    }

    /** Packages that could not be ordered. */
    public List<String> getUnresolved() {
        return unresolved;
    }
}
