package org.tesis.parque;

/**
 * No boundary edge faces the reference line with enough clearance for an entrance.
 */
public class NoValidFrontageException extends SitePlanException {

    private static final long serialVersionUID = 1L;

    public NoValidFrontageException(String message) {
        super(message);
    }
}
