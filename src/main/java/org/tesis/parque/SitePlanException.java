package org.tesis.parque;

/**
 * Base type of the fatal failures raised by the layout engine.
 */
public class SitePlanException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public SitePlanException(String message) {
        super(message);
    }

    public SitePlanException(String message, Throwable cause) {
        super(message, cause);
    }
}
