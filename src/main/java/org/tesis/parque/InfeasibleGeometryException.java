package org.tesis.parque;

/**
 * The buildable region is degenerate: nothing is left once the perimeter
 * buffer is removed, or no parameterization produces a layout.
 */
public class InfeasibleGeometryException extends SitePlanException {

    private static final long serialVersionUID = 1L;

    public InfeasibleGeometryException(String message) {
        super(message);
    }

    public InfeasibleGeometryException(String message, Throwable cause) {
        super(message, cause);
    }
}
