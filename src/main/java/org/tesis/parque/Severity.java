package org.tesis.parque;

/**
 * HARD rules must hold for a layout to be compliant; SOFT rules only add penalty.
 */
public enum Severity {
    HARD,
    SOFT
}
