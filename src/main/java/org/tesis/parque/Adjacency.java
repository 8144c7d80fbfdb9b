package org.tesis.parque;

/**
 * What an infrastructure element has to touch (within its own setback ring).
 */
public enum Adjacency {
    NONE,
    ROAD,
    BOUNDARY
}
