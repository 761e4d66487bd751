package org.snek.runtime.model;

/**
 * The fixed fruit palette. Only identity matters to the simulation.
 */
public enum FruitKind {
    RED,
    BLUE,
    ORANGE
}
