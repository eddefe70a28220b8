package com.diagramforge.core.model;

/**
 * A point in diagram coordinates. Used for vertex positions and connector waypoints.
 *
 * @param x horizontal coordinate
 * @param y vertical coordinate
 */
public record Position(double x, double y) {
}
