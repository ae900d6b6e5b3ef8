package org.carball.qengine.model.query;

public record ComplexityFactor(String name, int weight, String description) {
}
