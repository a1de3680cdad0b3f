package de.leipzig.htwk.gitrdf.shex.model;

public record ShapeReference(String shapeId) implements ValueExpression {
}
