package de.leipzig.htwk.gitrdf.shex.model;

/**
 * Value type of a triple constraint: {@link ShapeReference}, {@link NodeConstraint} or {@link ShapeJunction}.
 */
public interface ValueExpression {
}
