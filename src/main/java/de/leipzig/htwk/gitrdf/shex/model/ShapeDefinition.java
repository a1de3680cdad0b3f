package de.leipzig.htwk.gitrdf.shex.model;

import java.util.List;

/**
 * A single shape declaration ({@code <id> EXTRA ... { ... }}).
 */
public class ShapeDefinition {
    private final String id;
    private final List<String> extra;
    private final boolean closed;
    private final TripleExpression expression;

    public ShapeDefinition(String id, List<String> extra, boolean closed, TripleExpression expression) {
        this.id = id;
        this.extra = extra != null ? List.copyOf(extra) : List.of();
        this.closed = closed;
        this.expression = expression;
    }

    public ShapeDefinition(String id, TripleExpression expression) {
        this(id, List.of(), false, expression);
    }

    public String getId() {
        return id;
    }

    public List<String> getExtra() {
        return extra;
    }

    public boolean isClosed() {
        return closed;
    }

    public TripleExpression getExpression() {
        return expression;
    }

    /**
     * The ordered constraint sequence of this shape, or {@code null} when the shape has no
     * expression. A lone triple constraint counts as a sequence of one.
     */
    public List<TripleExpression> getConstraintSequence() {
        if (expression == null) {
            return null;
        }
        if (expression instanceof GroupExpression group) {
            return group.expressions();
        }
        return List.of(expression);
    }

    /**
     * Value shapes pin a single predicate to a value set, e.g.
     * {@code <human> EXTRA wdt:P31 { wdt:P31 [ wd:Q5 ] }}.
     */
    public NodeConstraint getValueShapeConstraint() {
        List<TripleExpression> sequence = getConstraintSequence();
        if (sequence == null || sequence.size() != 1) {
            return null;
        }
        if (sequence.get(0) instanceof TripleConstraint constraint
            && constraint.valueExpr() instanceof NodeConstraint nodeConstraint
            && nodeConstraint.hasValues()) {
            return nodeConstraint;
        }
        return null;
    }

    @Override
    public String toString() {
        return "ShapeDefinition{id='" + id + "', extra=" + extra + ", closed=" + closed + "}";
    }
}
