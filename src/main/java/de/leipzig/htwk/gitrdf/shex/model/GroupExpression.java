package de.leipzig.htwk.gitrdf.shex.model;

import java.util.List;

public interface GroupExpression extends TripleExpression {

  List<TripleExpression> expressions();
}
