package de.leipzig.htwk.gitrdf.shex.model;

/**
 * A class to evaluate, identified by its URL, with its human-readable label.
 */
public record EvaluationClass(String classUrl, String classLabel) {

  /** Last path segment of the class URL, e.g. {@code Q5} for {@code http://www.wikidata.org/entity/Q5}. */
  public String classId() {
    int slash = classUrl.lastIndexOf('/');
    return slash >= 0 ? classUrl.substring(slash + 1) : classUrl;
  }
}
