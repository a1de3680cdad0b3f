package de.leipzig.htwk.gitrdf.shex.model;

/**
 * Member of a value set. {@code datatype} and {@code language} only apply to literals.
 */
public record ValueSetValue(Kind kind, String value, String datatype, String language) {

  public enum Kind {
    IRI,
    IRI_STEM,
    LITERAL
  }

  public static ValueSetValue iri(String iri) {
    return new ValueSetValue(Kind.IRI, iri, null, null);
  }

  public static ValueSetValue iriStem(String stem) {
    return new ValueSetValue(Kind.IRI_STEM, stem, null, null);
  }

  public static ValueSetValue literal(String value, String datatype, String language) {
    return new ValueSetValue(Kind.LITERAL, value, datatype, language);
  }
}
