package de.leipzig.htwk.gitrdf.shex.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Prefix to namespace IRI mapping, in declaration order. Used to compact IRIs while writing
 * ShExC.
 */
public final class NamespaceTable {

  private static final Pattern LOCAL_NAME = Pattern.compile("[A-Za-z0-9_](?:[A-Za-z0-9_.\\-]*[A-Za-z0-9_\\-])?");

  private static final NamespaceTable EMPTY = new NamespaceTable(Map.of());

  private final Map<String, String> prefixes;

  private NamespaceTable(Map<String, String> prefixes) {
    this.prefixes = Collections.unmodifiableMap(new LinkedHashMap<>(prefixes));
  }

  public static NamespaceTable empty() {
    return EMPTY;
  }

  public static NamespaceTable of(Map<String, String> prefixes) {
    return prefixes == null || prefixes.isEmpty() ? EMPTY : new NamespaceTable(prefixes);
  }

  public Map<String, String> asMap() {
    return prefixes;
  }

  public boolean isEmpty() {
    return prefixes.isEmpty();
  }

  public int size() {
    return prefixes.size();
  }

  public String getNamespace(String prefix) {
    return prefixes.get(prefix);
  }

  /**
   * Compacts an IRI to a prefixed name using the longest matching namespace, or returns
   * {@code null} when no binding yields a valid local name.
   */
  public String compact(String iri) {
    if (iri == null) {
      return null;
    }
    String bestPrefix = null;
    String bestNamespace = null;
    for (Map.Entry<String, String> entry : prefixes.entrySet()) {
      String namespace = entry.getValue();
      if (iri.startsWith(namespace) && (bestNamespace == null || namespace.length() > bestNamespace.length())) {
        String localName = iri.substring(namespace.length());
        if (LOCAL_NAME.matcher(localName).matches()) {
          bestPrefix = entry.getKey();
          bestNamespace = namespace;
        }
      }
    }
    return bestPrefix != null ? bestPrefix + ":" + iri.substring(bestNamespace.length()) : null;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof NamespaceTable other && prefixes.equals(other.prefixes);
  }

  @Override
  public int hashCode() {
    return prefixes.hashCode();
  }

  @Override
  public String toString() {
    return "NamespaceTable" + prefixes;
  }
}
