package de.leipzig.htwk.gitrdf.shex.parser;

import de.leipzig.htwk.gitrdf.shex.model.NamespaceTable;
import de.leipzig.htwk.gitrdf.shex.model.ShapeSchema;

/**
 * Writes a schema as ShExC text.
 */
public interface ShexSerializer {

  /**
   * @param schema     schema to write
   * @param base       base IRI, or {@code null}
   * @param namespaces prefixes to declare and to compact IRIs with; never {@code null}
   */
  String serialize(ShapeSchema schema, String base, NamespaceTable namespaces);
}
