package de.leipzig.htwk.gitrdf.shex.config;

import java.util.LinkedHashMap;
import java.util.Map;

import org.eclipse.rdf4j.model.vocabulary.OWL;
import org.eclipse.rdf4j.model.vocabulary.RDF;
import org.eclipse.rdf4j.model.vocabulary.RDFS;
import org.eclipse.rdf4j.model.vocabulary.XSD;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import de.leipzig.htwk.gitrdf.shex.model.NamespaceTable;

@Component
@ConfigurationProperties(prefix = "shex.conversion")
public class ConversionConfig {

  private Map<String, String> defaultPrefixes = createDefaultPrefixes();
  private boolean lineRecoveryEnabled = true;

  @Value("${shex.max-file-size-mb:10}")
  private int maxFileSizeMb = 10;

  private static Map<String, String> createDefaultPrefixes() {
    Map<String, String> prefixes = new LinkedHashMap<>();
    prefixes.put(RDF.PREFIX, RDF.NAMESPACE);
    prefixes.put(RDFS.PREFIX, RDFS.NAMESPACE);
    prefixes.put(XSD.PREFIX, XSD.NAMESPACE);
    prefixes.put(OWL.PREFIX, OWL.NAMESPACE);
    prefixes.put("wd", "http://www.wikidata.org/entity/");
    prefixes.put("wdt", "http://www.wikidata.org/prop/direct/");
    prefixes.put("p", "http://www.wikidata.org/prop/");
    prefixes.put("ps", "http://www.wikidata.org/prop/statement/");
    prefixes.put("pq", "http://www.wikidata.org/prop/qualifier/");
    prefixes.put("schema", "http://schema.org/");
    return prefixes;
  }

  /**
   * Namespace table handed to the serializer when the caller supplies none.
   */
  public NamespaceTable getDefaultNamespaceTable() {
    return NamespaceTable.of(defaultPrefixes);
  }

  // Getters and setters
  public Map<String, String> getDefaultPrefixes() {
    return defaultPrefixes;
  }

  public void setDefaultPrefixes(Map<String, String> defaultPrefixes) {
    this.defaultPrefixes = defaultPrefixes;
  }

  public boolean isLineRecoveryEnabled() {
    return lineRecoveryEnabled;
  }

  public void setLineRecoveryEnabled(boolean lineRecoveryEnabled) {
    this.lineRecoveryEnabled = lineRecoveryEnabled;
  }

  public int getMaxFileSizeMb() {
    return maxFileSizeMb;
  }

  public void setMaxFileSizeMb(int maxFileSizeMb) {
    this.maxFileSizeMb = maxFileSizeMb;
  }
}
