package de.leipzig.htwk.gitrdf.shex.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import de.leipzig.htwk.gitrdf.shex.config.ConversionConfig;
import de.leipzig.htwk.gitrdf.shex.core.CommentExtractor;
import de.leipzig.htwk.gitrdf.shex.core.CommentReinserter;
import de.leipzig.htwk.gitrdf.shex.exception.ParseFailureException;
import de.leipzig.htwk.gitrdf.shex.exception.SchemaParseException;
import de.leipzig.htwk.gitrdf.shex.exception.UnrecoverableParseException;
import de.leipzig.htwk.gitrdf.shex.model.CommentRecord;
import de.leipzig.htwk.gitrdf.shex.model.ConversionResult;
import de.leipzig.htwk.gitrdf.shex.model.NamespaceTable;
import de.leipzig.htwk.gitrdf.shex.model.ShapeSchema;
import de.leipzig.htwk.gitrdf.shex.parser.ParseOutcome;
import de.leipzig.htwk.gitrdf.shex.parser.ShexGrammarEngine;
import de.leipzig.htwk.gitrdf.shex.parser.ShexJsonCodec;
import de.leipzig.htwk.gitrdf.shex.parser.ShexSerializer;

/**
 * ShExC to schema and back. Parsing gets one second chance: when the grammar engine reports
 * line-tagged errors, exactly those lines are removed and the text is parsed once more.
 */
@Service
public class ShexConversionService {

  private static final Logger logger = LoggerFactory.getLogger(ShexConversionService.class);

  private static final Pattern BASE_PATTERN = Pattern.compile("^[Bb][Aa][Ss][Ee]\\s+<(.+)>$");
  private static final Pattern PREFIX_PATTERN =
      Pattern.compile("^\\s*PREFIX\\s+([A-Za-z][\\w.\\-]*)?:\\s*<([^>]*)>", Pattern.CASE_INSENSITIVE);

  @Autowired
  private ShexGrammarEngine grammarEngine;

  @Autowired
  private ShexSerializer serializer;

  @Autowired
  private ShexJsonCodec jsonCodec;

  @Autowired
  private CommentExtractor commentExtractor;

  @Autowired
  private CommentReinserter commentReinserter;

  @Autowired
  private ConversionConfig config;

  public record ShexjDocument(String shexj, ConversionResult conversion) {
  }

  /**
   * Parses ShExC. Comments, base and prefixes are always read from the text as given, so they
   * survive even when lines had to be dropped.
   */
  public ConversionResult forward(String shexcText) throws SchemaParseException {
    if (shexcText == null) {
      throw new IllegalArgumentException("ShExC text cannot be null");
    }

    ParseOutcome outcome = grammarEngine.parse(shexcText);
    ShapeSchema schema;
    List<Integer> droppedLines = List.of();

    if (outcome.hasSchema()) {
      schema = outcome.schema();
    } else if (outcome.hasErrors()) {
      Set<Integer> errorLines = outcome.errorLines();
      droppedLines = new ArrayList<>(errorLines);
      if (!config.isLineRecoveryEnabled()) {
        logger.error("[CONVERSION] Parse failed on lines {} and line recovery is disabled", droppedLines);
        throw new UnrecoverableParseException(List.of(), outcome.errors(), outcome.errors());
      }

      logger.warn("[RECOVERY] Parse failed with {} error(s) on lines {}, retrying without them",
          outcome.errors().size(), droppedLines);
      outcome.errors().forEach(error -> logger.warn("[RECOVERY]   line {}: {}", error.line(), error.message()));

      ParseOutcome retry = grammarEngine.parse(removeLines(shexcText, errorLines));
      if (!retry.hasSchema()) {
        logger.error("[CONVERSION] Unable to parse schema, retry still failed with {} error(s)", retry.errors().size());
        throw new UnrecoverableParseException(droppedLines, outcome.errors(), retry.errors());
      }
      schema = retry.schema();
      logger.info("[RECOVERY] Recovered schema with {} shape(s) after dropping lines {}",
          schema.getShapeCount(), droppedLines);
    } else {
      logger.error("[CONVERSION] Unable to parse schema, the grammar engine reported no errors");
      throw new ParseFailureException("Unable to parse schema: no schema and no line errors reported");
    }

    String base = extractBase(shexcText);
    NamespaceTable namespaces = extractNamespaces(shexcText);
    List<CommentRecord> comments = commentExtractor.extract(shexcText);

    logger.info("[CONVERSION] Parsed {} shape(s), {} prefix(es), {} comment(s)",
        schema.getShapeCount(), namespaces.size(), comments.size());
    return new ConversionResult(schema, base, namespaces, comments, droppedLines);
  }

  /**
   * Serializes a schema to ShExC and puts the comments back. Uses the configured default prefixes
   * when {@code namespaces} is null or empty.
   */
  public String backward(ShapeSchema schema, String base, NamespaceTable namespaces, List<CommentRecord> comments) {
    NamespaceTable table = namespaces != null && !namespaces.isEmpty()
        ? namespaces
        : config.getDefaultNamespaceTable();
    String shexc = serializer.serialize(schema, base, table);
    return commentReinserter.reinsert(shexc, comments);
  }

  public String backward(ConversionResult conversion) {
    return backward(conversion.schema(), conversion.base(), conversion.namespaces(), conversion.comments());
  }

  public ShexjDocument toShexJ(String shexcText) throws SchemaParseException {
    ConversionResult conversion = forward(shexcText);
    return new ShexjDocument(jsonCodec.write(conversion.schema()), conversion);
  }

  public String toShexC(String shexjText, String base, NamespaceTable namespaces, List<CommentRecord> comments) {
    return backward(jsonCodec.read(shexjText), base, namespaces, comments);
  }

  /** First {@code BASE <iri>} line, or {@code null}. */
  static String extractBase(String shexcText) {
    for (String line : shexcText.split("\r?\n")) {
      Matcher matcher = BASE_PATTERN.matcher(line);
      if (matcher.matches()) {
        return matcher.group(1);
      }
    }
    return null;
  }

  /** Every {@code PREFIX p: <iri>} line in document order; the default prefix is bound to "". */
  static NamespaceTable extractNamespaces(String shexcText) {
    Map<String, String> prefixes = new LinkedHashMap<>();
    for (String line : shexcText.split("\r?\n")) {
      Matcher matcher = PREFIX_PATTERN.matcher(line);
      if (matcher.find()) {
        String prefix = matcher.group(1) != null ? matcher.group(1) : "";
        prefixes.put(prefix, matcher.group(2));
      }
    }
    return NamespaceTable.of(prefixes);
  }

  /** Removes the given 1-based lines. */
  static String removeLines(String text, Set<Integer> lineNumbers) {
    String[] lines = text.split("\r?\n", -1);
    List<String> kept = new ArrayList<>();
    for (int i = 0; i < lines.length; i++) {
      if (!lineNumbers.contains(i + 1)) {
        kept.add(lines[i]);
      }
    }
    return String.join("\n", kept);
  }
}
