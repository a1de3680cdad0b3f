package de.leipzig.htwk.gitrdf.shex.core;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import de.leipzig.htwk.gitrdf.shex.model.CommentKind;
import de.leipzig.htwk.gitrdf.shex.model.CommentRecord;

/**
 * Collects the {@code #} comments of a ShExC document together with the line they belong to, so
 * they can be put back after the schema has been re-serialized.
 *
 * <p>Comments above the first shape-declaring line are {@link CommentKind#GENERAL} and anchored to
 * the next non-blank line. Comments from that line on are {@link CommentKind#CONSTRAINT}: an
 * inline comment is anchored to the code in front of it, a full-line comment to the next non-blank
 * line.
 */
@Component
public class CommentExtractor {

  private static final Logger logger = LoggerFactory.getLogger(CommentExtractor.class);

  public List<CommentRecord> extract(String shexcText) {
    List<CommentRecord> comments = new ArrayList<>();
    if (shexcText == null || shexcText.isEmpty()) {
      return comments;
    }

    String[] lines = splitLines(shexcText);
    int startLine = findSchemaStartLine(lines);

    for (int idx = 0; idx < lines.length; idx++) {
      String line = lines[idx];
      boolean fullLineComment = line.strip().startsWith("#");

      if (idx < startLine) {
        if (fullLineComment) {
          comments.add(new CommentRecord(line, CommentKind.GENERAL, nextNonBlankLine(lines, idx)));
        }
        continue;
      }

      if (fullLineComment) {
        comments.add(new CommentRecord(line, CommentKind.CONSTRAINT, nextNonBlankLine(lines, idx)));
        continue;
      }

      int hash = commentStart(line);
      if (hash >= 0) {
        String code = stripTrailing(line.substring(0, hash));
        String anchor = code.isBlank() ? nextNonBlankLine(lines, idx) : code;
        comments.add(new CommentRecord(line.substring(hash), CommentKind.CONSTRAINT, anchor));
      }
    }

    logger.debug("[COMMENTS] Extracted {} comment(s), schema starts at line {}", comments.size(), startLine + 1);
    return comments;
  }

  static String[] splitLines(String text) {
    return text.split("\r?\n", -1);
  }

  /**
   * Index of the first line that starts with {@code start} or with a {@code <}-delimited shape
   * label; 0 when there is none.
   */
  static int findSchemaStartLine(String[] lines) {
    for (int idx = 0; idx < lines.length; idx++) {
      if (lines[idx].startsWith("start") || lines[idx].startsWith("<")) {
        return idx;
      }
    }
    return 0;
  }

  private static String nextNonBlankLine(String[] lines, int idx) {
    for (int next = idx + 1; next < lines.length; next++) {
      if (!lines[next].isBlank()) {
        return lines[next];
      }
    }
    return null;
  }

  /**
   * Position of the {@code #} that opens a comment, ignoring {@code #} inside IRIs and string
   * literals; -1 when the line has no comment.
   */
  static int commentStart(String line) {
    boolean inIri = false;
    char quote = 0;
    for (int i = 0; i < line.length(); i++) {
      char c = line.charAt(i);
      if (quote != 0) {
        if (c == '\\') {
          i++;
        } else if (c == quote) {
          quote = 0;
        }
      } else if (inIri) {
        if (c == '>') {
          inIri = false;
        }
      } else if (c == '<') {
        inIri = true;
      } else if (c == '"' || c == '\'') {
        quote = c;
      } else if (c == '#') {
        return i;
      }
    }
    return -1;
  }

  /** Drops trailing whitespace and {@code ;} separators. */
  static String stripTrailing(String code) {
    int end = code.length();
    while (end > 0 && (Character.isWhitespace(code.charAt(end - 1)) || code.charAt(end - 1) == ';')) {
      end--;
    }
    return code.substring(0, end);
  }
}
