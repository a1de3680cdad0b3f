package de.leipzig.htwk.gitrdf.shex.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import de.leipzig.htwk.gitrdf.shex.model.CommentKind;
import de.leipzig.htwk.gitrdf.shex.model.CommentRecord;

/**
 * Puts extracted comments back into serialized ShExC. Records are applied last to first, so an
 * inserted general comment never sits between a later comment and its anchor.
 */
@Component
public class CommentReinserter {

  private static final Logger logger = LoggerFactory.getLogger(CommentReinserter.class);

  public String reinsert(String shexcText, List<CommentRecord> comments) {
    if (comments == null || comments.isEmpty()) {
      return shexcText;
    }

    List<String> lines = new ArrayList<>(Arrays.asList(CommentExtractor.splitLines(shexcText)));
    int dropped = 0;

    for (int i = comments.size() - 1; i >= 0; i--) {
      CommentRecord comment = comments.get(i);
      if (comment.isDocumentStart()) {
        lines.add(0, comment.text());
        continue;
      }

      int target = findAnchor(lines, comment.anchor());
      if (target < 0) {
        dropped++;
        logger.warn("[WARNING] Comment anchor not found, dropping comment '{}' (anchor: '{}')",
            comment.text().strip(), comment.anchor());
        continue;
      }

      if (comment.kind() == CommentKind.GENERAL) {
        lines.add(target, comment.text());
      } else {
        lines.set(target, lines.get(target).stripTrailing() + "  " + comment.text().stripLeading());
      }
    }

    if (dropped > 0) {
      logger.warn("[COMMENTS] {} of {} comment(s) could not be placed", dropped, comments.size());
    }
    return String.join("\n", lines);
  }

  private static int findAnchor(List<String> lines, String anchor) {
    for (int idx = 0; idx < lines.size(); idx++) {
      String line = lines.get(idx);
      if (line.equals(anchor) || stripSeparators(line).equals(anchor)) {
        return idx;
      }
    }
    return -1;
  }

  /** Trailing spaces and {@code ;} only, tabs stay. */
  private static String stripSeparators(String line) {
    int end = line.length();
    while (end > 0 && (line.charAt(end - 1) == ' ' || line.charAt(end - 1) == ';')) {
      end--;
    }
    return line.substring(0, end);
  }
}
