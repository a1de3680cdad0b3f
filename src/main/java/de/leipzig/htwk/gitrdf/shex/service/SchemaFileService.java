package de.leipzig.htwk.gitrdf.shex.service;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import de.leipzig.htwk.gitrdf.shex.config.ConversionConfig;

@Service
public class SchemaFileService {

  private static final Logger logger = LoggerFactory.getLogger(SchemaFileService.class);

  @Autowired
  private ConversionConfig config;

  /**
   * Gets the maximum content size from configuration
   */
  private long getMaxContentSize() {
    return (long) config.getMaxFileSizeMb() * 1024 * 1024;
  }

  public boolean exists(Path schemaFile) {
    return Files.isRegularFile(schemaFile);
  }

  /**
   * Reads a ShExC file as UTF-8, keeping its line structure.
   */
  public String readSchema(Path schemaFile) throws IOException {
    if (!exists(schemaFile)) {
      throw new IllegalArgumentException("Schema file " + schemaFile + " does not exist");
    }

    StringBuilder content = new StringBuilder();
    long totalSize = 0;
    long maxSize = getMaxContentSize();

    try (BufferedReader reader = Files.newBufferedReader(schemaFile, StandardCharsets.UTF_8)) {
      String line;
      boolean first = true;
      while ((line = reader.readLine()) != null) {
        totalSize += line.length() + 1; // +1 for newline
        if (totalSize > maxSize) {
          throw new IllegalArgumentException(
              String.format("File %s is too large (>%d MB)", schemaFile, config.getMaxFileSizeMb()));
        }
        if (!first) {
          content.append('\n');
        }
        content.append(line);
        first = false;
      }
    }

    logger.debug("Read {} bytes from schema file: {}", totalSize, schemaFile);
    return content.toString();
  }
}
