package dev.docsage.corpus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads the JSONL corpus snapshot produced by the indexer: one self-contained {@code {"text",
 * "metadata"}} object per line.
 *
 * <p>Blank lines are ignored. Records whose text is blank are skipped with a warning so that empty
 * chunks never enter the lexical corpus. Any I/O or parse failure, and a snapshot that yields no
 * chunk at all, raise {@link IndexUnavailableException}.
 */
@Component
public class CorpusSnapshotReader {

  private static final Logger log = LoggerFactory.getLogger(CorpusSnapshotReader.class);

  private final ObjectMapper objectMapper;

  public CorpusSnapshotReader(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Parses every record of the snapshot in file order.
   *
   * @param snapshot path to the {@code bm25_corpus.jsonl} file
   * @return the admissible chunks, in snapshot order (never empty)
   * @throws IndexUnavailableException if the snapshot is missing, unreadable, malformed or empty
   */
  public List<Chunk> read(Path snapshot) {
    if (!Files.isRegularFile(snapshot)) {
      throw new IndexUnavailableException("Corpus snapshot not found: " + snapshot);
    }

    List<Chunk> chunks = new ArrayList<>();
    int skipped = 0;
    int lineNumber = 0;
    try (BufferedReader reader = Files.newBufferedReader(snapshot, StandardCharsets.UTF_8)) {
      String line;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        if (line.isBlank()) {
          continue;
        }
        Chunk chunk = parseLine(line, lineNumber, snapshot);
        if (chunk.text().isBlank()) {
          log.warn("Skipping corpus record with empty text at {}:{}", snapshot, lineNumber);
          skipped++;
          continue;
        }
        chunks.add(chunk);
      }
    } catch (IOException e) {
      throw new IndexUnavailableException("Failed to read corpus snapshot " + snapshot, e);
    }

    if (chunks.isEmpty()) {
      throw new IndexUnavailableException(
          "Corpus snapshot " + snapshot + " contains no indexable chunks");
    }
    log.info("Read {} chunks from {} ({} empty records skipped)", chunks.size(), snapshot, skipped);
    return chunks;
  }

  private Chunk parseLine(String line, int lineNumber, Path snapshot) {
    try {
      CorpusRecord record = objectMapper.readValue(line, CorpusRecord.class);
      if (record == null) {
        throw new IndexUnavailableException(
            "Corpus snapshot %s line %d is not a JSON object".formatted(snapshot, lineNumber));
      }
      return record.toChunk();
    } catch (JsonProcessingException e) {
      throw new IndexUnavailableException(
          "Malformed corpus record at %s line %d: %s"
              .formatted(snapshot, lineNumber, e.getOriginalMessage()),
          e);
    }
  }
}
