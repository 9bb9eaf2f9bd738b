package dev.docsage.corpus;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * One line of the JSONL corpus snapshot written by the indexer.
 *
 * <p>{@code metadata} holds at least one of {@code url} or {@code source_path}, optionally {@code
 * title} and {@code chunk_id}, plus whatever front-matter keys the crawler copied through.
 *
 * @param text the chunk body text
 * @param metadata free-form chunk metadata
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CorpusRecord(@Nullable String text, @Nullable Map<String, Object> metadata) {

  public Chunk toChunk() {
    Map<String, Object> meta = metadata != null ? metadata : Map.of();
    return new Chunk(
        text != null ? text : "",
        stringValue(meta, "url"),
        stringValue(meta, "title"),
        stringValue(meta, "source_path"),
        stringValue(meta, "chunk_id"));
  }

  private static @Nullable String stringValue(Map<String, Object> meta, String key) {
    Object value = meta.get(key);
    if (value == null) {
      return null;
    }
    String str = value.toString();
    return str.isEmpty() ? null : str;
  }
}
