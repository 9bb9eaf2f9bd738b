package dev.docsage.corpus;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A unit of indexed documentation text, as written to the corpus snapshot and the vector
 * collection by the indexer.
 *
 * @param text the chunk body text (never null; may be empty only for vector hits whose payload
 *     carried no text)
 * @param url URL of the page the chunk was cut from, if the crawler recorded one
 * @param title page title, if known
 * @param sourcePath path of the crawled markdown file the chunk came from
 * @param chunkId position of the chunk within its source file, as an opaque identifier
 */
public record Chunk(
    String text,
    @Nullable String url,
    @Nullable String title,
    @Nullable String sourcePath,
    @Nullable String chunkId) {

  public Chunk {
    Objects.requireNonNull(text, "text must not be null");
  }

  /** Convenience constructor for chunks that only carry text and citation metadata. */
  public Chunk(String text, @Nullable String url, @Nullable String title) {
    this(text, url, title, null, null);
  }

  /**
   * Returns the URL used for citation and deduplication: the page URL when present, otherwise
   * the source path of the crawled file.
   */
  public @Nullable String citationUrl() {
    return url != null ? url : sourcePath;
  }
}
