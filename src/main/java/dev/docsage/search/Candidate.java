package dev.docsage.search;

import dev.docsage.corpus.Chunk;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A chunk retrieved for one request, with the raw score from the source that found it. Scores
 * stay on their source's scale: cosine similarity for {@link CandidateSource#VECTOR}, BM25 for
 * {@link CandidateSource#LEXICAL}.
 *
 * @param chunk the retrieved chunk
 * @param score the source score (always finite)
 * @param source which retrieval strategy produced this candidate
 */
public record Candidate(Chunk chunk, double score, CandidateSource source) {

  public Candidate {
    Objects.requireNonNull(chunk, "chunk must not be null");
    Objects.requireNonNull(source, "source must not be null");
    if (!Double.isFinite(score)) {
      throw new IllegalArgumentException("Candidate score must be finite, got: " + score);
    }
  }

  public String text() {
    return chunk.text();
  }

  /** Citation URL of the chunk ({@code url}, falling back to {@code sourcePath}). */
  public @Nullable String url() {
    return chunk.citationUrl();
  }

  public @Nullable String title() {
    return chunk.title();
  }
}
