package dev.docsage.search;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Final output unit of the retrieval pipeline: a candidate with its reranking score. Lists of
 * ranked contexts are ordered by descending {@code rerankScore}; consumers must keep that order
 * (it is the citation order).
 *
 * @param candidate the fused candidate
 * @param rerankScore the cross-encoder score, or the source score when reranking was unavailable
 */
public record RankedContext(Candidate candidate, double rerankScore) {

  public RankedContext {
    Objects.requireNonNull(candidate, "candidate must not be null");
    if (!Double.isFinite(rerankScore)) {
      throw new IllegalArgumentException("Rerank score must be finite, got: " + rerankScore);
    }
  }

  public String text() {
    return candidate.text();
  }

  public @Nullable String url() {
    return candidate.url();
  }

  public @Nullable String title() {
    return candidate.title();
  }

  /** The source score the candidate was retrieved with. */
  public double score() {
    return candidate.score();
  }

  public CandidateSource source() {
    return candidate.source();
  }
}
