package dev.docsage.search;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Pure static utility merging vector and lexical candidates into one deduplicated, bounded pool
 * for reranking.
 *
 * <p>Fusion is set-based: scores keep their source scale and play no part in the merge. Vector
 * candidates are visited first, then lexical ones; the first candidate seen for a dedup key wins
 * and later ones are dropped regardless of source or score. The pool is capped at {@code max(2k,
 * 10)} candidates in first-occurrence order.
 *
 * <p>The dedup key is the first 64 code points of the text plus the citation URL. Overlapping
 * chunk boundaries produce near-duplicates that share a long prefix; a full-text key misses them
 * and a shorter prefix merges distinct passages.
 */
public final class CandidateFusion {

  static final int DEDUP_PREFIX_CODE_POINTS = 64;
  static final int MIN_POOL_SIZE = 10;

  private CandidateFusion() {}

  /**
   * Merges both candidate lists.
   *
   * @param vectorCandidates candidates from vector search, in store order
   * @param lexicalCandidates candidates from BM25 search, in score order
   * @param k retrieval breadth of the request (must be >= 1)
   * @return at most {@code max(2k, 10)} candidates with distinct dedup keys
   */
  public static List<Candidate> merge(
      List<Candidate> vectorCandidates, List<Candidate> lexicalCandidates, int k) {
    if (k < 1) {
      throw new IllegalArgumentException("k must be at least 1");
    }
    int limit = maxPoolSize(k);
    Set<DedupKey> seen = new HashSet<>();
    List<Candidate> merged = new ArrayList<>(Math.min(limit, 32));

    for (List<Candidate> source : List.of(vectorCandidates, lexicalCandidates)) {
      for (Candidate candidate : source) {
        if (merged.size() == limit) {
          return merged;
        }
        if (seen.add(dedupKey(candidate))) {
          merged.add(candidate);
        }
      }
    }
    return merged;
  }

  /** Upper bound on the merged pool for a request of breadth {@code k}. */
  public static int maxPoolSize(int k) {
    return Math.max(2 * k, MIN_POOL_SIZE);
  }

  static DedupKey dedupKey(Candidate candidate) {
    return new DedupKey(prefix(candidate.text()), candidate.url());
  }

  private static String prefix(String text) {
    int codePoints = text.codePointCount(0, text.length());
    if (codePoints <= DEDUP_PREFIX_CODE_POINTS) {
      return text;
    }
    return text.substring(0, text.offsetByCodePoints(0, DEDUP_PREFIX_CODE_POINTS));
  }

  /** Identity of a candidate for deduplication purposes. */
  record DedupKey(String textPrefix, @Nullable String url) {}
}
