package dev.docsage.search;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.scoring.ScoringModel;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;
import org.springframework.stereotype.Service;

/**
 * Cross-encoder reranking over the fused candidate pool, using an ONNX scoring model
 * (ms-marco-MiniLM-L-6-v2).
 *
 * <p>All {@code (query, text)} pairs of a request go to the model in a single batched call. Results
 * are sorted by descending model score with a stable sort, so equal scores keep fusion order, and
 * truncated to {@code topN}.
 *
 * <p>Model failures are raised as {@link RerankModelException}; choosing a fallback is the
 * caller's decision (see {@link #fallback(List, int)}).
 *
 * @see dev.langchain4j.model.scoring.ScoringModel
 */
@Service
public class Reranker {

  private final ScoringModel scoringModel;

  public Reranker(ScoringModel scoringModel) {
    this.scoringModel = scoringModel;
  }

  /**
   * Reranks candidates with the cross-encoder.
   *
   * @param query the original query text
   * @param candidates the fused candidate pool
   * @param topN maximum number of contexts to return
   * @return contexts sorted by rerank score descending, at most {@code topN}
   * @throws RerankModelException if the model fails or returns unusable scores
   */
  public List<RankedContext> rerank(String query, List<Candidate> candidates, int topN) {
    if (candidates.isEmpty()) {
      return List.of();
    }

    List<Double> scores = scoreBatch(query, candidates);

    return IntStream.range(0, candidates.size())
        .mapToObj(i -> new RankedContext(candidates.get(i), scores.get(i)))
        .sorted(Comparator.comparingDouble(RankedContext::rerankScore).reversed())
        .limit(topN)
        .toList();
  }

  private List<Double> scoreBatch(String query, List<Candidate> candidates) {
    List<Double> scores;
    try {
      List<TextSegment> segments =
          candidates.stream().map(c -> TextSegment.from(c.text())).toList();
      Response<List<Double>> response = scoringModel.scoreAll(segments, query);
      scores = response.content();
    } catch (RuntimeException e) {
      throw new RerankModelException("Cross-encoder scoring failed: " + e.getMessage(), e);
    }

    if (scores == null || scores.size() != candidates.size()) {
      throw new RerankModelException(
          "Cross-encoder returned %d scores for %d candidates"
              .formatted(scores == null ? 0 : scores.size(), candidates.size()));
    }
    for (Double score : scores) {
      if (score == null || !Double.isFinite(score)) {
        throw new RerankModelException("Cross-encoder returned a non-finite score: " + score);
      }
    }
    return scores;
  }

  /**
   * Orders candidates by their source score when the cross-encoder is unavailable. Each context's
   * rerank score is its source score.
   *
   * @param candidates the fused candidate pool
   * @param topN maximum number of contexts to return
   * @return contexts sorted by source score descending (stable), at most {@code topN}
   */
  public static List<RankedContext> fallback(List<Candidate> candidates, int topN) {
    return candidates.stream()
        .sorted(Comparator.comparingDouble(Candidate::score).reversed())
        .limit(topN)
        .map(c -> new RankedContext(c, c.score()))
        .toList();
  }
}
