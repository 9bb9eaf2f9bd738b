package dev.docsage.api;

import dev.docsage.search.Degradation;
import dev.docsage.search.RankedContext;
import dev.docsage.search.RetrievalResult;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Response of {@code POST /api/retrieve}: contexts in rerank order, distinct citation URLs in
 * first-appearance order, and the degradations applied to the request (empty when none).
 */
public record RetrieveResponse(
    List<ContextView> contexts, List<String> sources, List<Degradation> degraded) {

  static RetrieveResponse from(RetrievalResult result) {
    return new RetrieveResponse(
        result.contexts().stream().map(ContextView::from).toList(),
        result.sources(),
        result.degradations().stream().sorted().toList());
  }

  /** One ranked context as exposed over HTTP. */
  public record ContextView(
      String text,
      @Nullable String url,
      @Nullable String title,
      double score,
      double rerankScore,
      String source) {

    static ContextView from(RankedContext context) {
      return new ContextView(
          context.text(),
          context.url(),
          context.title(),
          context.score(),
          context.rerankScore(),
          context.source().value());
    }
  }
}
