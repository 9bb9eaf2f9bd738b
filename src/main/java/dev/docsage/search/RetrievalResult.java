package dev.docsage.search;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Outcome of one retrieval call: ranked contexts, the distinct citation URLs they carry (first
 * appearance order), and the fallbacks applied to produce them.
 *
 * <p>An empty result is a valid outcome meaning "no relevant context found".
 *
 * @param contexts contexts ordered by descending rerank score
 * @param sources distinct non-empty URLs of {@code contexts}, in context order
 * @param degradations fallbacks taken while serving the request (empty on the normal path)
 */
public record RetrievalResult(
    List<RankedContext> contexts, List<String> sources, Set<Degradation> degradations) {

  public RetrievalResult {
    contexts = List.copyOf(contexts);
    sources = List.copyOf(sources);
    degradations = Set.copyOf(degradations);
  }

  /** Builds a result from ranked contexts, deriving the citation URL list from them. */
  public static RetrievalResult of(List<RankedContext> contexts, Set<Degradation> degradations) {
    return new RetrievalResult(contexts, citationUrls(contexts), degradations);
  }

  public static RetrievalResult empty() {
    return new RetrievalResult(List.of(), List.of(), Set.of());
  }

  public boolean isEmpty() {
    return contexts.isEmpty();
  }

  public boolean isDegraded() {
    return !degradations.isEmpty();
  }

  /** Distinct non-empty URLs in the order their first context appears. */
  static List<String> citationUrls(List<RankedContext> contexts) {
    Set<String> urls = new LinkedHashSet<>();
    for (RankedContext context : contexts) {
      String url = context.url();
      if (url != null && !url.isEmpty()) {
        urls.add(url);
      }
    }
    return List.copyOf(urls);
  }
}
