package dev.docsage.search;

/** Fallbacks the pipeline applied while answering a request. */
public enum Degradation {
  /** Vector search failed or timed out; contexts come from lexical search only. */
  VECTOR_SEARCH_UNAVAILABLE,
  /** Cross-encoder scoring failed or timed out; contexts are ordered by source score. */
  RERANK_UNAVAILABLE
}
