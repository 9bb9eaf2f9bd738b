package dev.docsage.search;

/** Retrieval strategy that produced a {@link Candidate}. */
public enum CandidateSource {
  VECTOR("vector"),
  LEXICAL("lexical");

  private final String value;

  CandidateSource(String value) {
    this.value = value;
  }

  /** Lower-case label used in API responses and tool output. */
  public String value() {
    return value;
  }
}
