package dev.docsage.search;

import dev.docsage.corpus.Chunk;
import dev.docsage.corpus.IndexUnavailableException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.IntStream;

/**
 * In-memory Okapi BM25 index over the static corpus snapshot.
 *
 * <p>Documents are tokenized by whitespace only: no lower-casing, stemming or stop-word removal,
 * so the query must use the corpus spelling to match. Scoring uses {@code k1 = 1.5}, {@code b =
 * 0.75} and the non-negative IDF variant {@code ln((N - n + 0.5) / (n + 0.5) + 1)}.
 *
 * <p>Instances are immutable once {@link #load(List)} returns; {@link #search(List, int)} may be
 * called from any number of threads without synchronization.
 */
public final class LexicalIndex {

  static final double K1 = 1.5;
  static final double B = 0.75;

  private static final Pattern WHITESPACE =
      Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

  private final List<Chunk> corpus;
  private final List<Map<String, Integer>> termFrequencies;
  private final int[] documentLengths;
  private final Map<String, Integer> documentFrequencies;
  private final double averageDocumentLength;

  private LexicalIndex(
      List<Chunk> corpus,
      List<Map<String, Integer>> termFrequencies,
      int[] documentLengths,
      Map<String, Integer> documentFrequencies,
      double averageDocumentLength) {
    this.corpus = corpus;
    this.termFrequencies = termFrequencies;
    this.documentLengths = documentLengths;
    this.documentFrequencies = documentFrequencies;
    this.averageDocumentLength = averageDocumentLength;
  }

  /**
   * Builds the index from the corpus, keeping corpus order as the tie-break order for search.
   *
   * @param corpus the chunks to index, each with non-blank text
   * @return an immutable index
   * @throws IndexUnavailableException if the corpus is empty
   * @throws IllegalArgumentException if a chunk has blank text
   */
  public static LexicalIndex load(List<Chunk> corpus) {
    if (corpus.isEmpty()) {
      throw new IndexUnavailableException("Cannot build lexical index from an empty corpus");
    }

    List<Map<String, Integer>> termFrequencies = new ArrayList<>(corpus.size());
    int[] documentLengths = new int[corpus.size()];
    Map<String, Integer> documentFrequencies = new HashMap<>();
    long totalLength = 0;

    for (int i = 0; i < corpus.size(); i++) {
      Chunk chunk = corpus.get(i);
      if (chunk.text().isBlank()) {
        throw new IllegalArgumentException("Chunk at corpus position " + i + " has empty text");
      }
      List<String> tokens = tokenize(chunk.text());
      Map<String, Integer> frequencies = new HashMap<>();
      for (String token : tokens) {
        frequencies.merge(token, 1, Integer::sum);
      }
      for (String term : frequencies.keySet()) {
        documentFrequencies.merge(term, 1, Integer::sum);
      }
      termFrequencies.add(Map.copyOf(frequencies));
      documentLengths[i] = tokens.size();
      totalLength += tokens.size();
    }

    return new LexicalIndex(
        List.copyOf(corpus),
        List.copyOf(termFrequencies),
        documentLengths,
        Map.copyOf(documentFrequencies),
        (double) totalLength / corpus.size());
  }

  /**
   * Splits text on runs of Unicode whitespace, dropping empty tokens.
   *
   * @param text the text to split
   * @return tokens in text order (empty for blank input)
   */
  public static List<String> tokenize(String text) {
    if (text.isBlank()) {
      return List.of();
    }
    return Arrays.stream(WHITESPACE.split(text.strip())).filter(t -> !t.isEmpty()).toList();
  }

  /**
   * Returns the {@code k} best-scoring documents for the query tokens.
   *
   * <p>Every document is ranked, including those scoring zero, so an empty token list returns the
   * first {@code k} documents of the corpus with score 0.
   *
   * @param queryTokens whitespace-split query; a repeated token counts once per occurrence
   * @param k maximum number of candidates (must be >= 1)
   * @return candidates ordered by descending score, ties in corpus order
   */
  public List<Candidate> search(List<String> queryTokens, int k) {
    if (k < 1) {
      throw new IllegalArgumentException("k must be at least 1");
    }
    double[] scores = scores(queryTokens);
    return IntStream.range(0, corpus.size())
        .boxed()
        .sorted(Comparator.comparingDouble((Integer i) -> scores[i]).reversed())
        .limit(k)
        .map(i -> new Candidate(corpus.get(i), scores[i], CandidateSource.LEXICAL))
        .toList();
  }

  /**
   * Computes the BM25 score of every document, in corpus order.
   *
   * @param queryTokens whitespace-split query
   * @return one score per corpus document
   */
  public double[] scores(List<String> queryTokens) {
    double[] scores = new double[corpus.size()];
    for (String term : queryTokens) {
      Integer df = documentFrequencies.get(term);
      if (df == null) {
        continue;
      }
      double idf = idf(df);
      for (int i = 0; i < scores.length; i++) {
        Integer tf = termFrequencies.get(i).get(term);
        if (tf == null) {
          continue;
        }
        double lengthNorm = 1 - B + B * documentLengths[i] / averageDocumentLength;
        scores[i] += idf * (tf * (K1 + 1)) / (tf + K1 * lengthNorm);
      }
    }
    return scores;
  }

  private double idf(int documentFrequency) {
    int n = corpus.size();
    return Math.log((n - documentFrequency + 0.5) / (documentFrequency + 0.5) + 1);
  }

  /** Number of documents in the corpus. */
  public int size() {
    return corpus.size();
  }

  /** Number of distinct terms across the corpus. */
  public int vocabularySize() {
    return documentFrequencies.size();
  }

  /** Mean document length in tokens. */
  public double averageDocumentLength() {
    return averageDocumentLength;
  }
}
