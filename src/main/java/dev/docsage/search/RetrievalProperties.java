package dev.docsage.search;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the retrieval pipeline.
 *
 * <p>Properties are bound from {@code docsage.retrieval.*} in application.yml.
 *
 * <ul>
 *   <li>{@code default-k} - retrieval breadth when a request omits it (default 8)
 *   <li>{@code top-n} - number of contexts kept after reranking, independent of k (default 6)
 *   <li>{@code min-similarity} - cosine similarity floor for vector hits (default 0.15)
 *   <li>{@code vector-timeout} - bound on query embedding + vector search (default 5s)
 *   <li>{@code rerank-timeout} - bound on the batched cross-encoder call (default 10s)
 *   <li>{@code degrade-on-vector-failure} - answer from lexical results alone when the vector
 *       store fails and lexical search found something (default true)
 *   <li>{@code executor-pool-size} - worker threads for vector and rerank calls (default 8)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "docsage.retrieval")
public class RetrievalProperties {

  private int defaultK = RetrievalRequest.DEFAULT_K;
  private int topN = 6;
  private double minSimilarity = 0.15;
  private Duration vectorTimeout = Duration.ofSeconds(5);
  private Duration rerankTimeout = Duration.ofSeconds(10);
  private boolean degradeOnVectorFailure = true;
  private int executorPoolSize = 8;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (defaultK < 1) {
      throw new IllegalStateException("docsage.retrieval.default-k must be >= 1, got: " + defaultK);
    }
    if (topN < 1) {
      throw new IllegalStateException("docsage.retrieval.top-n must be >= 1, got: " + topN);
    }
    if (minSimilarity < -1.0 || minSimilarity > 1.0) {
      throw new IllegalStateException(
          "docsage.retrieval.min-similarity must be in [-1.0, 1.0], got: " + minSimilarity);
    }
    if (vectorTimeout.isNegative() || vectorTimeout.isZero()) {
      throw new IllegalStateException(
          "docsage.retrieval.vector-timeout must be positive, got: " + vectorTimeout);
    }
    if (rerankTimeout.isNegative() || rerankTimeout.isZero()) {
      throw new IllegalStateException(
          "docsage.retrieval.rerank-timeout must be positive, got: " + rerankTimeout);
    }
    if (executorPoolSize < 2) {
      throw new IllegalStateException(
          "docsage.retrieval.executor-pool-size must be >= 2, got: " + executorPoolSize);
    }
  }

  public int getDefaultK() {
    return defaultK;
  }

  public void setDefaultK(int defaultK) {
    this.defaultK = defaultK;
  }

  public int getTopN() {
    return topN;
  }

  public void setTopN(int topN) {
    this.topN = topN;
  }

  public double getMinSimilarity() {
    return minSimilarity;
  }

  public void setMinSimilarity(double minSimilarity) {
    this.minSimilarity = minSimilarity;
  }

  public Duration getVectorTimeout() {
    return vectorTimeout;
  }

  public void setVectorTimeout(Duration vectorTimeout) {
    this.vectorTimeout = vectorTimeout;
  }

  public Duration getRerankTimeout() {
    return rerankTimeout;
  }

  public void setRerankTimeout(Duration rerankTimeout) {
    this.rerankTimeout = rerankTimeout;
  }

  public boolean isDegradeOnVectorFailure() {
    return degradeOnVectorFailure;
  }

  public void setDegradeOnVectorFailure(boolean degradeOnVectorFailure) {
    this.degradeOnVectorFailure = degradeOnVectorFailure;
  }

  public int getExecutorPoolSize() {
    return executorPoolSize;
  }

  public void setExecutorPoolSize(int executorPoolSize) {
    this.executorPoolSize = executorPoolSize;
  }
}
