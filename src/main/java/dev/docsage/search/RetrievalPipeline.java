package dev.docsage.search;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Hybrid retrieval orchestration: BM25 and vector search in parallel, set-based fusion, then
 * cross-encoder reranking.
 *
 * <p>Pipeline: submit query embedding + vector search to the retrieval executor -> run BM25 on the
 * calling thread meanwhile -> wait for the vector result until {@code vector-timeout} after
 * submission -> {@link CandidateFusion#merge} -> {@link Reranker#rerank} on the executor (bounded
 * by {@code rerank-timeout}) -> contexts plus distinct citation URLs.
 *
 * <p>A call that times out is cancelled with an interrupt. Interrupt-aware work (the Qdrant call,
 * sleeps, blocking I/O) stops and frees its executor thread; an ONNX inference already running
 * cannot be interrupted and holds its thread until it returns.
 *
 * <p>Failure policy:
 *
 * <ul>
 *   <li>Vector failure or timeout: continue with lexical results only when degradation is enabled
 *       and at least one lexical candidate scored above zero; otherwise {@link
 *       RetrievalFailedException}.
 *   <li>Rerank failure or timeout: order the fused pool by source score instead.
 *   <li>No candidates at all: an empty {@link RetrievalResult}, not an error.
 * </ul>
 */
@Service
public class RetrievalPipeline {

  private static final Logger log = LoggerFactory.getLogger(RetrievalPipeline.class);

  private final PipelineContext context;
  private final RetrievalProperties properties;
  private final AsyncTaskExecutor executor;

  public RetrievalPipeline(
      PipelineContext context,
      RetrievalProperties properties,
      @Qualifier("retrievalExecutor") AsyncTaskExecutor executor) {
    this.context = context;
    this.properties = properties;
    this.executor = executor;
  }

  /**
   * Retrieves ranked contexts for a query.
   *
   * @param query the user question
   * @param k retrieval breadth per source
   * @return ranked contexts, citation URLs and applied degradations
   * @throws IllegalArgumentException if the query is blank or {@code k < 1}
   * @throws RetrievalFailedException if the request cannot be served even in degraded mode
   */
  public RetrievalResult retrieve(String query, int k) {
    return retrieve(new RetrievalRequest(query, k));
  }

  /**
   * Retrieves ranked contexts for a validated request.
   *
   * @param request the retrieval request
   * @return ranked contexts, citation URLs and applied degradations
   * @throws RetrievalFailedException if the request cannot be served even in degraded mode
   */
  public RetrievalResult retrieve(RetrievalRequest request) {
    String query = request.query();
    int k = request.k();
    Set<Degradation> degradations = EnumSet.noneOf(Degradation.class);

    long vectorDeadline = System.nanoTime() + properties.getVectorTimeout().toNanos();
    Future<List<Candidate>> vectorFuture = submit(() -> vectorSearch(query, k));

    List<Candidate> lexicalCandidates =
        context.lexicalIndex().search(LexicalIndex.tokenize(query), k);
    List<Candidate> vectorCandidates =
        awaitVectorCandidates(vectorFuture, vectorDeadline, lexicalCandidates, degradations);

    List<Candidate> merged = CandidateFusion.merge(vectorCandidates, lexicalCandidates, k);
    log.debug(
        "Retrieved {} vector + {} lexical candidates, {} after fusion (k={})",
        vectorCandidates.size(),
        lexicalCandidates.size(),
        merged.size(),
        k);

    if (merged.isEmpty()) {
      return RetrievalResult.of(List.of(), degradations);
    }
    return RetrievalResult.of(rerank(query, merged, degradations), degradations);
  }

  private List<Candidate> vectorSearch(String query, int k) {
    float[] queryVector;
    try {
      queryVector = context.embeddingModel().embed(query).content().vector();
    } catch (RuntimeException e) {
      throw new RetrievalBackendException("Query embedding failed: " + e.getMessage(), e);
    }
    return context.vectorIndexClient().search(queryVector, k);
  }

  private List<Candidate> awaitVectorCandidates(
      Future<List<Candidate>> future,
      long deadline,
      List<Candidate> lexicalCandidates,
      Set<Degradation> degradations) {
    Duration timeout = properties.getVectorTimeout();
    long remaining = Math.max(0L, deadline - System.nanoTime());
    try {
      return future.get(remaining, TimeUnit.NANOSECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      return degradeOrFail(
          new RetrievalBackendException("Vector search timed out after " + timeout, e),
          lexicalCandidates,
          degradations);
    } catch (ExecutionException e) {
      return degradeOrFail(asBackendException(e.getCause()), lexicalCandidates, degradations);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      throw new RetrievalFailedException("Interrupted while waiting for vector search", e);
    }
  }

  private List<Candidate> degradeOrFail(
      RetrievalBackendException failure,
      List<Candidate> lexicalCandidates,
      Set<Degradation> degradations) {
    boolean lexicalUsable = lexicalCandidates.stream().anyMatch(c -> c.score() > 0.0);
    if (properties.isDegradeOnVectorFailure() && lexicalUsable) {
      log.warn("Vector search unavailable, answering from lexical results: {}", failure.getMessage());
      degradations.add(Degradation.VECTOR_SEARCH_UNAVAILABLE);
      return List.of();
    }
    throw new RetrievalFailedException(
        "Vector search failed and lexical results alone are insufficient", failure);
  }

  private List<RankedContext> rerank(
      String query, List<Candidate> merged, Set<Degradation> degradations) {
    int topN = properties.getTopN();
    Duration timeout = properties.getRerankTimeout();
    Future<List<RankedContext>> future =
        submit(() -> context.reranker().rerank(query, merged, topN));
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      return fallback(
          new RerankModelException("Reranking timed out after " + timeout, e),
          merged,
          degradations);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof RerankModelException rerankFailure) {
        return fallback(rerankFailure, merged, degradations);
      }
      if (e.getCause() instanceof RejectedExecutionException rejected) {
        return fallback(
            new RerankModelException("Reranking could not be scheduled", rejected),
            merged,
            degradations);
      }
      throw new RetrievalFailedException("Reranking failed unexpectedly", e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      throw new RetrievalFailedException("Interrupted while waiting for reranking", e);
    }
  }

  private List<RankedContext> fallback(
      RerankModelException failure, List<Candidate> merged, Set<Degradation> degradations) {
    log.warn("Reranker unavailable, ordering by source score: {}", failure.getMessage());
    degradations.add(Degradation.RERANK_UNAVAILABLE);
    return Reranker.fallback(merged, properties.getTopN());
  }

  private <T> Future<T> submit(Callable<T> task) {
    try {
      return executor.submit(task);
    } catch (RejectedExecutionException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  private static RetrievalBackendException asBackendException(Throwable cause) {
    if (cause instanceof RetrievalBackendException backendFailure) {
      return backendFailure;
    }
    return new RetrievalBackendException("Vector search failed: " + cause.getMessage(), cause);
  }
}
