package dev.docsage.search;

import static io.qdrant.client.WithPayloadSelectorFactory.enable;

import dev.docsage.corpus.Chunk;
import io.qdrant.client.QdrantClient;
import io.qdrant.client.grpc.JsonWithInt.Value;
import io.qdrant.client.grpc.Points.ScoredPoint;
import io.qdrant.client.grpc.Points.SearchPoints;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * k-nearest-neighbour adapter over the vector collection written by the indexer.
 *
 * <p>The collection uses cosine distance, so Qdrant scores are cosine similarities already. The
 * similarity floor is sent as the search score threshold and applied again to every returned
 * point.
 *
 * <p>Payload keys: {@code text}, {@code url}, {@code title}. The payload is read directly, so a
 * point with no text is kept with an empty string and still carries its url and title.
 */
public class VectorIndexClient {

  private static final Logger log = LoggerFactory.getLogger(VectorIndexClient.class);

  static final String TEXT_KEY = "text";
  static final String URL_KEY = "url";
  static final String TITLE_KEY = "title";

  /** Qdrant scores are single precision; absorbs the float rounding of the floor itself. */
  private static final double FLOOR_TOLERANCE = 1e-6;

  private final QdrantClient qdrantClient;
  private final String collectionName;
  private final double minSimilarity;

  public VectorIndexClient(QdrantClient qdrantClient, String collectionName, double minSimilarity) {
    if (minSimilarity < -1.0 || minSimilarity > 1.0) {
      throw new IllegalArgumentException(
          "minSimilarity must be a cosine similarity in [-1, 1], got: " + minSimilarity);
    }
    this.qdrantClient = Objects.requireNonNull(qdrantClient, "qdrantClient");
    this.collectionName = Objects.requireNonNull(collectionName, "collectionName");
    this.minSimilarity = minSimilarity;
  }

  /**
   * Queries the collection for the nearest neighbours of a pre-computed query embedding.
   *
   * @param queryVector the query embedding (dimension must match the collection)
   * @param k maximum number of neighbours (must be >= 1)
   * @return candidates with cosine similarity >= the configured floor, in store order
   * @throws RetrievalBackendException if the collection cannot be queried
   */
  public List<Candidate> search(float[] queryVector, int k) {
    if (k < 1) {
      throw new IllegalArgumentException("k must be at least 1");
    }
    SearchPoints request =
        SearchPoints.newBuilder()
            .setCollectionName(collectionName)
            .addAllVector(toList(queryVector))
            .setLimit(k)
            .setScoreThreshold((float) minSimilarity)
            .setWithPayload(enable(true))
            .build();

    List<ScoredPoint> points = execute(request);

    List<Candidate> candidates =
        points.stream()
            .map(VectorIndexClient::toCandidate)
            .filter(c -> c.score() >= minSimilarity - FLOOR_TOLERANCE)
            .toList();
    log.debug(
        "Vector search on '{}' returned {} points, {} above similarity {}",
        collectionName,
        points.size(),
        candidates.size(),
        minSimilarity);
    return candidates;
  }

  public String collectionName() {
    return collectionName;
  }

  public double minSimilarity() {
    return minSimilarity;
  }

  private List<ScoredPoint> execute(SearchPoints request) {
    Future<List<ScoredPoint>> response;
    try {
      response = qdrantClient.searchAsync(request);
    } catch (RuntimeException e) {
      throw failure(e);
    }
    try {
      return response.get();
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      throw failure(cause);
    } catch (InterruptedException e) {
      response.cancel(true);
      Thread.currentThread().interrupt();
      throw failure(e);
    }
  }

  private RetrievalBackendException failure(Throwable cause) {
    return new RetrievalBackendException(
        "Vector search against collection '%s' failed: %s"
            .formatted(collectionName, cause.getMessage()),
        cause);
  }

  private static Candidate toCandidate(ScoredPoint point) {
    Map<String, Value> payload = point.getPayloadMap();
    String text = payloadString(payload, TEXT_KEY);
    Chunk chunk =
        new Chunk(
            text != null ? text : "",
            payloadString(payload, URL_KEY),
            payloadString(payload, TITLE_KEY));
    return new Candidate(chunk, point.getScore(), CandidateSource.VECTOR);
  }

  private static @Nullable String payloadString(Map<String, Value> payload, String key) {
    Value value = payload.get(key);
    if (value == null || value.getKindCase() != Value.KindCase.STRING_VALUE) {
      return null;
    }
    String str = value.getStringValue();
    return str.isEmpty() ? null : str;
  }

  private static List<Float> toList(float[] vector) {
    List<Float> values = new ArrayList<>(vector.length);
    for (float v : vector) {
      values.add(v);
    }
    return values;
  }
}
