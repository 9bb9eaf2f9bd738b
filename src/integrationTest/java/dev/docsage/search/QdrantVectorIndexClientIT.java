package dev.docsage.search;

import static io.qdrant.client.PointIdFactory.id;
import static io.qdrant.client.ValueFactory.value;
import static io.qdrant.client.VectorsFactory.vectors;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.qdrant.client.QdrantClient;
import io.qdrant.client.QdrantGrpcClient;
import io.qdrant.client.grpc.Collections.Distance;
import io.qdrant.client.grpc.Collections.VectorParams;
import io.qdrant.client.grpc.JsonWithInt.Value;
import io.qdrant.client.grpc.Points.PointStruct;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.qdrant.QdrantContainer;

/**
 * Runs {@link VectorIndexClient} against a real Qdrant instance, with hand-made 4-dimensional
 * vectors so cosine similarities are known exactly.
 */
@Testcontainers
class QdrantVectorIndexClientIT {

  private static final String COLLECTION = "capillary_docs";
  private static final int GRPC_PORT = 6334;

  @Container static QdrantContainer qdrant = new QdrantContainer("qdrant/qdrant:v1.13.4");

  private static QdrantClient qdrantClient;

  @BeforeAll
  static void createCollectionAndSeed() throws Exception {
    qdrantClient =
        new QdrantClient(
            QdrantGrpcClient.newBuilder(qdrant.getHost(), qdrant.getMappedPort(GRPC_PORT), false)
                .build());
    qdrantClient
        .createCollectionAsync(
            COLLECTION,
            VectorParams.newBuilder().setDistance(Distance.Cosine).setSize(4).build())
        .get();

    // cosine to the query {1, 0, 0, 0}: 0.995, 0.0995, 0.5 and 0.7071
    qdrantClient
        .upsertAsync(
            COLLECTION,
            List.of(
                point(1, new float[] {1f, 0.1f, 0f, 0f}, "Refunds are issued within 30 days.",
                    "https://a.com"),
                point(2, new float[] {0.1f, 1f, 0f, 0f}, "Shipping is free above 50 EUR.",
                    "https://b.com"),
                point(3, new float[] {0.5f, 0.5f, 0.5f, 0.5f}, "Accounts can be deleted.",
                    "https://c.com"),
                point(4, new float[] {1f, 0f, 1f, 0f}, null, "https://d.com")))
        .get();
  }

  @AfterAll
  static void closeClient() {
    if (qdrantClient != null) {
      qdrantClient.close();
    }
  }

  @Test
  void returnsNeighboursAboveSimilarityFloorInScoreOrder() {
    VectorIndexClient client = new VectorIndexClient(qdrantClient, COLLECTION, 0.15);

    List<Candidate> results = client.search(new float[] {1f, 0f, 0f, 0f}, 8);

    assertThat(results)
        .extracting(Candidate::url)
        .containsExactly("https://a.com", "https://d.com", "https://c.com");
    assertThat(results.get(0).score()).isCloseTo(1 / Math.sqrt(1.01), within(1e-4));
    assertThat(results.get(2).score()).isCloseTo(0.5, within(1e-4));
    assertThat(results.get(0).text()).isEqualTo("Refunds are issued within 30 days.");
    assertThat(results.get(0).title()).isEqualTo("Title https://a.com");
  }

  @Test
  void pointWithoutTextKeepsItsCitation() {
    VectorIndexClient client = new VectorIndexClient(qdrantClient, COLLECTION, 0.15);

    List<Candidate> results = client.search(new float[] {1f, 0f, 0f, 0f}, 8);

    assertThat(results).filteredOn(c -> c.text().isEmpty()).singleElement().satisfies(c -> {
      assertThat(c.url()).isEqualTo("https://d.com");
      assertThat(c.title()).isEqualTo("Title https://d.com");
    });
  }

  @Test
  void limitsResultsToK() {
    VectorIndexClient client = new VectorIndexClient(qdrantClient, COLLECTION, 0.15);

    assertThat(client.search(new float[] {1f, 0f, 0f, 0f}, 1)).hasSize(1);
  }

  @Test
  void missingCollectionIsBackendFailure() {
    VectorIndexClient client = new VectorIndexClient(qdrantClient, "no_such_collection", 0.15);

    assertThatThrownBy(() -> client.search(new float[] {1f, 0f, 0f, 0f}, 8))
        .isInstanceOf(RetrievalBackendException.class)
        .hasMessageContaining("no_such_collection");
  }

  private static PointStruct point(long pointId, float[] vector, @Nullable String text, String url) {
    Map<String, Value> payload = new HashMap<>();
    if (text != null) {
      payload.put("text", value(text));
    }
    payload.put("url", value(url));
    payload.put("title", value("Title " + url));
    return PointStruct.newBuilder()
        .setId(id(pointId))
        .setVectors(vectors(vector))
        .putAllPayload(payload)
        .build();
  }
}
