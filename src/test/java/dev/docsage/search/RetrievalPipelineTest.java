package dev.docsage.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.mock;

import dev.docsage.corpus.Chunk;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.scoring.ScoringModel;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.support.TaskExecutorAdapter;

@ExtendWith(MockitoExtension.class)
class RetrievalPipelineTest {

  private static final String QUERY = "how do I get a refund";

  private static final String REFUND_URL = "https://docs.example.com/refunds";
  private static final String SHIPPING_URL = "https://docs.example.com/shipping";
  private static final String ACCOUNT_URL = "https://docs.example.com/account";

  private static final Chunk REFUND =
      new Chunk(
          "Customers can request a refund within 30 days of purchase under our refund policy.",
          REFUND_URL,
          "Refund Policy");
  private static final Chunk SHIPPING =
      new Chunk(
          "Shipping times vary between 3 and 5 business days depending on region.",
          SHIPPING_URL,
          "Shipping");
  private static final Chunk ACCOUNT =
      new Chunk("Account deletion removes all personal data permanently.", ACCOUNT_URL, "Account");

  @Mock VectorIndexClient vectorIndexClient;
  @Mock EmbeddingModel embeddingModel;
  @Mock ScoringModel scoringModel;

  private final LexicalIndex lexicalIndex = LexicalIndex.load(List.of(REFUND, SHIPPING, ACCOUNT));
  private final RetrievalProperties properties = new RetrievalProperties();
  private ExecutorService executor;
  private RetrievalPipeline pipeline;

  @BeforeEach
  void setUp() {
    executor = Executors.newFixedThreadPool(4);
    pipeline = pipelineOver(lexicalIndex);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  // --- normal path ---

  @Test
  void refundChunkRanksFirstAndItsUrlIsListedOnce() {
    givenEmbedding();
    Chunk nearDuplicate =
        new Chunk(REFUND.text() + " Last updated in 2024.", REFUND_URL, "Refund Policy");
    given(vectorIndexClient.search(any(float[].class), anyInt()))
        .willReturn(
            List.of(
                new Candidate(nearDuplicate, 0.81, CandidateSource.VECTOR),
                new Candidate(SHIPPING, 0.22, CandidateSource.VECTOR)));
    givenModelPrefersRefundText();

    List<Candidate> lexical = lexicalIndex.search(LexicalIndex.tokenize(QUERY), 8);
    RetrievalResult result = pipeline.retrieve(QUERY, 8);

    assertThat(lexical.get(0).url()).isEqualTo(REFUND_URL);
    assertThat(result.contexts().get(0).url()).isEqualTo(REFUND_URL);
    assertThat(result.sources()).containsOnlyOnce(REFUND_URL);
    assertThat(result.sources()).containsExactly(REFUND_URL, SHIPPING_URL, ACCOUNT_URL);
    assertThat(result.contexts()).hasSize(3);
    assertThat(result.isDegraded()).isFalse();
  }

  @Test
  void contextsAreCappedAtTopNRegardlessOfK() {
    givenEmbedding();
    List<Candidate> vector = new ArrayList<>();
    for (int i = 0; i < 10; i++) {
      vector.add(
          new Candidate(
              new Chunk("vector chunk number " + i, "https://docs.example.com/v" + i, null),
              0.9 - i * 0.05,
              CandidateSource.VECTOR));
    }
    given(vectorIndexClient.search(any(float[].class), anyInt())).willReturn(vector);
    givenModelPrefersRefundText();

    RetrievalResult result = pipeline.retrieve(QUERY, 8);

    assertThat(result.contexts()).hasSize(6);
    for (int i = 1; i < result.contexts().size(); i++) {
      assertThat(result.contexts().get(i - 1).rerankScore())
          .isGreaterThanOrEqualTo(result.contexts().get(i).rerankScore());
    }
  }

  @Test
  void requestBreadthIsPassedToBothSources() {
    givenEmbedding();
    given(vectorIndexClient.search(any(float[].class), anyInt())).willReturn(List.of());
    givenModelPrefersRefundText();

    RetrievalResult result = pipeline.retrieve(QUERY, 2);

    then(vectorIndexClient).should().search(any(float[].class), eq(2));
    assertThat(result.contexts()).hasSize(2);
  }

  @Test
  void noCandidatesFromEitherSourceIsAnEmptyResult() {
    LexicalIndex emptyLexical = mock(LexicalIndex.class);
    given(emptyLexical.search(anyList(), anyInt())).willReturn(List.of());
    givenEmbedding();
    given(vectorIndexClient.search(any(float[].class), anyInt())).willReturn(List.of());

    RetrievalResult result = pipelineOver(emptyLexical).retrieve(QUERY, 8);

    assertThat(result.contexts()).isEmpty();
    assertThat(result.sources()).isEmpty();
    then(scoringModel).shouldHaveNoInteractions();
  }

  @Test
  void rejectsBlankQuery() {
    assertThatThrownBy(() -> pipeline.retrieve("   ", 8))
        .isInstanceOf(IllegalArgumentException.class);
  }

  // --- vector failures ---

  @Test
  void vectorFailureDegradesToLexicalResults() {
    givenEmbedding();
    given(vectorIndexClient.search(any(float[].class), anyInt()))
        .willThrow(new RetrievalBackendException("collection missing", new RuntimeException()));
    givenModelPrefersRefundText();

    RetrievalResult result = pipeline.retrieve(QUERY, 8);

    assertThat(result.degradations()).containsExactly(Degradation.VECTOR_SEARCH_UNAVAILABLE);
    assertThat(result.contexts()).allMatch(c -> c.source() == CandidateSource.LEXICAL);
    assertThat(result.contexts().get(0).url()).isEqualTo(REFUND_URL);
  }

  @Test
  void embeddingFailureIsTreatedAsVectorFailure() {
    given(embeddingModel.embed(anyString())).willThrow(new IllegalStateException("model not loaded"));
    givenModelPrefersRefundText();

    RetrievalResult result = pipeline.retrieve(QUERY, 8);

    assertThat(result.degradations()).containsExactly(Degradation.VECTOR_SEARCH_UNAVAILABLE);
    then(vectorIndexClient).shouldHaveNoInteractions();
  }

  @Test
  void vectorFailureFailsWhenDegradationDisabled() {
    properties.setDegradeOnVectorFailure(false);
    givenEmbedding();
    given(vectorIndexClient.search(any(float[].class), anyInt()))
        .willThrow(new RetrievalBackendException("collection missing", new RuntimeException()));

    assertThatThrownBy(() -> pipeline.retrieve(QUERY, 8))
        .isInstanceOf(RetrievalFailedException.class)
        .hasCauseInstanceOf(RetrievalBackendException.class);
  }

  @Test
  void vectorFailureFailsWhenLexicalFoundNothingRelevant() {
    givenEmbedding();
    given(vectorIndexClient.search(any(float[].class), anyInt()))
        .willThrow(new RetrievalBackendException("collection missing", new RuntimeException()));

    assertThatThrownBy(() -> pipeline.retrieve("warranty coverage", 8))
        .isInstanceOf(RetrievalFailedException.class);
    then(scoringModel).shouldHaveNoInteractions();
  }

  @Test
  void vectorTimeoutDegradesToLexicalResults() {
    properties.setVectorTimeout(Duration.ofMillis(100));
    given(embeddingModel.embed(anyString()))
        .willAnswer(
            invocation -> {
              Thread.sleep(5_000);
              return Response.from(Embedding.from(new float[] {0.1f, 0.2f, 0.3f}));
            });
    givenModelPrefersRefundText();

    RetrievalResult result = pipeline.retrieve(QUERY, 8);

    assertThat(result.degradations()).containsExactly(Degradation.VECTOR_SEARCH_UNAVAILABLE);
    assertThat(result.contexts()).isNotEmpty();
  }

  @Test
  void timedOutVectorSearchIsInterrupted() throws InterruptedException {
    properties.setVectorTimeout(Duration.ofMillis(100));
    CountDownLatch interrupted = new CountDownLatch(1);
    given(embeddingModel.embed(anyString()))
        .willAnswer(
            invocation -> {
              try {
                Thread.sleep(5_000);
              } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
              }
              return Response.from(Embedding.from(new float[] {0.1f, 0.2f, 0.3f}));
            });
    givenModelPrefersRefundText();

    pipeline.retrieve(QUERY, 8);

    assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
  }

  @Test
  void vectorTimeoutCountsFromSubmissionNotFromEndOfLexicalSearch() {
    properties.setVectorTimeout(Duration.ofMillis(500));
    LexicalIndex slowLexical = mock(LexicalIndex.class);
    given(slowLexical.search(anyList(), anyInt()))
        .willAnswer(
            invocation -> {
              Thread.sleep(600);
              return List.of(new Candidate(REFUND, 2.0, CandidateSource.LEXICAL));
            });
    given(embeddingModel.embed(anyString()))
        .willAnswer(
            invocation -> {
              Thread.sleep(900);
              return Response.from(Embedding.from(new float[] {0.1f, 0.2f, 0.3f}));
            });
    givenModelPrefersRefundText();

    RetrievalResult result = pipelineOver(slowLexical).retrieve(QUERY, 8);

    assertThat(result.degradations()).containsExactly(Degradation.VECTOR_SEARCH_UNAVAILABLE);
    assertThat(result.sources()).containsExactly(REFUND_URL);
  }

  // --- rerank failures ---

  @Test
  void rerankFailureFallsBackToSourceScoreOrder() {
    givenEmbedding();
    given(vectorIndexClient.search(any(float[].class), anyInt()))
        .willReturn(List.of(new Candidate(SHIPPING, 0.4, CandidateSource.VECTOR)));
    given(scoringModel.scoreAll(anyList(), anyString()))
        .willThrow(new IllegalStateException("ONNX failure"));

    RetrievalResult result = pipeline.retrieve(QUERY, 8);

    assertThat(result.degradations()).containsExactly(Degradation.RERANK_UNAVAILABLE);
    assertThat(result.contexts().get(0).url()).isEqualTo(REFUND_URL);
    assertThat(result.contexts()).allMatch(c -> c.rerankScore() == c.score());
  }

  @Test
  void rerankTimeoutFallsBackToSourceScoreOrder() {
    properties.setRerankTimeout(Duration.ofMillis(100));
    givenEmbedding();
    given(vectorIndexClient.search(any(float[].class), anyInt())).willReturn(List.of());
    given(scoringModel.scoreAll(anyList(), anyString()))
        .willAnswer(
            invocation -> {
              Thread.sleep(5_000);
              return Response.from(List.of());
            });

    RetrievalResult result = pipeline.retrieve(QUERY, 8);

    assertThat(result.degradations()).containsExactly(Degradation.RERANK_UNAVAILABLE);
    assertThat(result.contexts()).hasSize(3);
  }

  @Test
  void bothFailuresAreReported() {
    given(embeddingModel.embed(anyString())).willThrow(new IllegalStateException("down"));
    given(scoringModel.scoreAll(anyList(), anyString())).willThrow(new IllegalStateException("down"));

    RetrievalResult result = pipeline.retrieve(QUERY, 8);

    assertThat(result.degradations())
        .containsExactlyInAnyOrder(
            Degradation.VECTOR_SEARCH_UNAVAILABLE, Degradation.RERANK_UNAVAILABLE);
    assertThat(result.sources()).first().isEqualTo(REFUND_URL);
  }

  private RetrievalPipeline pipelineOver(LexicalIndex index) {
    PipelineContext context =
        new PipelineContext(index, vectorIndexClient, embeddingModel, new Reranker(scoringModel));
    return new RetrievalPipeline(context, properties, new TaskExecutorAdapter(executor));
  }

  private void givenEmbedding() {
    given(embeddingModel.embed(anyString()))
        .willReturn(Response.from(Embedding.from(new float[] {0.1f, 0.2f, 0.3f})));
  }

  private void givenModelPrefersRefundText() {
    given(scoringModel.scoreAll(anyList(), anyString()))
        .willAnswer(
            invocation -> {
              List<TextSegment> segments = invocation.getArgument(0);
              return Response.from(
                  segments.stream().map(s -> s.text().contains("refund") ? 8.5 : -4.0).toList());
            });
  }
}
