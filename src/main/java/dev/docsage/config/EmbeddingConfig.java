package dev.docsage.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2.AllMiniLmL6V2EmbeddingModel;
import dev.langchain4j.model.scoring.ScoringModel;
import dev.langchain4j.model.scoring.onnx.OnnxScoringModel;
import io.qdrant.client.QdrantClient;
import io.qdrant.client.QdrantGrpcClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures the embedding model, the cross-encoder scoring model and the Qdrant client beans.
 *
 * <p>Both models run in-process on ONNX Runtime: all-MiniLM-L6-v2 (384 dimensions) must be the
 * model the indexer embedded the collection with, and ms-marco-MiniLM-L-6-v2 is loaded from local
 * model and tokenizer files.
 *
 * @see dev.docsage.search.RetrievalPipeline
 */
@Configuration
public class EmbeddingConfig {

  private static final Logger log = LoggerFactory.getLogger(EmbeddingConfig.class);

  /**
   * Provides the in-process ONNX embedding model (all-MiniLM-L6-v2, 384 dimensions).
   *
   * @return a ready-to-use embedding model requiring no external API
   */
  @Bean
  public EmbeddingModel embeddingModel() {
    return new AllMiniLmL6V2EmbeddingModel();
  }

  /**
   * Provides the in-process ONNX cross-encoder scoring model (ms-marco-MiniLM-L-6-v2).
   *
   * @param modelPath path to the ONNX model file
   * @param tokenizerPath path to the tokenizer JSON file
   * @return a scoring model for cross-encoder reranking
   */
  @Bean
  public ScoringModel scoringModel(
      @Value("${docsage.reranker.model-path}") String modelPath,
      @Value("${docsage.reranker.tokenizer-path}") String tokenizerPath) {
    return new OnnxScoringModel(modelPath, tokenizerPath);
  }

  /**
   * Connects to the Qdrant instance holding the collection written by the indexer. The
   * collection, its vector size and cosine distance are provisioned by the indexer, not here.
   *
   * @param qdrant connection settings
   * @return a gRPC Qdrant client, closed with the context
   */
  @Bean(destroyMethod = "close")
  public QdrantClient qdrantClient(QdrantProperties qdrant) {
    log.info(
        "Using Qdrant collection '{}' at {}:{} (tls={})",
        qdrant.collection(),
        qdrant.host(),
        qdrant.port(),
        qdrant.useTls());
    QdrantGrpcClient.Builder grpc =
        QdrantGrpcClient.newBuilder(qdrant.host(), qdrant.port(), qdrant.useTls());
    if (qdrant.apiKey() != null && !qdrant.apiKey().isBlank()) {
      grpc.withApiKey(qdrant.apiKey());
    }
    return new QdrantClient(grpc.build());
  }
}
