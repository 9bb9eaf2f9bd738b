package dev.docsage.config;

import dev.docsage.corpus.Chunk;
import dev.docsage.corpus.CorpusProperties;
import dev.docsage.corpus.CorpusSnapshotReader;
import dev.docsage.search.LexicalIndex;
import dev.docsage.search.PipelineContext;
import dev.docsage.search.Reranker;
import dev.docsage.search.RetrievalProperties;
import dev.docsage.search.VectorIndexClient;
import dev.langchain4j.model.embedding.EmbeddingModel;
import io.qdrant.client.QdrantClient;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Wires the retrieval pipeline: the BM25 index built from the corpus snapshot, the vector index
 * client, and the bounded executor that runs vector and rerank calls.
 *
 * <p>Building the {@link LexicalIndex} bean reads the whole snapshot; a missing, empty or
 * malformed snapshot fails context startup.
 */
@Configuration
public class RetrievalConfig {

  private static final Logger log = LoggerFactory.getLogger(RetrievalConfig.class);

  @Bean
  public LexicalIndex lexicalIndex(CorpusSnapshotReader reader, CorpusProperties corpus) {
    List<Chunk> chunks = reader.read(corpus.snapshotPath());
    LexicalIndex index = LexicalIndex.load(chunks);
    log.info(
        "BM25 index ready: {} chunks, {} distinct terms, avg length {}",
        index.size(),
        index.vocabularySize(),
        String.format("%.1f", index.averageDocumentLength()));
    return index;
  }

  @Bean
  public VectorIndexClient vectorIndexClient(
      QdrantClient qdrantClient, QdrantProperties qdrant, RetrievalProperties retrieval) {
    return new VectorIndexClient(
        qdrantClient, qdrant.collection(), retrieval.getMinSimilarity());
  }

  @Bean
  public PipelineContext pipelineContext(
      LexicalIndex lexicalIndex,
      VectorIndexClient vectorIndexClient,
      EmbeddingModel embeddingModel,
      Reranker reranker) {
    return new PipelineContext(lexicalIndex, vectorIndexClient, embeddingModel, reranker);
  }

  /**
   * Bounded pool for vector search and rerank calls. Both calls of one request can be in flight
   * at once, so the pool is sized in pairs; requests beyond the queue capacity are rejected and
   * handled by the pipeline's failure policy.
   */
  @Bean(name = "retrievalExecutor")
  public ThreadPoolTaskExecutor retrievalExecutor(RetrievalProperties retrieval) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(retrieval.getExecutorPoolSize());
    executor.setMaxPoolSize(retrieval.getExecutorPoolSize());
    executor.setQueueCapacity(retrieval.getExecutorPoolSize() * 16);
    executor.setThreadNamePrefix("retrieval-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(10);
    executor.initialize();
    return executor;
  }
}
