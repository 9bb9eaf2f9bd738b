package dev.docsage.search;

import dev.langchain4j.model.embedding.EmbeddingModel;
import java.util.Objects;

/**
 * The long-lived collaborators a {@link RetrievalPipeline} reads from. Built once at startup and
 * shared by every request; each member is safe for concurrent use after construction.
 *
 * @param lexicalIndex BM25 index over the corpus snapshot
 * @param vectorIndexClient client for the vector collection
 * @param embeddingModel query embedding model (dimension must match the collection)
 * @param reranker cross-encoder reranker
 */
public record PipelineContext(
    LexicalIndex lexicalIndex,
    VectorIndexClient vectorIndexClient,
    EmbeddingModel embeddingModel,
    Reranker reranker) {

  public PipelineContext {
    Objects.requireNonNull(lexicalIndex, "lexicalIndex");
    Objects.requireNonNull(vectorIndexClient, "vectorIndexClient");
    Objects.requireNonNull(embeddingModel, "embeddingModel");
    Objects.requireNonNull(reranker, "reranker");
  }
}
