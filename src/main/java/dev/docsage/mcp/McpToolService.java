package dev.docsage.mcp;

import dev.docsage.search.Degradation;
import dev.docsage.search.LexicalIndex;
import dev.docsage.search.RetrievalFailedException;
import dev.docsage.search.RetrievalPipeline;
import dev.docsage.search.RetrievalProperties;
import dev.docsage.search.RetrievalRequest;
import dev.docsage.search.RetrievalResult;
import dev.docsage.search.VectorIndexClient;
import dev.langchain4j.model.embedding.EmbeddingModel;
import java.util.Locale;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * MCP adapter exposing retrieval as tool methods.
 *
 * <p>Each method is annotated with {@code @Tool} and registered via {@link McpToolConfig}. Tool
 * methods follow the structured error pattern: all exceptions are caught and returned as
 * descriptive error strings, never thrown.
 *
 * @see TokenBudgetTruncator
 */
@Service
public class McpToolService {

  private static final Logger log = LoggerFactory.getLogger(McpToolService.class);

  static final int MAX_K = 50;

  private final RetrievalPipeline pipeline;
  private final RetrievalProperties properties;
  private final TokenBudgetTruncator truncator;
  private final LexicalIndex lexicalIndex;
  private final VectorIndexClient vectorIndexClient;
  private final EmbeddingModel embeddingModel;

  public McpToolService(
      RetrievalPipeline pipeline,
      RetrievalProperties properties,
      TokenBudgetTruncator truncator,
      LexicalIndex lexicalIndex,
      VectorIndexClient vectorIndexClient,
      EmbeddingModel embeddingModel) {
    this.pipeline = pipeline;
    this.properties = properties;
    this.truncator = truncator;
    this.lexicalIndex = lexicalIndex;
    this.vectorIndexClient = vectorIndexClient;
    this.embeddingModel = embeddingModel;
  }

  /** Retrieves reranked documentation excerpts for a question, formatted within the token budget. */
  @Tool(
      name = "search_docs",
      description =
          "Search the indexed documentation with hybrid keyword and semantic retrieval. "
              + "Returns reranked excerpts with titles, source URLs and scores, followed by "
              + "a list of sources for citation.")
  public String searchDocs(
      @ToolParam(description = "Question or search query text") @Nullable String query,
      @ToolParam(
              description = "Retrieval breadth per source (1-50, default 8)",
              required = false)
          @Nullable Integer k) {
    try {
      if (query == null || query.isBlank()) {
        return "Error: Query must not be empty. Provide a search query string.";
      }
      RetrievalResult result = pipeline.retrieve(new RetrievalRequest(query, clampK(k)));
      if (result.isEmpty()) {
        return "No relevant context found for query: '%s'. Try rephrasing with different keywords."
            .formatted(query);
      }

      String formatted = truncator.truncate(result.contexts());
      if (result.isDegraded()) {
        return degradationNotice(result) + formatted;
      }
      return formatted;
    } catch (RetrievalFailedException e) {
      log.warn("search_docs failed: {}", e.getMessage());
      return "Error searching documentation: " + e.getUserMessage();
    } catch (Exception e) {
      log.warn("search_docs failed: {}", e.getMessage());
      return "Error searching documentation: " + e.getMessage();
    }
  }

  /** Reports the size of the lexical index and the vector collection in use. */
  @Tool(
      name = "index_statistics",
      description =
          "View index statistics: corpus size, vocabulary size, average chunk length, "
              + "vector collection and embedding dimensions.")
  public String indexStatistics() {
    try {
      return String.format(
          Locale.ROOT,
          """
          Index Statistics:
          - Corpus chunks: %,d
          - Vocabulary size: %,d
          - Average chunk length: %.1f tokens
          - Vector collection: %s
          - Embedding dimensions: %d (all-MiniLM-L6-v2)
          - Similarity floor: %.2f""",
          lexicalIndex.size(),
          lexicalIndex.vocabularySize(),
          lexicalIndex.averageDocumentLength(),
          vectorIndexClient.collectionName(),
          embeddingModel.dimension(),
          vectorIndexClient.minSimilarity());
    } catch (Exception e) {
      return "Error retrieving index statistics: " + e.getMessage();
    }
  }

  private int clampK(@Nullable Integer k) {
    if (k == null) {
      return properties.getDefaultK();
    }
    return Math.max(1, Math.min(k, MAX_K));
  }

  private static String degradationNotice(RetrievalResult result) {
    StringBuilder notice = new StringBuilder();
    if (result.degradations().contains(Degradation.VECTOR_SEARCH_UNAVAILABLE)) {
      notice.append("Note: semantic search is unavailable; results come from keyword search only.\n");
    }
    if (result.degradations().contains(Degradation.RERANK_UNAVAILABLE)) {
      notice.append("Note: reranking is unavailable; results are ordered by retrieval score.\n");
    }
    return notice.append('\n').toString();
  }
}
