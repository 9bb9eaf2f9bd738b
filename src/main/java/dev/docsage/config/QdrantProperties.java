package dev.docsage.config;

import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Connection settings for the Qdrant vector store, bound from {@code docsage.qdrant.*}.
 *
 * @param host Qdrant host name
 * @param port gRPC port (Qdrant serves REST on 6333 and gRPC on 6334)
 * @param apiKey API key; null or blank for an unauthenticated instance
 * @param useTls whether to connect over TLS
 * @param collection name of the collection written by the indexer
 */
@ConfigurationProperties(prefix = "docsage.qdrant")
public record QdrantProperties(
    @DefaultValue("localhost") String host,
    @DefaultValue("6334") int port,
    @Nullable String apiKey,
    @DefaultValue("false") boolean useTls,
    @DefaultValue("capillary_docs") String collection) {}
