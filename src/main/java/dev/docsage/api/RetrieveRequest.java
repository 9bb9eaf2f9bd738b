package dev.docsage.api;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.jspecify.annotations.Nullable;

/**
 * Body of {@code POST /api/retrieve}.
 *
 * @param query the user question (required, non-blank)
 * @param k retrieval breadth per source; {@code null} uses {@code docsage.retrieval.default-k}
 */
public record RetrieveRequest(@NotBlank String query, @Nullable @Min(1) Integer k) {}
