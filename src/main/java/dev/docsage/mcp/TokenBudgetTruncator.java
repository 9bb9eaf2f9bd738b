package dev.docsage.mcp;

import dev.docsage.search.RankedContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Formats ranked contexts for an MCP client within a configurable token budget.
 *
 * <p>Tokens are estimated as characters / 4. Contexts are rendered in rerank order and accumulated
 * until the next one would exceed the budget. If even the first context exceeds the budget, it is
 * cut at the character level so that at least one context is always returned. A {@code Sources:}
 * list with the distinct URLs of the rendered contexts follows and is not counted against the
 * budget.
 */
@Component
public class TokenBudgetTruncator {

  private static final double CHARS_PER_TOKEN = 4.0;

  private final int tokenBudget;

  public TokenBudgetTruncator(@Value("${docsage.mcp.token-budget:5000}") int tokenBudget) {
    if (tokenBudget < 1) {
      throw new IllegalArgumentException("docsage.mcp.token-budget must be >= 1, got: " + tokenBudget);
    }
    this.tokenBudget = tokenBudget;
  }

  /**
   * Formats and truncates contexts to fit within the configured token budget.
   *
   * @param contexts contexts in rerank order
   * @return formatted text, or an empty string when there is nothing to format
   */
  public String truncate(@Nullable List<RankedContext> contexts) {
    if (contexts == null || contexts.isEmpty()) {
      return "";
    }

    StringBuilder output = new StringBuilder();
    List<String> sources = new ArrayList<>();
    int estimatedTokens = 0;

    for (int i = 0; i < contexts.size(); i++) {
      RankedContext context = contexts.get(i);
      String formatted = formatContext(i + 1, context);
      int contextTokens = estimateTokens(formatted);

      if (i == 0 && contextTokens > tokenBudget) {
        int maxChars = (int) (tokenBudget * CHARS_PER_TOKEN);
        output.append(formatted, 0, Math.min(maxChars, formatted.length())).append("\n\n");
        addSource(sources, context);
        break;
      }

      if (estimatedTokens + contextTokens > tokenBudget) {
        break;
      }

      output.append(formatted);
      addSource(sources, context);
      estimatedTokens += contextTokens;
    }

    if (!sources.isEmpty()) {
      output.append("Sources:\n");
      sources.forEach(url -> output.append("- ").append(url).append('\n'));
    }
    return output.toString();
  }

  /**
   * Returns the configured token budget.
   *
   * @return the maximum number of estimated tokens for rendered contexts
   */
  public int getTokenBudget() {
    return tokenBudget;
  }

  int estimateTokens(String text) {
    return (int) Math.ceil(text.length() / CHARS_PER_TOKEN);
  }

  private static void addSource(List<String> sources, RankedContext context) {
    String url = context.url();
    if (url != null && !url.isEmpty() && !sources.contains(url)) {
      sources.add(url);
    }
  }

  private String formatContext(int index, RankedContext context) {
    return String.format(
        Locale.ROOT,
        "## [%d] %s\nSource: %s\nScore: %.3f\n\n%s\n\n---\n",
        index,
        Objects.requireNonNullElse(context.title(), "Untitled"),
        Objects.requireNonNullElse(context.url(), "unknown"),
        context.rerankScore(),
        context.text());
  }
}
