package dev.docsage.corpus;

/**
 * Raised when the lexical corpus cannot be built: the snapshot is missing, unreadable,
 * malformed, or holds no indexable chunk. Thrown during startup; the application must not serve
 * queries without a lexical index.
 */
public class IndexUnavailableException extends RuntimeException {

  public IndexUnavailableException(String message) {
    super(message);
  }

  public IndexUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
