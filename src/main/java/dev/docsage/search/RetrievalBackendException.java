package dev.docsage.search;

/**
 * The vector store could not answer a query: it is unreachable, rejected the credentials, or the
 * collection does not exist. The pipeline decides whether to degrade to lexical-only results.
 */
public class RetrievalBackendException extends RuntimeException {

  public RetrievalBackendException(String message, Throwable cause) {
    super(message, cause);
  }
}
