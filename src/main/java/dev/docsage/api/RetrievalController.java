package dev.docsage.api;

import dev.docsage.search.RetrievalPipeline;
import dev.docsage.search.RetrievalProperties;
import dev.docsage.search.RetrievalRequest;
import dev.docsage.search.RetrievalResult;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP entry point for hybrid retrieval. Errors are rendered as Problem Details by {@link
 * dev.docsage.config.GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api")
public class RetrievalController {

  private final RetrievalPipeline pipeline;
  private final RetrievalProperties properties;

  public RetrievalController(RetrievalPipeline pipeline, RetrievalProperties properties) {
    this.pipeline = pipeline;
    this.properties = properties;
  }

  @PostMapping("/retrieve")
  public RetrieveResponse retrieve(@Valid @RequestBody RetrieveRequest body) {
    int k = body.k() != null ? body.k() : properties.getDefaultK();
    RetrievalResult result = pipeline.retrieve(new RetrievalRequest(body.query(), k));
    return RetrieveResponse.from(result);
  }
}
