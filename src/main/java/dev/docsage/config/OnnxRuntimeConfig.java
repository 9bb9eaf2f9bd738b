package dev.docsage.config;

import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtLoggingLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.config.BeanFactoryPostProcessor;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.context.EnvironmentAware;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

/**
 * Configures the ONNX Runtime environment before any ONNX model bean is created.
 *
 * <p>Implemented as a {@link BeanFactoryPostProcessor} so the {@link OrtEnvironment} singleton is
 * created with custom threading options before Spring instantiates the embedding and scoring
 * models. Both models call {@code OrtEnvironment.getEnvironment()}, and the environment cannot be
 * reconfigured after first creation.
 *
 * <p>Thread counts come from {@code docsage.onnx.intra-op-threads} (default 4) and {@code
 * docsage.onnx.inter-op-threads} (default 2). Thread spinning is disabled to keep idle CPU low
 * between requests.
 */
@Configuration
public class OnnxRuntimeConfig implements BeanFactoryPostProcessor, EnvironmentAware {

  private static final Logger log = LoggerFactory.getLogger(OnnxRuntimeConfig.class);

  static final int DEFAULT_INTRA_OP_THREADS = 4;
  static final int DEFAULT_INTER_OP_THREADS = 2;

  private int intraOpThreads = DEFAULT_INTRA_OP_THREADS;
  private int interOpThreads = DEFAULT_INTER_OP_THREADS;

  @Override
  public void setEnvironment(Environment environment) {
    this.intraOpThreads =
        environment.getProperty(
            "docsage.onnx.intra-op-threads", Integer.class, DEFAULT_INTRA_OP_THREADS);
    this.interOpThreads =
        environment.getProperty(
            "docsage.onnx.inter-op-threads", Integer.class, DEFAULT_INTER_OP_THREADS);
  }

  @Override
  public void postProcessBeanFactory(ConfigurableListableBeanFactory beanFactory)
      throws BeansException {
    try (var threadingOptions = new OrtEnvironment.ThreadingOptions()) {
      threadingOptions.setGlobalSpinControl(false);
      threadingOptions.setGlobalIntraOpNumThreads(intraOpThreads);
      threadingOptions.setGlobalInterOpNumThreads(interOpThreads);

      OrtEnvironment.getEnvironment(
          OrtLoggingLevel.ORT_LOGGING_LEVEL_WARNING, "docsage", threadingOptions);

      log.info(
          "ONNX Runtime initialized: spinning=off, intra-op={}, inter-op={}",
          intraOpThreads,
          interOpThreads);
    } catch (OrtException e) {
      throw new IllegalStateException("Failed to configure ONNX Runtime threading", e);
    } catch (IllegalStateException e) {
      log.warn(
          "ONNX Runtime environment already initialized, threading options not applied: {}",
          e.getMessage());
    }
  }
}
