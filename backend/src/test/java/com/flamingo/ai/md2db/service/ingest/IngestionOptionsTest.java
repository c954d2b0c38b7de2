package com.flamingo.ai.md2db.service.ingest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.md2db.config.IngestionConfig;
import java.io.IOException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.env.StandardEnvironment;
import org.springframework.core.io.FileSystemResource;

@DisplayName("IngestionOptions Tests")
class IngestionOptionsTest {

  @Test
  @DisplayName("should take values from configuration and derive the queue depth")
  void shouldResolveFromConfig() {
    IngestionConfig config = new IngestionConfig();
    config.getWorkers().setCount(3);
    config.getBatch().setSize(50);

    IngestionOptions options = IngestionOptions.from(config);

    assertThat(options.workerCount()).isEqualTo(3);
    assertThat(options.queueDepth()).isEqualTo(6);
    assertThat(options.batchSize()).isEqualTo(50);
    assertThat(options.retryLimit()).isEqualTo(2);
    assertThat(options.targetChunkSizeBytes()).isEqualTo(10L * 1024 * 1024);
    assertThat(options.maxBoundarySearchBytes()).isEqualTo(10_000);
  }

  @Test
  @DisplayName("should default the worker count to the available processors")
  void shouldDefaultWorkerCount() {
    IngestionOptions options =
        IngestionOptions.builder()
            .targetChunkSizeBytes(1024)
            .maxBoundarySearchBytes(100)
            .batchSize(10)
            .build();

    assertThat(options.workerCount()).isEqualTo(Runtime.getRuntime().availableProcessors());
    assertThat(options.queueDepth()).isEqualTo(2 * options.workerCount());
  }

  @Test
  @DisplayName("should use the available processors when the configured worker count is zero")
  void shouldResolveZeroWorkerCount() {
    IngestionConfig config = new IngestionConfig();
    config.getWorkers().setCount(0);

    IngestionOptions options = IngestionOptions.from(config);

    assertThat(options.workerCount()).isEqualTo(Runtime.getRuntime().availableProcessors());
  }

  @Test
  @DisplayName("should not pin the worker count in the shipped application.yml")
  void shouldDefaultShippedWorkerCountToProcessors() throws IOException {
    StandardEnvironment environment = new StandardEnvironment();
    for (PropertySource<?> source :
        new YamlPropertySourceLoader()
            .load("application", new FileSystemResource("src/main/resources/application.yml"))) {
      environment.getPropertySources().addLast(source);
    }
    IngestionConfig config =
        Binder.get(environment).bind("ingestion", IngestionConfig.class).get();

    IngestionOptions options = IngestionOptions.from(config);

    if (System.getenv("INGESTION_WORKERS") == null) {
      assertThat(options.workerCount()).isEqualTo(Runtime.getRuntime().availableProcessors());
    }
    assertThat(options.batchSize()).isEqualTo(1000);
  }

  @Test
  @DisplayName("should reject a non-positive batch size")
  void shouldRejectInvalidBatchSize() {
    assertThatThrownBy(
            () ->
                IngestionOptions.builder()
                    .targetChunkSizeBytes(1024)
                    .maxBoundarySearchBytes(100)
                    .batchSize(0)
                    .build())
        .isInstanceOf(IllegalArgumentException.class);
  }
}
