package com.flamingo.ai.md2db.service.writer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.md2db.mongodb.BulkWriteReport;
import com.flamingo.ai.md2db.mongodb.InMemoryQuestionBankStore;
import com.flamingo.ai.md2db.mongodb.QuestionBankStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

@DisplayName("BatchWriter Tests")
class BatchWriterTest {

  private SimpleMeterRegistry meterRegistry;
  private List<BatchOutcome> outcomes;
  private BatchWriter.BatchListener listener;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    outcomes = Collections.synchronizedList(new ArrayList<>());
    listener = (batch, outcome) -> outcomes.add(outcome);
  }

  @Test
  @DisplayName("should hold questions below the batch size until flush")
  void shouldBufferUntilFlush() {
    QuestionBankStore store = mock(QuestionBankStore.class);
    when(store.insertQuestions(anyList())).thenReturn(new BulkWriteReport(2, List.of()));

    try (BatchWriter writer = new BatchWriter(store, 3, listener, meterRegistry)) {
      writer.add(question("q-1"));
      writer.add(question("q-2"));

      verify(store, never()).insertQuestions(anyList());

      writer.flush();

      verify(store).insertQuestions(anyList());
      assertThat(writer.getWrittenCount()).isEqualTo(2);
    }
  }

  @Test
  @DisplayName("should hand a full batch to the write thread")
  void shouldWriteFullBatchInBackground() {
    QuestionBankStore store = mock(QuestionBankStore.class);
    when(store.insertQuestions(anyList())).thenReturn(new BulkWriteReport(2, List.of()));

    try (BatchWriter writer = new BatchWriter(store, 2, listener, meterRegistry)) {
      writer.add(question("q-1"));
      writer.add(question("q-2"));

      verify(store, timeout(5_000)).insertQuestions(anyList());
    }
  }

  @Test
  @DisplayName("should write every question across several batches")
  void shouldWriteAllBatches() {
    InMemoryQuestionBankStore store = new InMemoryQuestionBankStore();

    try (BatchWriter writer = new BatchWriter(store, 4, listener, meterRegistry)) {
      for (int i = 0; i < 10; i++) {
        writer.add(question("q-" + i));
      }
      writer.flush();

      assertThat(writer.getWrittenCount()).isEqualTo(10);
    }
    assertThat(store.countQuestions()).isEqualTo(10);
    assertThat(store.bulkCalls()).isEqualTo(3);
    assertThat(outcomes).hasSize(3);
    assertThat(meterRegistry.counter("ingestion.questions.written").count()).isEqualTo(10.0);
  }

  @Test
  @DisplayName("should count already-stored questions as duplicates and refused ones as failures")
  void shouldSeparateDuplicatesFromFailures() {
    InMemoryQuestionBankStore store = new InMemoryQuestionBankStore();
    store.refuseQuestion("q-bad");

    BatchWriter writer = new BatchWriter(store, 10, listener, meterRegistry);
    writer.add(question("q-1"));
    writer.flush();
    writer.add(question("q-1"));
    writer.add(question("q-bad"));
    writer.add(question("q-2"));
    writer.close();

    assertThat(writer.getWrittenCount()).isEqualTo(2);
    assertThat(writer.getDuplicateCount()).isEqualTo(1);
    assertThat(outcomes).noneMatch(BatchOutcome::batchFailed);
    assertThat(writer.getFailures())
        .singleElement()
        .satisfies(
            failure -> {
              assertThat(failure.questionId()).isEqualTo("q-bad");
              assertThat(failure.sourceChunk()).isEqualTo("0-10");
              assertThat(failure.reason()).contains("validation");
            });
  }

  @Test
  @DisplayName("should record the whole batch as failed when the store throws")
  void shouldRecordBatchFailure_whenStoreThrows() {
    QuestionBankStore store = mock(QuestionBankStore.class);
    when(store.insertQuestions(anyList()))
        .thenThrow(new DataAccessResourceFailureException("connection refused"));

    BatchWriter writer = new BatchWriter(store, 10, listener, meterRegistry);
    writer.add(question("q-1"));
    writer.add(question("q-2"));
    writer.close();

    assertThat(writer.getWrittenCount()).isZero();
    assertThat(writer.getFailures())
        .extracting(WriteFailure::questionId)
        .containsExactly("q-1", "q-2");
    assertThat(outcomes)
        .singleElement()
        .satisfies(
            outcome -> {
              assertThat(outcome.failures()).hasSize(2);
              assertThat(outcome.batchFailed()).isTrue();
              assertThat(outcome.batchError()).contains("connection refused");
            });
  }

  @Test
  @DisplayName("should keep accepting questions while a full batch is written")
  void shouldFillSecondBuffer_whileFirstBatchIsWritten() throws Exception {
    CountDownLatch writeStarted = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    QuestionBankStore store = mock(QuestionBankStore.class);
    when(store.insertQuestions(anyList()))
        .thenAnswer(
            invocation -> {
              writeStarted.countDown();
              release.await(10, TimeUnit.SECONDS);
              return new BulkWriteReport(invocation.<List<?>>getArgument(0).size(), List.of());
            });

    BatchWriter writer = new BatchWriter(store, 2, listener, meterRegistry);
    try {
      writer.add(question("q-1"));
      writer.add(question("q-2"));
      assertThat(writeStarted.await(5, TimeUnit.SECONDS)).isTrue();

      // The first batch is still being written; the other buffer takes new questions.
      writer.add(question("q-3"));

      // Completing the second buffer needs the first write to finish.
      CompletableFuture<Void> fourth =
          CompletableFuture.runAsync(() -> writer.add(question("q-4")));
      assertThatThrownBy(() -> fourth.get(300, TimeUnit.MILLISECONDS))
          .isInstanceOf(TimeoutException.class);

      release.countDown();
      fourth.get(5, TimeUnit.SECONDS);
    } finally {
      release.countDown();
    }
    writer.close();

    assertThat(writer.getWrittenCount()).isEqualTo(4);
    verify(store, times(2)).insertQuestions(anyList());
  }

  private static FinalizedQuestion question(String id) {
    return new FinalizedQuestion(
        id,
        "0-10",
        0,
        "Question " + id,
        "subjective",
        List.of(),
        null,
        null,
        List.of(),
        List.of(),
        "hash-" + id);
  }
}
