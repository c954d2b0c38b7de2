package com.flamingo.ai.md2db.mongodb;

import com.flamingo.ai.md2db.domain.document.CanonicalEntity;
import com.flamingo.ai.md2db.domain.document.FormulaDocument;
import com.flamingo.ai.md2db.domain.document.ImageDocument;
import com.flamingo.ai.md2db.domain.document.OptionDocument;
import com.flamingo.ai.md2db.domain.document.QuestionDocument;
import com.flamingo.ai.md2db.domain.enums.EntityKind;
import com.flamingo.ai.md2db.exception.DuplicateContentException;
import com.mongodb.MongoBulkWriteException;
import com.mongodb.bulk.BulkWriteError;
import com.mongodb.bulk.BulkWriteResult;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.BulkOperationException;
import org.springframework.data.mongodb.core.BulkOperations.BulkMode;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

/**
 * MongoDB-backed {@link QuestionBankStore}.
 *
 * <p>Lookups and canonical inserts are retried on transient failures through the {@code mongo}
 * Resilience4j instance; unique-index violations surface as {@link DuplicateContentException} and
 * are never retried.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MongoQuestionBankStore implements QuestionBankStore {

  static final String HASH_FIELD = "hash";
  private static final int DUPLICATE_KEY = 11000;

  private final MongoTemplate mongoTemplate;
  private final MeterRegistry meterRegistry;

  @PostConstruct
  @Override
  public void initCollections() {
    try {
      for (EntityKind kind : EntityKind.values()) {
        IndexOperations indexOps = mongoTemplate.indexOps(entityClass(kind));
        if (indexOps == null) {
          log.warn("Mongo template not available, skipping index initialization");
          return;
        }
        indexOps.ensureIndex(new Index().on(HASH_FIELD, Sort.Direction.ASC).unique());
      }
      IndexOperations questionIndexes = mongoTemplate.indexOps(QuestionDocument.class);
      questionIndexes.ensureIndex(new Index().on("question_type", Sort.Direction.ASC));
      questionIndexes.ensureIndex(new Index().on("created_at", Sort.Direction.DESC));
      log.info("Question bank indexes verified");
    } catch (Exception e) {
      log.error("Failed to initialize question bank indexes: {}", e.getMessage(), e);
      throw new IllegalStateException("Failed to initialize question bank indexes", e);
    }
  }

  @Override
  @Retry(name = "mongo")
  public Optional<String> findEntityIdByHash(EntityKind kind, String hash) {
    Query query = Query.query(Criteria.where(HASH_FIELD).is(hash));
    query.fields().include("_id");
    CanonicalEntity found = mongoTemplate.findOne(query, entityClass(kind));
    return Optional.ofNullable(found).map(CanonicalEntity::getId);
  }

  @Override
  @Retry(name = "mongo")
  public String insertEntity(EntityKind kind, String payload, String hash, String altText) {
    try {
      return mongoTemplate.insert(newEntity(kind, payload, hash, altText)).getId();
    } catch (DuplicateKeyException e) {
      throw new DuplicateContentException(kind, hash, e);
    }
  }

  @Override
  @Timed(value = "mongo.questions.bulk_insert", description = "Time for one question bulk insert")
  @Retry(name = "mongo")
  public BulkWriteReport insertQuestions(List<QuestionDocument> questions) {
    if (questions.isEmpty()) {
      return new BulkWriteReport(0, List.of());
    }
    try {
      BulkWriteResult result =
          mongoTemplate
              .bulkOps(BulkMode.UNORDERED, QuestionDocument.class)
              .insert(questions)
              .execute();
      meterRegistry.counter("mongo.questions.inserted").increment(result.getInsertedCount());
      return new BulkWriteReport(result.getInsertedCount(), List.of());
    } catch (BulkOperationException e) {
      return toReport(e.getResult(), e.getErrors());
    } catch (DuplicateKeyException e) {
      // Some driver/template versions translate a bulk failure holding a duplicate key this way.
      if (e.getCause() instanceof MongoBulkWriteException bulk) {
        return toReport(bulk.getWriteResult(), bulk.getWriteErrors());
      }
      throw e;
    }
  }

  @Override
  public long countEntities(EntityKind kind) {
    return mongoTemplate.count(new Query(), entityClass(kind));
  }

  @Override
  public long countQuestions() {
    return mongoTemplate.count(new Query(), QuestionDocument.class);
  }

  private BulkWriteReport toReport(BulkWriteResult result, List<BulkWriteError> errors) {
    List<BulkWriteReport.Rejection> rejected = new ArrayList<>();
    for (BulkWriteError error : errors) {
      rejected.add(
          new BulkWriteReport.Rejection(
              error.getIndex(), error.getCode() == DUPLICATE_KEY, error.getMessage()));
    }
    int inserted = result != null && result.wasAcknowledged() ? result.getInsertedCount() : 0;
    meterRegistry.counter("mongo.questions.inserted").increment(inserted);
    log.debug("Bulk insert accepted {} and refused {} documents", inserted, rejected.size());
    return new BulkWriteReport(inserted, rejected);
  }

  private static Class<? extends CanonicalEntity> entityClass(EntityKind kind) {
    return switch (kind) {
      case OPTION -> OptionDocument.class;
      case IMAGE -> ImageDocument.class;
      case FORMULA -> FormulaDocument.class;
    };
  }

  private static CanonicalEntity newEntity(
      EntityKind kind, String payload, String hash, String altText) {
    return switch (kind) {
      case OPTION -> OptionDocument.builder().content(payload).hash(hash).build();
      case IMAGE -> ImageDocument.builder().url(payload).alt(altText).hash(hash).build();
      case FORMULA -> FormulaDocument.builder().formula(payload).hash(hash).build();
    };
  }
}
