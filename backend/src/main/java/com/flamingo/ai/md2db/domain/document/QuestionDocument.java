package com.flamingo.ai.md2db.domain.document;

import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

/**
 * A finalized question as stored in the {@code questions} collection.
 *
 * <p>The identifier is derived from the source chunk and the question's position inside it, so a
 * re-submitted question collides on {@code _id} instead of producing a second row.
 */
@Document(collection = "questions")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class QuestionDocument {

  @Id private String id;

  private String content;

  @Field("question_type")
  private String questionType;

  /** Option ids in presentation order; the label is implied by position (A, B, ...). */
  private List<String> options;

  private String answer;

  private String explanation;

  private List<String> images;

  private List<String> formulas;

  @Field("source_chunk")
  private String sourceChunk;

  private int position;

  @Field("content_hash")
  private String contentHash;

  @Field("created_at")
  private Instant createdAt;
}
