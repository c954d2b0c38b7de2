package com.flamingo.ai.md2db.service.writer;

import com.flamingo.ai.md2db.domain.document.QuestionDocument;
import java.time.Instant;
import java.util.List;

/**
 * A parsed question whose options, images and formulas have been replaced by canonical entity ids.
 *
 * @param id stable identifier, {@code <sourceKey>:<chunkStart>:<position>}
 * @param sourceChunk id of the chunk the question came from
 * @param position index of the question within its chunk
 * @param content question text
 * @param questionType classification tag
 * @param optionIds canonical option ids in presentation order
 * @param answer answer text, or {@code null}
 * @param explanation explanation text, or {@code null}
 * @param imageIds canonical image ids
 * @param formulaIds canonical formula ids
 * @param contentHash digest of {@code content}, logged with write failures for replay
 */
public record FinalizedQuestion(
    String id,
    String sourceChunk,
    int position,
    String content,
    String questionType,
    List<String> optionIds,
    String answer,
    String explanation,
    List<String> imageIds,
    List<String> formulaIds,
    String contentHash) {

  public FinalizedQuestion {
    optionIds = List.copyOf(optionIds);
    imageIds = List.copyOf(imageIds);
    formulaIds = List.copyOf(formulaIds);
  }

  public QuestionDocument toDocument(Instant createdAt) {
    return QuestionDocument.builder()
        .id(id)
        .content(content)
        .questionType(questionType)
        .options(optionIds)
        .answer(answer)
        .explanation(explanation)
        .images(imageIds)
        .formulas(formulaIds)
        .sourceChunk(sourceChunk)
        .position(position)
        .contentHash(contentHash)
        .createdAt(createdAt)
        .build();
  }
}
