package com.flamingo.ai.md2db.service.parsing;

import java.util.List;
import java.util.Map;

/**
 * A question as produced by a {@link QuestionParser}, before its sub-entities are deduplicated.
 *
 * @param content question text without numbering, options or image tags
 * @param questionType classification tag, e.g. {@code multiple_choice}
 * @param options option texts in presentation order
 * @param answer answer text, or {@code null}
 * @param explanation explanation text, or {@code null}
 * @param imageUrls image URLs referenced by the question
 * @param formulas LaTeX formula sources with delimiters removed
 * @param imageAlts alt text by image URL, for images that have any
 */
public record RawQuestion(
    String content,
    String questionType,
    List<String> options,
    String answer,
    String explanation,
    List<String> imageUrls,
    List<String> formulas,
    Map<String, String> imageAlts) {

  public RawQuestion {
    options = options == null ? List.of() : List.copyOf(options);
    imageUrls = imageUrls == null ? List.of() : List.copyOf(imageUrls);
    formulas = formulas == null ? List.of() : List.copyOf(formulas);
    imageAlts = imageAlts == null ? Map.of() : Map.copyOf(imageAlts);
  }
}
