package com.flamingo.ai.md2db.domain.enums;

/** Question classification tag as stored in {@code questions.question_type}. */
public enum QuestionType {
  MULTIPLE_CHOICE("multiple_choice"),
  TRUE_FALSE("true_false"),
  FILL_IN_BLANK("fill_in_blank"),
  SUBJECTIVE("subjective");

  private final String tag;

  QuestionType(String tag) {
    this.tag = tag;
  }

  public String getTag() {
    return tag;
  }
}
