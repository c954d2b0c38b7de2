package com.flamingo.ai.md2db.service.chunking;

import java.util.regex.Pattern;

/** Line patterns that mark where a new question may begin. */
public final class QuestionSeparators {

  /** Numbered-list start: {@code "12. "}. */
  public static final Pattern NUMBERED = Pattern.compile("^\\d+\\.\\s+");

  /** Horizontal rule: {@code ---}, {@code ***} or {@code ___}. */
  public static final Pattern HORIZONTAL_RULE = Pattern.compile("^\\s*(-{3,}|\\*{3,}|_{3,})\\s*$");

  /** Consecutive blank lines that count as a separator. */
  public static final int BLANK_RUN_LENGTH = 2;

  private QuestionSeparators() {}

  /**
   * Whether a single line (without its terminator) opens a new question on its own.
   *
   * @param line the line text
   * @return true for numbered starts and horizontal rules
   */
  public static boolean isSeparatorLine(String line) {
    return NUMBERED.matcher(line).find() || HORIZONTAL_RULE.matcher(line).matches();
  }

  public static boolean isBlank(String line) {
    return line.isBlank();
  }
}
