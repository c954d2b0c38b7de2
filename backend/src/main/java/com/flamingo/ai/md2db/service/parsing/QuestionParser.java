package com.flamingo.ai.md2db.service.parsing;

import com.flamingo.ai.md2db.exception.QuestionParseException;
import java.util.List;

/**
 * Turns the text of one chunk into questions.
 *
 * <p>Implementations must be pure: no I/O and no shared mutable state, since parsing runs
 * concurrently on every worker thread.
 */
public interface QuestionParser {

  /**
   * Parses chunk text.
   *
   * @param text the chunk text
   * @return questions in source order; empty when the text holds none
   * @throws QuestionParseException if the text is unrecoverably malformed
   */
  List<RawQuestion> parse(String text);
}
