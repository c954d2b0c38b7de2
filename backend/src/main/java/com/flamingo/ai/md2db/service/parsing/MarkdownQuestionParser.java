package com.flamingo.ai.md2db.service.parsing;

import com.flamingo.ai.md2db.domain.enums.QuestionType;
import com.flamingo.ai.md2db.exception.QuestionParseException;
import com.flamingo.ai.md2db.service.chunking.QuestionSeparators;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.Image;
import org.commonmark.node.Node;
import org.commonmark.node.Text;
import org.commonmark.parser.Parser;
import org.springframework.stereotype.Service;

/**
 * Heuristic {@link QuestionParser} for Markdown question banks.
 *
 * <p>Text is split into question blocks by the first strategy that applies:
 *
 * <ol>
 *   <li>numbered lines ({@code 1. ...}), horizontal rules closing a block early;
 *   <li>horizontal rules ({@code ---}, {@code ***}, {@code ___});
 *   <li>runs of two or more blank lines;
 *   <li>otherwise the whole text is one question.
 * </ol>
 *
 * <p>Each block is classified, and its options, answer, explanation, images and LaTeX formulas are
 * pulled out. Image URLs and alt text come from the commonmark AST so that images inside code
 * spans are not picked up.
 */
@Service
@Slf4j
public class MarkdownQuestionParser implements QuestionParser {

  private static final Parser MARKDOWN = Parser.builder().build();

  private static final Pattern LEADING_NUMBER = Pattern.compile("^\\s*\\d+\\.\\s*");
  private static final Pattern OPTION_LINE = Pattern.compile("^([A-Z])\\.\\s*(.+)$");
  private static final Pattern OPTION_MARKER = Pattern.compile("^[A-Z]\\.\\s");
  private static final Pattern LOWER_OPTION_MARKER = Pattern.compile("^[a-f]\\.[ \\t]");
  private static final Pattern ANSWER_LINE =
      Pattern.compile("^(?:answer|答案)\\s*[:：]\\s*(.*)$", Pattern.CASE_INSENSITIVE);
  private static final Pattern EXPLANATION_LINE =
      Pattern.compile("^(?:explanation|解析)\\s*[:：]\\s*(.*)$", Pattern.CASE_INSENSITIVE);
  private static final Pattern IMAGE_TAG = Pattern.compile("!\\[[^\\]]*\\]\\([^)]*\\)");
  private static final Pattern TRUE_FALSE =
      Pattern.compile("\\b(?:true|false)\\b|正确|错误", Pattern.CASE_INSENSITIVE);
  private static final Pattern BLANK_RUN = Pattern.compile("\\n[ \\t]*\\n(?:[ \\t]*\\n)+");

  private static final Pattern DISPLAY_DOLLARS =
      Pattern.compile("\\$\\$(.+?)\\$\\$", Pattern.DOTALL);
  private static final Pattern DISPLAY_BRACKETS =
      Pattern.compile("\\\\\\[(.+?)\\\\\\]", Pattern.DOTALL);
  private static final Pattern INLINE_PARENS = Pattern.compile("\\\\\\((.+?)\\\\\\)");
  private static final Pattern INLINE_DOLLAR = Pattern.compile("\\$([^$\\n]+?)\\$");

  @Override
  public List<RawQuestion> parse(String text) {
    if (text.indexOf('\u0000') >= 0) {
      throw new QuestionParseException("Chunk contains NUL characters; input is not text");
    }
    String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
    if (normalized.isBlank()) {
      return List.of();
    }

    List<RawQuestion> questions = new ArrayList<>();
    for (String block : splitQuestions(normalized)) {
      questions.add(parseBlock(block));
    }
    log.debug("Parsed {} questions from {} characters", questions.size(), text.length());
    return questions;
  }

  // ---- splitting ----

  List<String> splitQuestions(String text) {
    String[] lines = text.split("\n", -1);

    boolean numbered = false;
    boolean ruled = false;
    for (String line : lines) {
      numbered |= QuestionSeparators.NUMBERED.matcher(line).find();
      ruled |= QuestionSeparators.HORIZONTAL_RULE.matcher(line).matches();
    }

    List<String> blocks;
    if (numbered) {
      blocks = splitOnNumberedLines(lines);
    } else if (ruled) {
      blocks = splitOnRules(lines);
    } else {
      blocks = List.of(BLANK_RUN.split(text));
    }
    return blocks.stream().map(String::strip).filter(b -> !b.isEmpty()).toList();
  }

  private List<String> splitOnNumberedLines(String[] lines) {
    List<String> blocks = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    boolean inPreamble = true;
    for (String line : lines) {
      if (QuestionSeparators.NUMBERED.matcher(line).find()) {
        flushBlock(blocks, current, inPreamble);
        inPreamble = false;
        current.append(line).append('\n');
      } else if (QuestionSeparators.HORIZONTAL_RULE.matcher(line).matches()) {
        flushBlock(blocks, current, inPreamble);
      } else {
        current.append(line).append('\n');
      }
    }
    flushBlock(blocks, current, inPreamble);
    return blocks;
  }

  /** Preamble before the first numbered line keeps only non-heading text. */
  private void flushBlock(List<String> blocks, StringBuilder current, boolean inPreamble) {
    String block = current.toString();
    current.setLength(0);
    if (inPreamble) {
      StringBuilder kept = new StringBuilder();
      for (String line : block.split("\n")) {
        if (!line.strip().startsWith("#")) {
          kept.append(line).append('\n');
        }
      }
      block = kept.toString();
    }
    if (!block.isBlank()) {
      blocks.add(block);
    }
  }

  private List<String> splitOnRules(String[] lines) {
    List<String> blocks = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    for (String line : lines) {
      if (QuestionSeparators.HORIZONTAL_RULE.matcher(line).matches()) {
        blocks.add(current.toString());
        current.setLength(0);
      } else {
        current.append(line).append('\n');
      }
    }
    blocks.add(current.toString());
    return blocks;
  }

  // ---- per-question extraction ----

  private RawQuestion parseBlock(String block) {
    QuestionType type = detectQuestionType(block);
    List<String> options =
        type == QuestionType.MULTIPLE_CHOICE ? parseOptions(block) : List.<String>of();

    String answer = null;
    StringBuilder explanation = null;
    boolean inExplanation = false;
    boolean optionsStarted = false;
    List<String> contentLines = new ArrayList<>();

    Map<String, String> images = extractImages(block);
    String withoutImages = IMAGE_TAG.matcher(block).replaceAll("");
    String[] lines = LEADING_NUMBER.matcher(withoutImages).replaceFirst("").split("\n");
    for (String raw : lines) {
      String line = raw.strip();
      if (line.isEmpty()) {
        continue;
      }
      Matcher answerMatcher = ANSWER_LINE.matcher(line);
      Matcher explanationMatcher = EXPLANATION_LINE.matcher(line);
      if (answerMatcher.matches()) {
        answer = answerMatcher.group(1).strip();
        inExplanation = false;
      } else if (explanationMatcher.matches()) {
        explanation = new StringBuilder(explanationMatcher.group(1).strip());
        inExplanation = true;
      } else if (inExplanation) {
        explanation.append(' ').append(line);
      } else if (OPTION_MARKER.matcher(line).find()) {
        optionsStarted = true;
      } else if (!optionsStarted) {
        contentLines.add(line);
      }
    }

    return new RawQuestion(
        String.join(" ", contentLines).strip(),
        type.getTag(),
        options,
        blankToNull(answer),
        explanation == null ? null : blankToNull(explanation.toString().strip()),
        List.copyOf(images.keySet()),
        extractFormulas(block),
        withAltText(images));
  }

  QuestionType detectQuestionType(String block) {
    int optionLines = 0;
    for (String line : block.toLowerCase(Locale.ROOT).split("\n")) {
      if (LOWER_OPTION_MARKER.matcher(line.strip()).find()) {
        optionLines++;
      }
    }
    if (optionLines >= 2) {
      return QuestionType.MULTIPLE_CHOICE;
    }
    if (TRUE_FALSE.matcher(block).find()) {
      return QuestionType.TRUE_FALSE;
    }
    if (block.contains("____")) {
      return QuestionType.FILL_IN_BLANK;
    }
    return QuestionType.SUBJECTIVE;
  }

  private List<String> parseOptions(String block) {
    List<String> options = new ArrayList<>();
    for (String line : block.split("\n")) {
      String stripped = line.strip();
      if (ANSWER_LINE.matcher(stripped).matches()) {
        continue;
      }
      Matcher matcher = OPTION_LINE.matcher(stripped);
      if (matcher.matches()) {
        options.add(matcher.group(2).strip());
      }
    }
    return options;
  }

  /** Image URLs in document order, each with the alt text of its first occurrence. */
  private Map<String, String> extractImages(String block) {
    Map<String, String> images = new LinkedHashMap<>();
    Node document = MARKDOWN.parse(block);
    document.accept(
        new AbstractVisitor() {
          @Override
          public void visit(Image image) {
            String destination = image.getDestination();
            if (destination != null && !destination.isBlank()) {
              images.putIfAbsent(destination.strip(), altText(image));
            }
          }
        });
    return images;
  }

  private static String altText(Image image) {
    StringBuilder alt = new StringBuilder();
    image.accept(
        new AbstractVisitor() {
          @Override
          public void visit(Text text) {
            alt.append(text.getLiteral());
          }
        });
    return alt.toString().strip();
  }

  private static Map<String, String> withAltText(Map<String, String> images) {
    Map<String, String> alts = new LinkedHashMap<>();
    images.forEach(
        (url, alt) -> {
          if (!alt.isEmpty()) {
            alts.put(url, alt);
          }
        });
    return alts;
  }

  private List<String> extractFormulas(String block) {
    Set<String> formulas = new LinkedHashSet<>();
    String remaining = block;
    for (Pattern display : List.of(DISPLAY_DOLLARS, DISPLAY_BRACKETS, INLINE_PARENS)) {
      Matcher matcher = display.matcher(remaining);
      while (matcher.find()) {
        addFormula(formulas, matcher.group(1));
      }
      remaining = matcher.replaceAll(" ");
    }
    Matcher inline = INLINE_DOLLAR.matcher(remaining);
    while (inline.find()) {
      addFormula(formulas, inline.group(1));
    }
    return List.copyOf(formulas);
  }

  private static void addFormula(Set<String> formulas, String formula) {
    String stripped = formula.strip();
    if (!stripped.isEmpty()) {
      formulas.add(stripped);
    }
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
