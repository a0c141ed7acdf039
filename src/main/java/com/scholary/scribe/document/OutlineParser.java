package com.scholary.scribe.document;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses markdown-like structured text into an {@link Outline}.
 *
 * <p>Block grammar, one construct per line:
 *
 * <ul>
 *   <li>1-6 {@code #} symbols followed by a space start a heading of that level
 *   <li>{@code -}, {@code *}, {@code +} or {@code 1.} markers start a list item; leading
 *       whitespace sets the depth ({@value #INDENT_WIDTH} columns per level, a tab counts as one
 *       level)
 *   <li>a pipe-delimited line followed by a separator row of dashes opens a table, which runs until
 *       the next blank line, heading or list item
 *   <li>horizontal rules are dropped, quote markers are stripped
 *   <li>any other non-blank line is a paragraph
 * </ul>
 *
 * <p>Tables are strict: every row must have as many cells as the header, otherwise the whole
 * document is rejected with {@link MalformedOutlineException}. Inline formatting is lenient, see
 * {@link InlineParser}.
 */
public class OutlineParser {

  static final int INDENT_WIDTH = 2;

  private static final Pattern HEADING = Pattern.compile("^(#{1,6}) (.*)$");
  private static final Pattern LIST_ITEM =
      Pattern.compile("^([ \\t]*)([-*+]|\\d+[.)])[ \\t]+(.*)$");
  private static final Pattern HORIZONTAL_RULE = Pattern.compile("^(-{3,}|\\*{3,}|_{3,})$");
  private static final Pattern SEPARATOR_CELL = Pattern.compile("^:?-+:?$");

  private final InlineParser inlineParser;

  public OutlineParser() {
    this(new InlineParser());
  }

  public OutlineParser(InlineParser inlineParser) {
    this.inlineParser = inlineParser;
  }

  /**
   * Parse structured text.
   *
   * @param text the raw text, lines separated by any line terminator
   * @return the outline
   * @throws MalformedOutlineException if a block construct is malformed
   */
  public Outline parse(String text) {
    List<Block> blocks = new ArrayList<>();
    if (text == null || text.isBlank()) {
      return new Outline(blocks);
    }

    String[] lines = text.split("\\R", -1);
    int index = 0;
    while (index < lines.length) {
      String line = lines[index];
      String stripped = line.strip();

      if (stripped.isEmpty()) {
        index++;
        continue;
      }
      if (startsTable(lines, index)) {
        index = parseTable(lines, index, blocks);
        continue;
      }
      if (HORIZONTAL_RULE.matcher(stripped).matches()) {
        index++;
        continue;
      }

      Matcher heading = HEADING.matcher(stripped);
      Matcher listItem = LIST_ITEM.matcher(line);
      if (heading.matches()) {
        blocks.add(
            new Block.Heading(
                heading.group(1).length(), inlineParser.parse(heading.group(2).strip())));
      } else if (listItem.matches()) {
        boolean ordered = Character.isDigit(listItem.group(2).charAt(0));
        blocks.add(
            new Block.ListItem(
                ordered, depthOf(listItem.group(1)), inlineParser.parse(listItem.group(3).strip())));
      } else if (stripped.startsWith(">")) {
        blocks.add(new Block.Paragraph(inlineParser.parse(stripped.substring(1).strip())));
      } else {
        blocks.add(new Block.Paragraph(inlineParser.parse(stripped)));
      }
      index++;
    }
    return new Outline(blocks);
  }

  private boolean startsTable(String[] lines, int index) {
    return lines[index].contains("|")
        && index + 1 < lines.length
        && isSeparatorRow(lines[index + 1]);
  }

  private boolean isSeparatorRow(String line) {
    if (!line.contains("|")) {
      return false;
    }
    for (String cell : splitCells(line)) {
      if (!SEPARATOR_CELL.matcher(cell).matches()) {
        return false;
      }
    }
    return true;
  }

  /** Parses the table starting at {@code start} and returns the index of the first line after it. */
  private int parseTable(String[] lines, int start, List<Block> blocks) {
    List<String> header = splitCells(lines[start]);
    int columns = header.size();

    List<String> separator = splitCells(lines[start + 1]);
    if (separator.size() != columns) {
      throw new MalformedOutlineException(
          String.format(
              "Table separator has %d cells, header has %d", separator.size(), columns),
          start + 2);
    }

    List<List<Block.Cell>> rows = new ArrayList<>();
    rows.add(toCells(header));

    int index = start + 2;
    while (index < lines.length && continuesTable(lines[index])) {
      List<String> cells = splitCells(lines[index]);
      if (cells.size() != columns) {
        throw new MalformedOutlineException(
            String.format("Table row has %d cells, header has %d", cells.size(), columns),
            index + 1);
      }
      rows.add(toCells(cells));
      index++;
    }

    blocks.add(new Block.Table(rows));
    return index;
  }

  private boolean continuesTable(String line) {
    String stripped = line.strip();
    return !stripped.isEmpty()
        && !HEADING.matcher(stripped).matches()
        && !LIST_ITEM.matcher(line).matches();
  }

  private List<Block.Cell> toCells(List<String> texts) {
    List<Block.Cell> cells = new ArrayList<>(texts.size());
    for (String text : texts) {
      cells.add(new Block.Cell(inlineParser.parse(text)));
    }
    return cells;
  }

  static List<String> splitCells(String line) {
    String body = line.strip();
    if (body.startsWith("|")) {
      body = body.substring(1);
    }
    if (body.endsWith("|")) {
      body = body.substring(0, body.length() - 1);
    }
    List<String> cells = new ArrayList<>();
    for (String cell : body.split("\\|", -1)) {
      cells.add(cell.strip());
    }
    return cells;
  }

  static int depthOf(String indent) {
    int width = 0;
    for (char c : indent.toCharArray()) {
      width += c == '\t' ? INDENT_WIDTH : 1;
    }
    return Math.min(width / INDENT_WIDTH, Block.MAX_LIST_DEPTH);
  }
}
