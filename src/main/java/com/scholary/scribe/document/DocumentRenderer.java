package com.scholary.scribe.document;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.List;
import org.apache.poi.xwpf.usermodel.UnderlinePatterns;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFHyperlinkRun;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFStyle;
import org.apache.poi.xwpf.usermodel.XWPFStyles;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTString;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTStyle;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STStyleType;

/**
 * Renders an {@link Outline} into a Word (.docx) document.
 *
 * <p>This is a pure transformation: no I/O beyond the in-memory buffer and no shared state, so a
 * single instance can be used from any number of threads.
 *
 * <p>Mapping:
 *
 * <ul>
 *   <li>Heading level n uses paragraph style {@code Heading<n>}
 *   <li>List items use {@code ListBullet}/{@code ListNumber}, indented {@value #LIST_INDENT_TWIPS}
 *       twips per level, with a leading marker run
 *   <li>Tables render as a bordered grid; the header row is shaded and repeats across pages
 *   <li>Hyperlinks are external relationships shown as blue underlined text
 * </ul>
 */
public class DocumentRenderer {

  public static final String HEADING_STYLE_PREFIX = "Heading";
  public static final String LIST_BULLET_STYLE = "ListBullet";
  public static final String LIST_NUMBER_STYLE = "ListNumber";
  public static final int LIST_INDENT_TWIPS = 360;
  public static final String HEADER_ROW_SHADE = "D9E2F3";
  public static final String HYPERLINK_COLOR = "0563C1";

  private static final int[] HEADING_FONT_SIZES = {0, 20, 16, 14, 13, 12, 11};
  private static final String[] BULLETS = {"•", "◦", "▪"};

  /**
   * Render an outline.
   *
   * @param outline the outline to render
   * @return the .docx bytes
   */
  public byte[] render(Outline outline) {
    try (XWPFDocument document = new XWPFDocument();
        ByteArrayOutputStream out = new ByteArrayOutputStream()) {
      defineStyles(document);

      ListCounters counters = new ListCounters();
      for (Block block : outline.blocks()) {
        if (block instanceof Block.ListItem item) {
          renderListItem(document, item, counters);
          continue;
        }
        counters.reset();
        if (block instanceof Block.Heading heading) {
          renderHeading(document, heading);
        } else if (block instanceof Block.Table table) {
          renderTable(document, table);
        } else if (block instanceof Block.Paragraph paragraph) {
          renderRuns(document.createParagraph(), paragraph.runs());
        }
      }

      document.write(out);
      return out.toByteArray();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to render document", e);
    }
  }

  private void renderHeading(XWPFDocument document, Block.Heading heading) {
    XWPFParagraph paragraph = document.createParagraph();
    paragraph.setStyle(HEADING_STYLE_PREFIX + heading.level());
    for (XWPFRun run : renderRuns(paragraph, heading.runs())) {
      run.setFontSize(HEADING_FONT_SIZES[heading.level()]);
    }
  }

  private void renderListItem(XWPFDocument document, Block.ListItem item, ListCounters counters) {
    XWPFParagraph paragraph = document.createParagraph();
    paragraph.setStyle(item.ordered() ? LIST_NUMBER_STYLE : LIST_BULLET_STYLE);
    paragraph.setIndentationLeft(LIST_INDENT_TWIPS * (item.depth() + 1));
    paragraph.setIndentationHanging(LIST_INDENT_TWIPS);

    String marker =
        item.ordered()
            ? counters.next(item.depth()) + "."
            : BULLETS[item.depth() % BULLETS.length];
    if (!item.ordered()) {
      counters.clear(item.depth());
    }
    paragraph.createRun().setText(marker + "\t");

    renderRuns(paragraph, item.runs());
  }

  private void renderTable(XWPFDocument document, Block.Table table) {
    List<List<Block.Cell>> rows = table.rows();
    XWPFTable grid = document.createTable(rows.size(), table.columnCount());

    for (int r = 0; r < rows.size(); r++) {
      XWPFTableRow row = grid.getRow(r);
      if (r == 0) {
        row.setRepeatHeader(true);
      }
      List<Block.Cell> cells = rows.get(r);
      for (int c = 0; c < cells.size(); c++) {
        XWPFTableCell cell = row.getCell(c);
        if (r == 0) {
          cell.setColor(HEADER_ROW_SHADE);
        }
        renderRuns(cell.getParagraphs().get(0), cells.get(c).runs());
      }
    }
  }

  private List<XWPFRun> renderRuns(XWPFParagraph paragraph, List<InlineRun> runs) {
    XWPFRun[] rendered = new XWPFRun[runs.size()];
    for (int i = 0; i < runs.size(); i++) {
      InlineRun run = runs.get(i);
      if (run instanceof InlineRun.Hyperlink link) {
        XWPFHyperlinkRun hyperlinkRun = paragraph.createHyperlinkRun(link.target());
        hyperlinkRun.setText(link.displayText());
        hyperlinkRun.setColor(HYPERLINK_COLOR);
        hyperlinkRun.setUnderline(UnderlinePatterns.SINGLE);
        rendered[i] = hyperlinkRun;
      } else {
        XWPFRun textRun = paragraph.createRun();
        textRun.setText(run.text());
        if (run instanceof InlineRun.Bold) {
          textRun.setBold(true);
        } else if (run instanceof InlineRun.Italic) {
          textRun.setItalic(true);
        }
        rendered[i] = textRun;
      }
    }
    return Arrays.asList(rendered);
  }

  private void defineStyles(XWPFDocument document) {
    XWPFStyles styles = document.createStyles();
    for (int level = Block.MIN_HEADING_LEVEL; level <= Block.MAX_HEADING_LEVEL; level++) {
      addParagraphStyle(styles, HEADING_STYLE_PREFIX + level, "heading " + level);
    }
    addParagraphStyle(styles, LIST_BULLET_STYLE, "List Bullet");
    addParagraphStyle(styles, LIST_NUMBER_STYLE, "List Number");
  }

  private void addParagraphStyle(XWPFStyles styles, String styleId, String name) {
    CTStyle ctStyle = CTStyle.Factory.newInstance();
    ctStyle.setStyleId(styleId);
    CTString styleName = CTString.Factory.newInstance();
    styleName.setVal(name);
    ctStyle.setName(styleName);

    XWPFStyle style = new XWPFStyle(ctStyle);
    style.setType(STStyleType.PARAGRAPH);
    styles.addStyle(style);
  }

  /** Numbering state for ordered lists; restarts whenever a non-list block intervenes. */
  private static final class ListCounters {

    private final int[] counters = new int[Block.MAX_LIST_DEPTH + 1];

    int next(int depth) {
      Arrays.fill(counters, depth + 1, counters.length, 0);
      return ++counters[depth];
    }

    void clear(int depth) {
      Arrays.fill(counters, depth, counters.length, 0);
    }

    void reset() {
      Arrays.fill(counters, 0);
    }
  }
}
