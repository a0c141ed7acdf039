package com.scholary.scribe.document;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.scribe.document.Block.Cell;
import com.scholary.scribe.document.InlineRun.Bold;
import com.scholary.scribe.document.InlineRun.Hyperlink;
import com.scholary.scribe.document.InlineRun.PlainText;
import java.util.List;
import org.junit.jupiter.api.Test;

class DocumentRendererTest {

  private final OutlineParser parser = new OutlineParser();
  private final DocumentRenderer renderer = new DocumentRenderer();

  @Test
  void render_shouldPreserveStructureAndFormatting() throws Exception {
    Outline outline =
        parser.parse(
            "# Weekly sync\n"
                + "See **decisions** and [board](https://example.com/board)\n"
                + "| Owner | Task |\n"
                + "|---|---|\n"
                + "| Ann | *Budget* |\n"
                + "| Bob | **Hiring** |\n"
                + "- first\n"
                + "  - nested\n"
                + "1. step");

    Outline extracted = DocxOutlineExtractor.extract(renderer.render(outline));

    assertThat(extracted).isEqualTo(outline);
  }

  @Test
  void render_shouldProduceIdenticalContentForSameOutline() throws Exception {
    Outline outline = parser.parse("## Title\n- a\n- b\n| x | y |\n|---|---|\n| 1 | 2 |");

    String first = DocxOutlineExtractor.documentXml(renderer.render(outline));
    String second = DocxOutlineExtractor.documentXml(renderer.render(outline));

    assertThat(first).isEqualTo(second);
  }

  @Test
  void render_shouldNumberOrderedListsAndRestartAfterParagraph() throws Exception {
    byte[] docx = renderer.render(parser.parse("1. a\n2. b\n   1. inner\n3. c\nbreak\n1. again"));

    assertThat(DocxOutlineExtractor.markerOf(docx, 0)).isEqualTo("1.");
    assertThat(DocxOutlineExtractor.markerOf(docx, 1)).isEqualTo("2.");
    assertThat(DocxOutlineExtractor.markerOf(docx, 2)).isEqualTo("1.");
    assertThat(DocxOutlineExtractor.markerOf(docx, 3)).isEqualTo("3.");
    assertThat(DocxOutlineExtractor.markerOf(docx, 5)).isEqualTo("1.");
  }

  @Test
  void render_shouldHandleEmptyCells() throws Exception {
    Outline outline =
        new Outline(
            List.of(
                new Block.Table(
                    List.of(
                        List.of(new Cell(List.of(new PlainText("h1"))), new Cell(List.of())),
                        List.of(
                            new Cell(List.of(new Bold("v"))),
                            new Cell(List.of(new Hyperlink("x", "https://x.example"))))))));

    assertThat(DocxOutlineExtractor.extract(renderer.render(outline))).isEqualTo(outline);
  }

  @Test
  void render_shouldProduceValidDocumentForEmptyOutline() throws Exception {
    byte[] docx = renderer.render(new Outline(List.of()));

    assertThat(docx).isNotEmpty();
    assertThat(DocxOutlineExtractor.extract(docx).blocks()).isEmpty();
  }
}
