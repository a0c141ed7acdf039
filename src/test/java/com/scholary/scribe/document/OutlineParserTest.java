package com.scholary.scribe.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.scribe.document.Block.Heading;
import com.scholary.scribe.document.Block.ListItem;
import com.scholary.scribe.document.Block.Paragraph;
import com.scholary.scribe.document.Block.Table;
import com.scholary.scribe.document.InlineRun.Bold;
import com.scholary.scribe.document.InlineRun.PlainText;
import java.util.List;
import org.junit.jupiter.api.Test;

class OutlineParserTest {

  private final OutlineParser parser = new OutlineParser();

  @Test
  void parse_shouldRecognizeHeadingsOfEveryLevel() {
    Outline outline = parser.parse("# One\n## Two\n###### Six\n####### Seven");

    assertThat(outline.blocks())
        .containsExactly(
            new Heading(1, List.of(new PlainText("One"))),
            new Heading(2, List.of(new PlainText("Two"))),
            new Heading(6, List.of(new PlainText("Six"))),
            new Paragraph(List.of(new PlainText("####### Seven"))));
  }

  @Test
  void parse_shouldComputeListDepthFromIndentation() {
    Outline outline = parser.parse("- top\n  - nested\n\t\t- tabbed\n1. first\n2) second");

    assertThat(outline.blocks())
        .containsExactly(
            new ListItem(false, 0, List.of(new PlainText("top"))),
            new ListItem(false, 1, List.of(new PlainText("nested"))),
            new ListItem(false, 2, List.of(new PlainText("tabbed"))),
            new ListItem(true, 0, List.of(new PlainText("first"))),
            new ListItem(true, 0, List.of(new PlainText("second"))));
  }

  @Test
  void parse_shouldClampDeepLists() {
    String indent = " ".repeat(40);
    Outline outline = parser.parse(indent + "- deep");

    assertThat(((ListItem) outline.blocks().get(0)).depth()).isEqualTo(Block.MAX_LIST_DEPTH);
  }

  @Test
  void parse_shouldBuildTableWithHeaderRow() {
    Outline outline =
        parser.parse("| Name | Role |\n|:---|---:|\n| Ann | **Lead** |\n| Bob | Dev |\n\nAfter");

    assertThat(outline.blocks()).hasSize(2);
    Table table = (Table) outline.blocks().get(0);
    assertThat(table.rows()).hasSize(3);
    assertThat(table.columnCount()).isEqualTo(2);
    assertThat(table.rows().get(0).get(0).runs()).containsExactly(new PlainText("Name"));
    assertThat(table.rows().get(1).get(1).runs()).containsExactly(new Bold("Lead"));
    assertThat(outline.blocks().get(1))
        .isEqualTo(new Paragraph(List.of(new PlainText("After"))));
  }

  @Test
  void parse_shouldRejectRaggedTable() {
    assertThatThrownBy(() -> parser.parse("a|b\n--|--\nc"))
        .isInstanceOf(MalformedOutlineException.class)
        .satisfies(e -> assertThat(((MalformedOutlineException) e).getLineNumber()).isEqualTo(3));
  }

  @Test
  void parse_shouldRejectSeparatorWithWrongCellCount() {
    assertThatThrownBy(() -> parser.parse("Intro\n| a | b |\n|---|---|---|\n| 1 | 2 |"))
        .isInstanceOf(MalformedOutlineException.class)
        .hasMessageContaining("Line 3");
  }

  @Test
  void parse_shouldEndTableAtHeading() {
    Outline outline = parser.parse("| a | b |\n|---|---|\n| 1 | 2 |\n# Next");

    assertThat(outline.blocks()).hasSize(2);
    assertThat(outline.blocks().get(1)).isInstanceOf(Heading.class);
  }

  @Test
  void parse_shouldDropRulesAndUnquote() {
    Outline outline = parser.parse("---\n> quoted text\n***");

    assertThat(outline.blocks())
        .containsExactly(new Paragraph(List.of(new PlainText("quoted text"))));
  }

  @Test
  void parse_shouldTreatPipeWithoutSeparatorAsParagraph() {
    Outline outline = parser.parse("either a | b\nnothing else");

    assertThat(outline.blocks()).hasSize(2).allMatch(Paragraph.class::isInstance);
  }

  @Test
  void parse_shouldReturnEmptyOutlineForBlankText() {
    assertThat(parser.parse("  \n\n").isEmpty()).isTrue();
  }

  @Test
  void firstHeadingText_shouldJoinRuns() {
    Outline outline = parser.parse("Intro\n## Weekly **sync** notes\n# Later");

    assertThat(outline.firstHeadingText()).contains("Weekly sync notes");
  }
}
