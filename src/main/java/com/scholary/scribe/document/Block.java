package com.scholary.scribe.document;

import java.util.List;
import java.util.Objects;

/**
 * A block-level node of an {@link Outline}.
 *
 * <p>The constructors enforce the structural invariants, so an outline that exists is always
 * renderable: heading levels stay within 1-6, list depth is capped at {@link #MAX_LIST_DEPTH} and
 * tables are rectangular.
 */
public interface Block {

  int MIN_HEADING_LEVEL = 1;
  int MAX_HEADING_LEVEL = 6;
  int MAX_LIST_DEPTH = 8;

  /** Heading of rank {@code level}. */
  record Heading(int level, List<InlineRun> runs) implements Block {
    public Heading {
      if (level < MIN_HEADING_LEVEL || level > MAX_HEADING_LEVEL) {
        throw new IllegalArgumentException("Heading level out of range: " + level);
      }
      runs = List.copyOf(runs);
    }
  }

  /** Plain paragraph. */
  record Paragraph(List<InlineRun> runs) implements Block {
    public Paragraph {
      runs = List.copyOf(runs);
    }
  }

  /** Bulleted or numbered list entry; depth 0 is the outermost level. */
  record ListItem(boolean ordered, int depth, List<InlineRun> runs) implements Block {
    public ListItem {
      if (depth < 0 || depth > MAX_LIST_DEPTH) {
        throw new IllegalArgumentException("List depth out of range: " + depth);
      }
      runs = List.copyOf(runs);
    }
  }

  /** Grid of cells; row 0 is the header row. */
  record Table(List<List<Cell>> rows) implements Block {
    public Table {
      Objects.requireNonNull(rows, "rows");
      if (rows.isEmpty()) {
        throw new IllegalArgumentException("Table must have at least a header row");
      }
      int columns = rows.get(0).size();
      for (int i = 0; i < rows.size(); i++) {
        if (rows.get(i).size() != columns) {
          throw new IllegalArgumentException(
              String.format(
                  "Table row %d has %d cells, expected %d", i, rows.get(i).size(), columns));
        }
      }
      rows = rows.stream().map(List::copyOf).toList();
    }

    public int columnCount() {
      return rows.get(0).size();
    }
  }

  /** One table cell. */
  record Cell(List<InlineRun> runs) {
    public Cell {
      runs = List.copyOf(runs);
    }
  }
}
