package com.scholary.scribe.document;

import java.util.List;
import java.util.Optional;

/**
 * Parsed structure of a document prior to rendering: an ordered sequence of blocks.
 *
 * <p>Outlines are transient. They are built from structured text by {@link OutlineParser} and
 * consumed immediately by {@link DocumentRenderer}.
 */
public record Outline(List<Block> blocks) {

  public Outline {
    blocks = List.copyOf(blocks);
  }

  public boolean isEmpty() {
    return blocks.isEmpty();
  }

  /** Text of the first heading, used to title the rendered document. */
  public Optional<String> firstHeadingText() {
    return blocks.stream()
        .filter(Block.Heading.class::isInstance)
        .map(Block.Heading.class::cast)
        .findFirst()
        .map(heading -> plainText(heading.runs()));
  }

  static String plainText(List<InlineRun> runs) {
    StringBuilder text = new StringBuilder();
    for (InlineRun run : runs) {
      text.append(run.text());
    }
    return text.toString().strip();
  }
}
