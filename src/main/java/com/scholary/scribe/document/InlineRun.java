package com.scholary.scribe.document;

import java.util.Objects;

/**
 * A run of inline text inside a block.
 *
 * <p>Runs carry no nesting: formatting applies to the whole run, and a hyperlink carries its
 * display text verbatim.
 */
public interface InlineRun {

  /** The visible text of this run. */
  String text();

  /** Unformatted text. */
  record PlainText(String text) implements InlineRun {
    public PlainText {
      Objects.requireNonNull(text, "text");
    }
  }

  /** Bold text. */
  record Bold(String text) implements InlineRun {
    public Bold {
      Objects.requireNonNull(text, "text");
    }
  }

  /** Italic text. */
  record Italic(String text) implements InlineRun {
    public Italic {
      Objects.requireNonNull(text, "text");
    }
  }

  /** Clickable text pointing at an external target. */
  record Hyperlink(String displayText, String target) implements InlineRun {
    public Hyperlink {
      Objects.requireNonNull(displayText, "displayText");
      Objects.requireNonNull(target, "target");
    }

    @Override
    public String text() {
      return displayText;
    }
  }
}
