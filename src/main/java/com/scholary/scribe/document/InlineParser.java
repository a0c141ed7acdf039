package com.scholary.scribe.document;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a line of text into inline runs.
 *
 * <p>Recognised markers, scanned left to right without overlap:
 *
 * <ul>
 *   <li>{@code **text**} becomes {@link InlineRun.Bold}
 *   <li>{@code *text*} becomes {@link InlineRun.Italic}
 *   <li>{@code [text](url)} becomes {@link InlineRun.Hyperlink}
 *   <li>a bare {@code http(s)://} URL becomes a hyperlink showing the URL itself
 * </ul>
 *
 * <p>Anything that does not form a complete marker is kept as plain text. Adjacent plain text is
 * merged into a single run.
 */
public class InlineParser {

  private static final Pattern INLINE =
      Pattern.compile(
          "\\*\\*(?<bold>.+?)\\*\\*"
              + "|\\*(?<italic>[^*]+?)\\*"
              + "|\\[(?<label>[^\\]]+)\\]\\((?<target>[^)\\s]+)\\)"
              + "|(?<![(\\w])(?<url>https?://[^\\s<>\"()]+[^\\s<>\"().,;:!?])");

  public List<InlineRun> parse(String text) {
    List<InlineRun> runs = new ArrayList<>();
    if (text == null || text.isEmpty()) {
      return runs;
    }

    StringBuilder plain = new StringBuilder();
    Matcher matcher = INLINE.matcher(text);
    int position = 0;
    while (matcher.find()) {
      plain.append(text, position, matcher.start());
      InlineRun run = toRun(matcher);
      flushPlain(plain, runs);
      runs.add(run);
      position = matcher.end();
    }
    plain.append(text.substring(position));
    flushPlain(plain, runs);
    return runs;
  }

  private InlineRun toRun(Matcher matcher) {
    if (matcher.group("bold") != null) {
      return new InlineRun.Bold(matcher.group("bold"));
    }
    if (matcher.group("italic") != null) {
      return new InlineRun.Italic(matcher.group("italic"));
    }
    if (matcher.group("label") != null) {
      return new InlineRun.Hyperlink(matcher.group("label"), matcher.group("target"));
    }
    String url = matcher.group("url");
    return new InlineRun.Hyperlink(url, url);
  }

  private void flushPlain(StringBuilder plain, List<InlineRun> runs) {
    if (plain.length() > 0) {
      runs.add(new InlineRun.PlainText(plain.toString()));
      plain.setLength(0);
    }
  }
}
