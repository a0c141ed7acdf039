package com.scholary.scribe.stage;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/** Builds safe local file names for artifacts. */
public final class Filenames {

  static final String FALLBACK_AUDIO_NAME = "recording";
  static final String FALLBACK_TITLE = "untitled";
  static final List<String> AUDIO_EXTENSIONS = List.of(".mp3", ".ogg", ".m4a", ".wav", ".flac");

  private static final Pattern UNSAFE_AUDIO_CHARS = Pattern.compile("[^A-Za-z0-9\\-_. ]");
  private static final Pattern UNSAFE_TITLE_CHARS = Pattern.compile("[<>:\"/\\\\|?*\\p{Cntrl}]");
  private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmm");

  private Filenames() {}

  /**
   * File name for downloaded audio: only letters, digits, {@code - _ .} and spaces survive, and
   * {@code .mp3} is appended unless the name already carries a known audio extension.
   */
  public static String audioFileName(String raw) {
    String name = raw == null ? "" : UNSAFE_AUDIO_CHARS.matcher(raw).replaceAll("").strip();
    name = stripDotsAndSpaces(name);
    if (name.isEmpty()) {
      name = FALLBACK_AUDIO_NAME;
    }
    return hasAudioExtension(name) ? name : name + ".mp3";
  }

  /**
   * File name for a rendered document: {@code <title>_<yyyyMMdd_HHmm>.docx}, with characters that
   * are unsafe on common file systems removed and the title cut to {@code maxTitleLength}.
   */
  public static String documentFileName(String title, LocalDateTime timestamp, int maxTitleLength) {
    String safe = title == null ? "" : UNSAFE_TITLE_CHARS.matcher(title).replaceAll("");
    safe = stripDotsAndSpaces(safe);
    if (safe.length() > maxTitleLength) {
      safe = safe.substring(0, maxTitleLength).strip();
    }
    if (safe.isEmpty()) {
      safe = FALLBACK_TITLE;
    }
    return safe + "_" + STAMP.format(timestamp) + ".docx";
  }

  public static String baseName(String filename) {
    int dot = filename.lastIndexOf('.');
    return dot > 0 ? filename.substring(0, dot) : filename;
  }

  static boolean hasAudioExtension(String name) {
    String lower = name.toLowerCase(Locale.ROOT);
    return AUDIO_EXTENSIONS.stream().anyMatch(lower::endsWith);
  }

  private static String stripDotsAndSpaces(String value) {
    int start = 0;
    int end = value.length();
    while (start < end && (value.charAt(start) == '.' || value.charAt(start) == ' ')) {
      start++;
    }
    while (end > start && (value.charAt(end - 1) == '.' || value.charAt(end - 1) == ' ')) {
      end--;
    }
    return value.substring(start, end);
  }
}
