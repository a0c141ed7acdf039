package com.scholary.scribe.storage;

import java.util.Locale;

/** Helpers for object names shared by the storage backends. */
final class FileNames {

  private FileNames() {}

  /** Insert a suffix before the extension: {@code a.docx} becomes {@code a-1234.docx}. */
  static String withSuffix(String filename, String suffix) {
    int dot = filename.lastIndexOf('.');
    if (dot <= 0) {
      return filename + suffix;
    }
    return filename.substring(0, dot) + suffix + filename.substring(dot);
  }

  static String contentType(String filename) {
    String lower = filename.toLowerCase(Locale.ROOT);
    if (lower.endsWith(".docx")) {
      return "application/vnd.openxmlformats-officedocument.wordprocessingml.document";
    } else if (lower.endsWith(".txt")) {
      return "text/plain; charset=utf-8";
    } else if (lower.endsWith(".md")) {
      return "text/markdown; charset=utf-8";
    } else if (lower.endsWith(".mp3")) {
      return "audio/mpeg";
    } else if (lower.endsWith(".m4a")) {
      return "audio/mp4";
    } else if (lower.endsWith(".ogg")) {
      return "audio/ogg";
    } else if (lower.endsWith(".wav")) {
      return "audio/wav";
    } else if (lower.endsWith(".flac")) {
      return "audio/flac";
    }
    return "application/octet-stream";
  }
}
