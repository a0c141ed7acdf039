package com.scholary.scribe.job;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/** SHA-256 content fingerprints, lowercase hex. */
public final class Fingerprints {

  private static final int BUFFER_SIZE = 64 * 1024;

  private Fingerprints() {}

  public static String of(byte[] content) {
    MessageDigest digest = newDigest();
    return HexFormat.of().formatHex(digest.digest(content));
  }

  public static String of(Path file) {
    MessageDigest digest = newDigest();
    byte[] buffer = new byte[BUFFER_SIZE];
    try (InputStream in = Files.newInputStream(file)) {
      int read;
      while ((read = in.read(buffer)) != -1) {
        digest.update(buffer, 0, read);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot fingerprint " + file, e);
    }
    return HexFormat.of().formatHex(digest.digest());
  }

  /** Whether the file exists and its content still hashes to the given fingerprint. */
  public static boolean matches(Path file, String fingerprint) {
    return fingerprint != null && Files.isRegularFile(file) && fingerprint.equals(of(file));
  }

  static MessageDigest newDigest() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
