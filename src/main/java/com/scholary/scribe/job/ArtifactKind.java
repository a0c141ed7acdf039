package com.scholary.scribe.job;

/** Local files a recording accumulates as it moves through the pipeline. */
public enum ArtifactKind {
  AUDIO("audio"),
  TRANSCRIPT("transcript"),
  SUMMARY("summary"),
  DOCUMENT("document");

  private final String directoryName;

  ArtifactKind(String directoryName) {
    this.directoryName = directoryName;
  }

  public String directoryName() {
    return directoryName;
  }
}
