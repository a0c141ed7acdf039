package com.scholary.scribe.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Immutable set of artifacts, at most one per {@link ArtifactKind}. */
public final class ArtifactSet {

  private static final ArtifactSet EMPTY = new ArtifactSet(Map.of());

  private final Map<ArtifactKind, Artifact> entries;

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public ArtifactSet(Map<ArtifactKind, Artifact> entries) {
    EnumMap<ArtifactKind, Artifact> copy = new EnumMap<>(ArtifactKind.class);
    if (entries != null) {
      copy.putAll(entries);
    }
    this.entries = Collections.unmodifiableMap(copy);
  }

  public static ArtifactSet empty() {
    return EMPTY;
  }

  @JsonValue
  public Map<ArtifactKind, Artifact> asMap() {
    return entries;
  }

  public Optional<Artifact> get(ArtifactKind kind) {
    return Optional.ofNullable(entries.get(kind));
  }

  public boolean has(ArtifactKind kind) {
    return entries.containsKey(kind);
  }

  public Set<ArtifactKind> kinds() {
    return entries.keySet();
  }

  public ArtifactSet with(ArtifactKind kind, Artifact artifact) {
    EnumMap<ArtifactKind, Artifact> copy = new EnumMap<>(ArtifactKind.class);
    copy.putAll(entries);
    copy.put(kind, artifact);
    return new ArtifactSet(copy);
  }

  public ArtifactSet without(Collection<ArtifactKind> kinds) {
    EnumMap<ArtifactKind, Artifact> copy = new EnumMap<>(ArtifactKind.class);
    copy.putAll(entries);
    kinds.forEach(copy::remove);
    return new ArtifactSet(copy);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof ArtifactSet set && entries.equals(set.entries);
  }

  @Override
  public int hashCode() {
    return entries.hashCode();
  }

  @Override
  public String toString() {
    return entries.toString();
  }
}
