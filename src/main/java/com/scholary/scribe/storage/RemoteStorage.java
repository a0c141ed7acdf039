package com.scholary.scribe.storage;

import java.nio.file.Path;
import java.util.Set;

/**
 * Remote folder-based storage where published artifacts end up.
 *
 * <p>Uploads are de-duplicated by content fingerprint: uploading a file whose fingerprint is
 * already present in the folder succeeds without creating a second object.
 *
 * <p>Implementations throw {@link RemoteStorageException} on failure.
 */
public interface RemoteStorage {

  /**
   * Make sure a folder exists.
   *
   * @param path slash-separated folder path, e.g. {@code documents}
   * @return an id that identifies the folder in later calls
   */
  String ensureFolder(String path);

  /**
   * Upload a file unless the folder already holds one with the same fingerprint.
   *
   * @param folderId id returned by {@link #ensureFolder(String)}
   * @param filename name of the object inside the folder
   * @param file local file to upload
   * @param fingerprint SHA-256 of the file content
   * @return the object id and whether the upload was skipped
   */
  UploadResult upload(String folderId, String filename, Path file, String fingerprint);

  /** Fingerprints of all objects in a folder. */
  Set<String> listExisting(String folderId);
}
