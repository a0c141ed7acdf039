package com.scholary.scribe.storage;

import com.scholary.scribe.job.Fingerprints;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Remote storage that keeps folders as directories under a local root, for single-machine setups
 * and tests. Fingerprints are computed from the stored files.
 */
public class FileSystemRemoteStorage implements RemoteStorage {

  private static final Logger LOGGER = LoggerFactory.getLogger(FileSystemRemoteStorage.class);

  private final Path root;

  public FileSystemRemoteStorage(Path root) {
    this.root = root.toAbsolutePath().normalize();
    LOGGER.info("Initialized filesystem storage: root={}", this.root);
  }

  @Override
  public String ensureFolder(String path) {
    Path folder = resolve(path);
    try {
      Files.createDirectories(folder);
    } catch (IOException e) {
      throw new RemoteStorageException("Failed to create folder " + folder, e);
    }
    return root.relativize(folder).toString();
  }

  @Override
  public synchronized UploadResult upload(
      String folderId, String filename, Path file, String fingerprint) {
    Path folder = resolve(folderId);
    Map<String, Path> existing = fingerprintsToFiles(folder);
    Path match = existing.get(fingerprint);
    if (match != null) {
      LOGGER.info("Skipping upload, identical content exists: {}", match);
      return new UploadResult(root.relativize(match).toString(), true);
    }

    Path target = folder.resolve(filename).normalize();
    if (Files.exists(target)) {
      target = folder.resolve(FileNames.withSuffix(filename, "-" + fingerprint.substring(0, 8)));
    }
    if (!target.startsWith(folder)) {
      throw new RemoteStorageException("Invalid object name: " + filename);
    }

    try {
      Path temp = folder.resolve("." + target.getFileName() + ".part");
      Files.copy(file, temp, StandardCopyOption.REPLACE_EXISTING);
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      throw new RemoteStorageException("Failed to upload " + file + " to " + target, e);
    }
    LOGGER.info("Stored object: {}", target);
    return new UploadResult(root.relativize(target).toString(), false);
  }

  @Override
  public Set<String> listExisting(String folderId) {
    return fingerprintsToFiles(resolve(folderId)).keySet();
  }

  private Map<String, Path> fingerprintsToFiles(Path folder) {
    Map<String, Path> result = new HashMap<>();
    if (!Files.isDirectory(folder)) {
      throw new RemoteStorageException("Folder does not exist: " + folder);
    }
    try (Stream<Path> files = Files.list(folder)) {
      files
          .filter(Files::isRegularFile)
          .filter(f -> !f.getFileName().toString().startsWith("."))
          .forEach(f -> result.put(Fingerprints.of(f), f));
    } catch (IOException | UncheckedIOException e) {
      throw new RemoteStorageException("Failed to list folder " + folder, e);
    }
    return result;
  }

  private Path resolve(String folderId) {
    Path folder = root.resolve(folderId).normalize();
    if (!folder.startsWith(root)) {
      throw new RemoteStorageException("Folder outside storage root: " + folderId);
    }
    return folder;
  }
}
