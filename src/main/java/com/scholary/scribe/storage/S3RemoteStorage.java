package com.scholary.scribe.storage;

import java.net.URI;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

/**
 * S3/MinIO implementation of RemoteStorage.
 *
 * <p>Folders are key prefixes inside one bucket. The content fingerprint of every uploaded object
 * is stored in its user metadata under {@value #FINGERPRINT_METADATA}, so de-duplication needs a
 * listing plus one HEAD per object and never downloads content.
 *
 * <p>The AWS SDK retries transient failures (network issues, 500 errors, throttling) on its own;
 * anything that still fails surfaces as {@link RemoteStorageException}.
 */
public class S3RemoteStorage implements RemoteStorage {

  private static final Logger LOGGER = LoggerFactory.getLogger(S3RemoteStorage.class);

  static final String FINGERPRINT_METADATA = "fingerprint";

  private final S3Client s3Client;
  private final String bucket;

  public S3RemoteStorage(ObjectStoreProperties properties) {
    this(buildClient(properties), properties.bucket());
  }

  S3RemoteStorage(S3Client s3Client, String bucket) {
    this.s3Client = s3Client;
    this.bucket = bucket;
  }

  private static S3Client buildClient(ObjectStoreProperties properties) {
    LOGGER.info(
        "Initializing S3 client: endpoint={}, bucket={}, pathStyleAccess={}",
        properties.endpoint(),
        properties.bucket(),
        properties.pathStyleAccess());

    AwsBasicCredentials credentials =
        AwsBasicCredentials.create(properties.accessKey(), properties.secretKey());

    Region region =
        properties.region() != null && !properties.region().isEmpty()
            ? Region.of(properties.region())
            : Region.US_EAST_1;

    return S3Client.builder()
        .region(region)
        .credentialsProvider(StaticCredentialsProvider.create(credentials))
        .endpointOverride(URI.create(properties.endpoint()))
        .forcePathStyle(properties.pathStyleAccess()) // Required for MinIO
        .build();
  }

  @Override
  public String ensureFolder(String path) {
    String prefix = normalize(path);
    LOGGER.debug("Using folder prefix: bucket={}, prefix={}", bucket, prefix);
    try {
      s3Client.headObject(HeadObjectRequest.builder().bucket(bucket).key(prefix).build());
    } catch (NoSuchKeyException e) {
      // folder marker
      putMarker(prefix);
    } catch (S3Exception e) {
      if (e.statusCode() != 404) {
        throw failure("Failed to check folder", prefix, e);
      }
      putMarker(prefix);
    }
    return prefix;
  }

  @Override
  public synchronized UploadResult upload(
      String folderId, String filename, Path file, String fingerprint) {
    Map<String, String> existing = fingerprintsToKeys(folderId);
    String existingKey = existing.get(fingerprint);
    if (existingKey != null) {
      LOGGER.info(
          "Skipping upload, identical content exists: bucket={}, key={}", bucket, existingKey);
      return new UploadResult(existingKey, true);
    }

    String key = folderId + filename;
    if (existing.containsValue(key)) {
      key = folderId + FileNames.withSuffix(filename, "-" + fingerprint.substring(0, 8));
    }

    LOGGER.debug("Uploading object: bucket={}, key={}, file={}", bucket, key, file);
    try {
      PutObjectRequest request =
          PutObjectRequest.builder()
              .bucket(bucket)
              .key(key)
              .contentType(FileNames.contentType(filename))
              .metadata(Map.of(FINGERPRINT_METADATA, fingerprint))
              .build();

      s3Client.putObject(request, RequestBody.fromFile(file));

      LOGGER.info("Successfully uploaded object: bucket={}, key={}", bucket, key);
      return new UploadResult(key, false);

    } catch (S3Exception e) {
      throw failure("Failed to upload object", key, e);

    } catch (RuntimeException e) {
      String message =
          String.format("Unexpected error uploading object: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message, e);
      throw new RemoteStorageException(message, e);
    }
  }

  @Override
  public Set<String> listExisting(String folderId) {
    return fingerprintsToKeys(folderId).keySet();
  }

  private Map<String, String> fingerprintsToKeys(String prefix) {
    Map<String, String> result = new HashMap<>();
    try {
      ListObjectsV2Request request =
          ListObjectsV2Request.builder().bucket(bucket).prefix(prefix).build();
      for (S3Object object : s3Client.listObjectsV2Paginator(request).contents()) {
        if (object.key().equals(prefix)) {
          continue;
        }
        HeadObjectResponse head =
            s3Client.headObject(
                HeadObjectRequest.builder().bucket(bucket).key(object.key()).build());
        String fingerprint = head.metadata().get(FINGERPRINT_METADATA);
        if (fingerprint != null) {
          result.put(fingerprint, object.key());
        }
      }
    } catch (S3Exception e) {
      throw failure("Failed to list folder", prefix, e);
    }
    LOGGER.debug("Listed folder: bucket={}, prefix={}, objects={}", bucket, prefix, result.size());
    return result;
  }

  private void putMarker(String prefix) {
    try {
      s3Client.putObject(
          PutObjectRequest.builder().bucket(bucket).key(prefix).build(), RequestBody.empty());
      LOGGER.info("Created folder marker: bucket={}, key={}", bucket, prefix);
    } catch (S3Exception e) {
      throw failure("Failed to create folder", prefix, e);
    }
  }

  private RemoteStorageException failure(String action, String key, S3Exception e) {
    String message =
        String.format(
            "%s: bucket=%s, key=%s, statusCode=%s", action, bucket, key, e.statusCode());
    LOGGER.error(message, e);
    return new RemoteStorageException(message, e);
  }

  static String normalize(String path) {
    String trimmed = path.strip();
    while (trimmed.startsWith("/")) {
      trimmed = trimmed.substring(1);
    }
    return trimmed.endsWith("/") ? trimmed : trimmed + "/";
  }

  /** Release connections and threads held by the SDK client. */
  public void close() {
    LOGGER.info("Closing S3 client");
    s3Client.close();
  }
}
