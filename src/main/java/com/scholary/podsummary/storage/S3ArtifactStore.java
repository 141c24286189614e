package com.scholary.podsummary.storage;

import java.net.URI;
import java.util.Comparator;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

/**
 * S3/MinIO implementation of {@link ArtifactStore}.
 *
 * <p>Each artifact is stored under {@code <prefix><jobId>/<name>} in a single bucket. Works with
 * real S3 and S3-compatible services; MinIO needs path-style access.
 *
 * <p>The SDK retries transient failures (network issues, 5xx, throttling) itself. A missing key is
 * reported as {@link ArtifactNotFoundException}; every other failure as {@link StorageException}.
 */
public class S3ArtifactStore extends AbstractArtifactStore implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(S3ArtifactStore.class);

  private final S3Client s3Client;
  private final String bucket;
  private final String prefix;

  public S3ArtifactStore(ArtifactStoreProperties.S3 properties, String publicBaseUrl) {
    this(buildClient(properties), properties.bucket(), properties.prefix(), publicBaseUrl);
  }

  S3ArtifactStore(S3Client s3Client, String bucket, String prefix, String publicBaseUrl) {
    super(publicBaseUrl);
    this.s3Client = s3Client;
    this.bucket = bucket;
    this.prefix = prefix == null ? "" : prefix;
    LOGGER.info("Initialized S3 artifact store: bucket={}, prefix={}", bucket, this.prefix);
  }

  private static S3Client buildClient(ArtifactStoreProperties.S3 properties) {
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
        .forcePathStyle(properties.pathStyleAccess())
        .build();
  }

  @Override
  public String write(String jobId, String name, byte[] content) {
    validate(jobId, name);
    String key = key(jobId, name);
    LOGGER.debug("Uploading artifact: bucket={}, key={}, bytes={}", bucket, key, content.length);

    try {
      PutObjectRequest request =
          PutObjectRequest.builder()
              .bucket(bucket)
              .key(key)
              .contentType(ArtifactNames.contentType(name))
              .contentLength((long) content.length)
              .build();
      s3Client.putObject(request, RequestBody.fromBytes(content));
      return reference(jobId, name);

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to upload artifact: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new StorageException(message, e);

    } catch (RuntimeException e) {
      String message =
          String.format("Unexpected error uploading artifact: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message, e);
      throw new StorageException(message, e);
    }
  }

  @Override
  public byte[] read(String jobId, String name) {
    validate(jobId, name);
    String key = key(jobId, name);

    try {
      GetObjectRequest request = GetObjectRequest.builder().bucket(bucket).key(key).build();
      return s3Client.getObjectAsBytes(request).asByteArray();

    } catch (NoSuchKeyException e) {
      throw new ArtifactNotFoundException(jobId, name);

    } catch (S3Exception e) {
      if (e.statusCode() == 404) {
        throw new ArtifactNotFoundException(jobId, name);
      }
      String message =
          String.format(
              "Failed to read artifact: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new StorageException(message, e);

    } catch (RuntimeException e) {
      String message =
          String.format("Unexpected error reading artifact: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message, e);
      throw new StorageException(message, e);
    }
  }

  @Override
  public boolean exists(String jobId, String name) {
    validate(jobId, name);
    String key = key(jobId, name);
    try {
      s3Client.headObject(HeadObjectRequest.builder().bucket(bucket).key(key).build());
      return true;
    } catch (NoSuchKeyException e) {
      return false;
    } catch (S3Exception e) {
      if (e.statusCode() == 404) {
        return false;
      }
      String message =
          String.format(
              "Failed to check artifact: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new StorageException(message, e);
    }
  }

  @Override
  public Optional<String> findSourceAudio(String jobId) {
    validateJobId(jobId);
    String jobPrefix = prefix + jobId + "/";
    try {
      ListObjectsV2Request request =
          ListObjectsV2Request.builder()
              .bucket(bucket)
              .prefix(jobPrefix + ArtifactNames.SOURCE_PREFIX + ".")
              .build();
      return s3Client.listObjectsV2(request).contents().stream()
          .map(S3Object::key)
          .map(key -> key.substring(jobPrefix.length()))
          .filter(ArtifactNames::isSourceFile)
          .min(Comparator.naturalOrder());
    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to list artifacts: bucket=%s, prefix=%s, statusCode=%s",
              bucket, jobPrefix, e.statusCode());
      LOGGER.error(message, e);
      throw new StorageException(message, e);
    }
  }

  @Override
  public void close() {
    LOGGER.info("Closing S3 client");
    s3Client.close();
  }

  private String key(String jobId, String name) {
    return prefix + jobId + "/" + name;
  }
}
