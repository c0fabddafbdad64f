package com.scholary.oralhistory.objectstore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.wait.strategy.HttpWaitStrategy;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;

/**
 * Runs the S3 client against a MinIO container, checking that checksum-based skipping works with a
 * real server's ETags.
 */
@Testcontainers(disabledWithoutDocker = true)
class S3ObjectStoreClientMinioTest {

  private static final String MINIO_ACCESS_KEY = "minioadmin";
  private static final String MINIO_SECRET_KEY = "minioadmin";
  private static final String TEST_BUCKET = "captions-test";

  @Container
  static GenericContainer<?> minioContainer =
      new GenericContainer<>("minio/minio:latest")
          .withExposedPorts(9000)
          .withEnv("MINIO_ROOT_USER", MINIO_ACCESS_KEY)
          .withEnv("MINIO_ROOT_PASSWORD", MINIO_SECRET_KEY)
          .withCommand("server /data")
          .waitingFor(new HttpWaitStrategy().forPath("/minio/health/ready").forPort(9000));

  private static S3ObjectStoreClient client;

  @BeforeAll
  static void setUp() {
    String endpoint =
        String.format("http://%s:%d", minioContainer.getHost(), minioContainer.getMappedPort(9000));

    try (S3Client admin =
        S3Client.builder()
            .region(Region.US_EAST_1)
            .credentialsProvider(
                StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(MINIO_ACCESS_KEY, MINIO_SECRET_KEY)))
            .endpointOverride(URI.create(endpoint))
            .forcePathStyle(true)
            .build()) {
      admin.createBucket(CreateBucketRequest.builder().bucket(TEST_BUCKET).build());
    }

    client =
        new S3ObjectStoreClient(
            new ObjectStoreProperties(
                endpoint, MINIO_ACCESS_KEY, MINIO_SECRET_KEY, TEST_BUCKET, "us-east-1", true));
  }

  @AfterAll
  static void tearDown() {
    if (client != null) {
      client.close();
    }
  }

  @Test
  void putObjectIfChanged_shouldSkipSecondIdenticalUpload() throws Exception {
    byte[] vtt =
        "WEBVTT\n\n00:00.000 --> 00:02.000\n<v S1>Hello.\n".getBytes(StandardCharsets.UTF_8);

    assertThat(client.putObjectIfChanged(TEST_BUCKET, "story/seg1.vtt", vtt, "text/vtt")).isTrue();
    assertThat(client.putObjectIfChanged(TEST_BUCKET, "story/seg1.vtt", vtt, "text/vtt")).isFalse();

    try (InputStream stored = client.getObjectStream(TEST_BUCKET, "story/seg1.vtt")) {
      assertThat(stored.readAllBytes()).isEqualTo(vtt);
    }
    ObjectStoreClient.ObjectMetadata metadata =
        client.getObjectMetadata(TEST_BUCKET, "story/seg1.vtt");
    assertThat(metadata.contentLength()).isEqualTo(vtt.length);
    assertThat(metadata.eTag()).isEqualTo(S3ObjectStoreClient.md5Hex(vtt));
  }

  @Test
  void putObjectIfChanged_shouldRewriteChangedContent() {
    byte[] first = "[]".getBytes(StandardCharsets.UTF_8);
    byte[] second = "[{\"offset\":0,\"timeMs\":0}]".getBytes(StandardCharsets.UTF_8);

    String key = "story/tsync.json";

    assertThat(client.putObjectIfChanged(TEST_BUCKET, key, first, "application/json")).isTrue();
    assertThat(client.putObjectIfChanged(TEST_BUCKET, key, second, "application/json")).isTrue();
  }

  @Test
  void getObjectStream_shouldFailForMissingObject() {
    assertThatThrownBy(() -> client.getObjectStream(TEST_BUCKET, "story/absent.json"))
        .isInstanceOf(ObjectStoreException.class);
  }

  @Test
  void presignGet_shouldNameTheObject() {
    String url =
        client.presignGet(TEST_BUCKET, "story/seg1.vtt", Duration.ofMinutes(10)).toString();

    assertThat(url).contains("story/seg1.vtt").contains("X-Amz-Signature");
  }
}
