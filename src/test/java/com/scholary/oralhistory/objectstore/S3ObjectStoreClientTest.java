package com.scholary.oralhistory.objectstore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.net.URI;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PresignedGetObjectRequest;

class S3ObjectStoreClientTest {

  private static final byte[] CONTENT = "hello".getBytes(StandardCharsets.UTF_8);
  private static final String CONTENT_MD5 = "5d41402abc4b2a76b9719d911017c592";

  private S3Client s3Client;
  private S3Presigner s3Presigner;
  private S3ObjectStoreClient client;

  @BeforeEach
  void setUp() {
    s3Client = mock(S3Client.class);
    s3Presigner = mock(S3Presigner.class);
    client = new S3ObjectStoreClient(s3Client, s3Presigner);
  }

  @Test
  void md5Hex_shouldMatchSinglePartETag() {
    assertThat(S3ObjectStoreClient.md5Hex(CONTENT)).isEqualTo(CONTENT_MD5);
  }

  @Test
  void putObjectIfChanged_shouldSkipIdenticalObject() {
    when(s3Client.headObject(any(HeadObjectRequest.class)))
        .thenReturn(HeadObjectResponse.builder().eTag("\"" + CONTENT_MD5 + "\"").build());

    boolean written = client.putObjectIfChanged("archive", "seg1.vtt", CONTENT, "text/vtt");

    assertThat(written).isFalse();
    verify(s3Client, never()).putObject(any(PutObjectRequest.class), any(RequestBody.class));
  }

  @Test
  void putObjectIfChanged_shouldUploadWhenObjectIsMissing() {
    when(s3Client.headObject(any(HeadObjectRequest.class)))
        .thenThrow(NoSuchKeyException.builder().message("missing").build());

    boolean written = client.putObjectIfChanged("archive", "seg1.vtt", CONTENT, "text/vtt");

    assertThat(written).isTrue();
    ArgumentCaptor<PutObjectRequest> request = ArgumentCaptor.forClass(PutObjectRequest.class);
    verify(s3Client).putObject(request.capture(), any(RequestBody.class));
    assertThat(request.getValue().bucket()).isEqualTo("archive");
    assertThat(request.getValue().key()).isEqualTo("seg1.vtt");
    assertThat(request.getValue().contentType()).isEqualTo("text/vtt");
    assertThat(request.getValue().contentLength()).isEqualTo(5L);
  }

  @Test
  void putObjectIfChanged_shouldUploadWhenContentDiffers() {
    when(s3Client.headObject(any(HeadObjectRequest.class)))
        .thenReturn(HeadObjectResponse.builder().eTag("\"0123456789abcdef\"").build());

    assertThat(client.putObjectIfChanged("archive", "seg1.vtt", CONTENT, "text/vtt")).isTrue();
    verify(s3Client).putObject(any(PutObjectRequest.class), any(RequestBody.class));
  }

  @Test
  void putObjectIfChanged_shouldTreatNotFoundStatusAsMissing() {
    when(s3Client.headObject(any(HeadObjectRequest.class)))
        .thenThrow(S3Exception.builder().statusCode(404).message("Not Found").build());

    assertThat(client.putObjectIfChanged("archive", "seg1.vtt", CONTENT, "text/vtt")).isTrue();
  }

  @Test
  void putObjectIfChanged_shouldFailWhenChecksumLookupFails() {
    when(s3Client.headObject(any(HeadObjectRequest.class)))
        .thenThrow(S3Exception.builder().statusCode(500).message("boom").build());

    assertThatThrownBy(() -> client.putObjectIfChanged("archive", "seg1.vtt", CONTENT, "text/vtt"))
        .isInstanceOf(ObjectStoreException.class)
        .hasMessageContaining("statusCode=500");
    verify(s3Client, never()).putObject(any(PutObjectRequest.class), any(RequestBody.class));
  }

  @Test
  void getObjectStream_shouldWrapMissingObject() {
    when(s3Client.getObject(any(GetObjectRequest.class)))
        .thenThrow(NoSuchKeyException.builder().message("missing").build());

    assertThatThrownBy(() -> client.getObjectStream("archive", "absent.json"))
        .isInstanceOf(ObjectStoreException.class)
        .hasMessage("Object not found: bucket=archive, key=absent.json");
  }

  @Test
  void getObjectMetadata_shouldStripETagQuotes() {
    when(s3Client.headObject(any(HeadObjectRequest.class)))
        .thenReturn(
            HeadObjectResponse.builder()
                .contentLength(5L)
                .contentType("text/vtt")
                .eTag("\"" + CONTENT_MD5 + "\"")
                .build());

    ObjectStoreClient.ObjectMetadata metadata = client.getObjectMetadata("archive", "seg1.vtt");

    assertThat(metadata)
        .isEqualTo(new ObjectStoreClient.ObjectMetadata(5L, "text/vtt", CONTENT_MD5));
  }

  @Test
  void presignGet_shouldReturnPresignedUrl() throws Exception {
    URL url = URI.create("http://localhost:9000/archive/seg1.vtt?X-Amz-Signature=abc").toURL();
    PresignedGetObjectRequest presigned = mock(PresignedGetObjectRequest.class);
    when(presigned.url()).thenReturn(url);
    when(s3Presigner.presignGetObject(any(GetObjectPresignRequest.class))).thenReturn(presigned);

    assertThat(client.presignGet("archive", "seg1.vtt", Duration.ofMinutes(5))).isSameAs(url);

    ArgumentCaptor<GetObjectPresignRequest> request =
        ArgumentCaptor.forClass(GetObjectPresignRequest.class);
    verify(s3Presigner).presignGetObject(request.capture());
    assertThat(request.getValue().signatureDuration()).isEqualTo(Duration.ofMinutes(5));
    assertThat(request.getValue().getObjectRequest().key()).isEqualTo("seg1.vtt");
  }
}
