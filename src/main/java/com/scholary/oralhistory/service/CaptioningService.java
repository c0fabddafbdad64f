package com.scholary.oralhistory.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.oralhistory.alignment.AlignmentResult;
import com.scholary.oralhistory.api.CaptionResponse;
import com.scholary.oralhistory.api.StoredCaptionRequest;
import com.scholary.oralhistory.captions.TextCaptioner;
import com.scholary.oralhistory.captions.TextCaptions;
import com.scholary.oralhistory.objectstore.ObjectStoreClient;
import java.io.IOException;
import java.io.InputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Captions one segment at a time, from an inline alignment or one held in object storage.
 *
 * <p>Stored alignments can have their VTT and timing-sync files written back beside them.
 */
@Service
public class CaptioningService {

  private static final Logger LOGGER = LoggerFactory.getLogger(CaptioningService.class);

  private final TextCaptioner captioner;
  private final CaptionWriter captionWriter;
  private final ObjectStoreClient objectStoreClient;
  private final ObjectMapper objectMapper;

  public CaptioningService(
      TextCaptioner captioner,
      CaptionWriter captionWriter,
      ObjectStoreClient objectStoreClient,
      ObjectMapper objectMapper) {
    this.captioner = captioner;
    this.captionWriter = captionWriter;
    this.objectStoreClient = objectStoreClient;
    this.objectMapper = objectMapper;
  }

  /**
   * Caption an alignment supplied by the caller. Nothing is stored.
   *
   * @throws CaptioningException if the alignment cannot be reconciled with its transcript
   */
  public CaptionResponse caption(AlignmentResult alignment, int durationMs) {
    TextCaptions captions = captionAlignment(alignment, durationMs);
    return toResponse(captions, null);
  }

  /**
   * Caption the alignment JSON at {@code bucket/alignmentKey}, saving the results when requested.
   *
   * @throws CaptioningException if the alignment cannot be reconciled with its transcript
   */
  public CaptionResponse captionStoredAlignment(StoredCaptionRequest request) throws IOException {
    LOGGER.info(
        "Captioning stored alignment: bucket={}, key={}, durationMs={}",
        request.bucket(),
        request.alignmentKey(),
        request.durationMs());

    AlignmentResult alignment;
    try (InputStream in =
        objectStoreClient.getObjectStream(request.bucket(), request.alignmentKey())) {
      alignment = objectMapper.readValue(in, AlignmentResult.class);
    } catch (JsonProcessingException e) {
      throw new CaptioningException("Unreadable alignment JSON: " + request.alignmentKey(), e);
    }
    LOGGER.debug("Read alignment with {} words", alignment.words().size());

    TextCaptions captions = captionAlignment(alignment, request.durationMs());

    CaptionResponse.StorageInfo storage = null;
    if (request.save()) {
      storage = captionWriter.saveCaptions(request.bucket(), request.alignmentKey(), captions);
      LOGGER.info(
          "Saved captions: vttKey={} (written={}), timingSyncKey={} (written={})",
          storage.vttKey(),
          storage.vttWritten(),
          storage.timingSyncKey(),
          storage.timingSyncWritten());
    }
    return toResponse(captions, storage);
  }

  private TextCaptions captionAlignment(AlignmentResult alignment, int durationMs) {
    return captioner
        .caption(alignment, durationMs)
        .orElseThrow(
            error -> {
              LOGGER.error("Segment not captioned: {}", error);
              return new CaptioningException(error);
            });
  }

  private CaptionResponse toResponse(TextCaptions captions, CaptionResponse.StorageInfo storage) {
    return new CaptionResponse(
        captions.cues(),
        captions.validation(),
        captionWriter.writeVtt(captions),
        captionWriter.timingSync(captions),
        storage);
  }
}
