package com.scholary.oralhistory.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.oralhistory.api.CaptionResponse;
import com.scholary.oralhistory.captions.CaptionCue;
import com.scholary.oralhistory.captions.CueText;
import com.scholary.oralhistory.captions.TextCaptions;
import com.scholary.oralhistory.captions.TimingSyncPair;
import com.scholary.oralhistory.objectstore.ObjectStoreClient;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Writes captions in the formats the archive player and reviewers use.
 *
 * <p>WebVTT for playback, a timing-sync list that lets the transcript view follow the video, and a
 * plain-text dump for checking cue boundaries by eye.
 */
@Component
public class CaptionWriter {

  private static final String VTT_CONTENT_TYPE = "text/vtt";
  private static final String JSON_CONTENT_TYPE = "application/json";

  private final ObjectMapper objectMapper;
  private final ObjectStoreClient objectStoreClient;

  public CaptionWriter(ObjectMapper objectMapper, ObjectStoreClient objectStoreClient) {
    this.objectMapper = objectMapper;
    this.objectStoreClient = objectStoreClient;
  }

  /**
   * Write captions as WebVTT.
   *
   * <pre>
   * WEBVTT
   * NOTE Captions generated from forced alignment
   *
   * 00:01.000 --&gt; 00:04.500
   * &lt;v S1&gt;Where did you grow up?
   * &lt;v S2&gt;Chicago.
   * </pre>
   */
  public String writeVtt(TextCaptions captions) {
    StringBuilder vtt = new StringBuilder();
    vtt.append("WEBVTT\n");
    vtt.append("NOTE Captions generated from forced alignment\n\n");

    for (CaptionCue cue : captions.cues()) {
      vtt.append(formatVttTime(cue.getTimeStart()))
          .append(" --> ")
          .append(formatVttTime(cue.getTimeEnd()))
          .append("\n");
      for (CueText line : cue.getLines()) {
        if (!line.getSpeaker().isEmpty()) {
          vtt.append("<v ").append(line.getSpeaker()).append(">");
        }
        vtt.append(escapeVtt(line.getText())).append("\n");
      }
      vtt.append("\n");
    }
    return vtt.toString();
  }

  /**
   * (transcript offset, time) pairs: (0, 0) first, then one per cue start, then the end of the
   * transcript paired with the end of the segment.
   */
  public List<TimingSyncPair> timingSync(TextCaptions captions) {
    List<TimingSyncPair> pairs = new ArrayList<>(captions.cues().size() + 2);
    pairs.add(new TimingSyncPair(0, 0));
    for (CaptionCue cue : captions.cues()) {
      pairs.add(new TimingSyncPair(cue.getTranscriptOffset(), cue.getTimeStart()));
    }
    pairs.add(new TimingSyncPair(captions.endOffset(), captions.endTimeMs()));
    return pairs;
  }

  public byte[] writeTimingSyncJson(TextCaptions captions) throws IOException {
    return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(timingSync(captions));
  }

  /** Plain-text listing of every cue, for manual review. */
  public String writeDiagnostic(TextCaptions captions) {
    StringBuilder text = new StringBuilder();
    List<CaptionCue> cues = captions.cues();
    for (int i = 0; i < cues.size(); i++) {
      CaptionCue cue = cues.get(i);
      text.append(
          String.format(
              "Cue %d: %d-%dms (%dms), %d line(s)\n",
              i + 1,
              cue.getTimeStart(),
              cue.getTimeEnd(),
              cue.duration(),
              cue.getLines().size()));
      for (CueText line : cue.getLines()) {
        String speaker = line.getSpeaker().isEmpty() ? "--" : line.getSpeaker();
        text.append(String.format("  %s [%d chars]: %s\n", speaker, line.length(), line.getText()));
      }
    }
    text.append(String.format("%d cues", cues.size()));
    return text.toString();
  }

  /**
   * Save the VTT and timing-sync files next to the alignment they were built from. Files whose
   * stored copy is identical are not rewritten.
   *
   * @param bucket the bucket name
   * @param alignmentKey key of the alignment JSON
   * @return storage info with keys and URLs
   */
  public CaptionResponse.StorageInfo saveCaptions(
      String bucket, String alignmentKey, TextCaptions captions) throws IOException {

    String baseKey = alignmentKey.replaceAll("\\.[^./]+$", "");
    String vttKey = baseKey + ".vtt";
    String timingSyncKey = baseKey + "_tsync.json";

    boolean vttWritten =
        objectStoreClient.putObjectIfChanged(
            bucket, vttKey, writeVtt(captions).getBytes(StandardCharsets.UTF_8), VTT_CONTENT_TYPE);
    boolean timingSyncWritten =
        objectStoreClient.putObjectIfChanged(
            bucket, timingSyncKey, writeTimingSyncJson(captions), JSON_CONTENT_TYPE);

    String vttUrl = objectStoreClient.presignGet(bucket, vttKey, Duration.ofDays(7)).toString();
    String timingSyncUrl =
        objectStoreClient.presignGet(bucket, timingSyncKey, Duration.ofDays(7)).toString();

    return new CaptionResponse.StorageInfo(
        bucket, vttKey, timingSyncKey, vttUrl, timingSyncUrl, vttWritten, timingSyncWritten);
  }

  /** HH:MM:SS.mmm, or MM:SS.mmm under an hour. */
  static String formatVttTime(int millis) {
    int hours = millis / 3_600_000;
    int minutes = (millis / 60_000) % 60;
    int seconds = (millis / 1000) % 60;
    int ms = millis % 1000;
    if (hours > 0) {
      return String.format("%02d:%02d:%02d.%03d", hours, minutes, seconds, ms);
    }
    return String.format("%02d:%02d.%03d", minutes, seconds, ms);
  }

  private static String escapeVtt(String text) {
    return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
  }
}
