package com.scholary.oralhistory.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.oralhistory.alignment.AlignmentResult;
import com.scholary.oralhistory.captions.CaptionValidationReport;
import com.scholary.oralhistory.job.CaptioningJob;
import com.scholary.oralhistory.job.CaptioningJobRunner;
import com.scholary.oralhistory.job.JobRepository;
import com.scholary.oralhistory.service.CaptioningException;
import com.scholary.oralhistory.service.CaptioningService;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class CaptionControllerTest {

  private static final String CAPTION_BODY =
      "{\"alignment\":{\"transcript\":\"Hello.\",\"words\":[]},\"durationMs\":3000}";
  private static final String JOB_BODY =
      "{\"bucket\":\"archive\",\"alignmentKey\":\"story/seg1.json\",\"durationMs\":3000}";

  private CaptioningService captioningService;
  private CaptioningJobRunner jobRunner;
  private JobRepository jobRepository;
  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    captioningService = mock(CaptioningService.class);
    jobRunner = mock(CaptioningJobRunner.class);
    jobRepository = mock(JobRepository.class);
    mockMvc =
        MockMvcBuilders.standaloneSetup(
                new CaptionController(captioningService, jobRunner, jobRepository))
            .build();
  }

  @Test
  void caption_shouldReturnCaptions() throws Exception {
    when(captioningService.caption(any(AlignmentResult.class), eq(3000)))
        .thenReturn(response("WEBVTT\n"));

    mockMvc
        .perform(
            post("/api/captions").contentType(MediaType.APPLICATION_JSON).content(CAPTION_BODY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.vtt").value("WEBVTT\n"))
        .andExpect(jsonPath("$.validation.cueCount").value(0));
  }

  @Test
  void caption_shouldReturnUnprocessableWhenCaptioningFails() throws Exception {
    when(captioningService.caption(any(AlignmentResult.class), eq(3000)))
        .thenThrow(new CaptioningException("Word 'planet' not found"));

    mockMvc
        .perform(
            post("/api/captions").contentType(MediaType.APPLICATION_JSON).content(CAPTION_BODY))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.error").value("Word 'planet' not found"));
  }

  @Test
  void caption_shouldRejectNonPositiveDuration() throws Exception {
    mockMvc
        .perform(
            post("/api/captions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"alignment\":{\"transcript\":\"Hello.\"},\"durationMs\":0}"))
        .andExpect(status().isBadRequest());

    verifyNoInteractions(captioningService);
  }

  @Test
  void startJob_shouldAcceptAndRunJob() throws Exception {
    mockMvc
        .perform(
            post("/api/captions/jobs").contentType(MediaType.APPLICATION_JSON).content(JOB_BODY))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.jobId").isNotEmpty());

    ArgumentCaptor<CaptioningJob> job = ArgumentCaptor.forClass(CaptioningJob.class);
    verify(jobRepository).save(job.capture());
    verify(jobRunner).run(job.getValue());
    assertThat(job.getValue().getRequest().alignmentKey()).isEqualTo("story/seg1.json");
    assertThat(job.getValue().getRequest().save()).isTrue();
  }

  @Test
  void getJobStatus_shouldReturnJob() throws Exception {
    CaptioningJob job =
        new CaptioningJob("job-1", new StoredCaptionRequest("archive", "a.json", 3000, true));
    when(jobRepository.findById("job-1")).thenReturn(Optional.of(job));

    mockMvc
        .perform(get("/api/jobs/job-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.jobId").value("job-1"))
        .andExpect(jsonPath("$.status").value("PENDING"))
        .andExpect(jsonPath("$.progress").value(0));
  }

  @Test
  void getJobStatus_shouldReturnNotFoundForUnknownJob() throws Exception {
    when(jobRepository.findById("nope")).thenReturn(Optional.empty());

    mockMvc.perform(get("/api/jobs/nope")).andExpect(status().isNotFound());
  }

  private static CaptionResponse response(String vtt) {
    return new CaptionResponse(
        List.of(), new CaptionValidationReport(0, 0, 0, 0, 0, 0, 0), vtt, List.of(), null);
  }
}
