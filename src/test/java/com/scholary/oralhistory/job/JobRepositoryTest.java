package com.scholary.oralhistory.job;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.oralhistory.api.JobStatusResponse.Status;
import com.scholary.oralhistory.api.StoredCaptionRequest;
import org.junit.jupiter.api.Test;

class JobRepositoryTest {

  private final JobRepository repository = new JobRepository(10, 5);

  @Test
  void save_shouldMakeJobFindable() {
    CaptioningJob job =
        new CaptioningJob("job-1", new StoredCaptionRequest("archive", "a.json", 1000, null));

    repository.save(job);

    assertThat(repository.findById("job-1")).containsSame(job);
    assertThat(job.getStatus()).isEqualTo(Status.PENDING);
    assertThat(job.getProgress()).isZero();
    assertThat(job.getRequest().save()).isTrue();
  }

  @Test
  void delete_shouldRemoveJob() {
    repository.save(
        new CaptioningJob("job-2", new StoredCaptionRequest("archive", "b.json", 1000, false)));

    repository.delete("job-2");

    assertThat(repository.findById("job-2")).isEmpty();
    assertThat(repository.findById("never-created")).isEmpty();
  }
}
