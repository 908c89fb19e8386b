package com.leadharvest.scrape.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.leadharvest.scrape.model.Checkpoint;
import com.leadharvest.scrape.model.ScrapeJobPlan;
import com.leadharvest.scrape.model.ScrapeJobRequest;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class CheckpointJdbcRepositoryTest {

  @Autowired private CheckpointJdbcRepository checkpoints;

  @Autowired private ScrapeJobJdbcRepository jobs;

  @Test
  void missingCheckpointIsEmpty() {
    assertTrue(checkpoints.load(UUID.randomUUID().toString()).isEmpty());
  }

  @Test
  void saveOverwritesPreviousPosition() {
    String jobId = newJob();
    Instant first = Instant.now().minusSeconds(60).truncatedTo(ChronoUnit.MILLIS);
    Instant second = Instant.now().truncatedTo(ChronoUnit.MILLIS);

    checkpoints.save(jobId, new Checkpoint(jobId, 0, 3, 57, 0, first));
    checkpoints.save(jobId, new Checkpoint(jobId, 2, 0, 118, 2, second));

    Checkpoint loaded = checkpoints.load(jobId).orElseThrow();
    assertEquals(2, loaded.currentAreaIndex());
    assertEquals(0, loaded.currentPage());
    assertEquals(118, loaded.leadsFound());
    assertEquals(2, loaded.areasCompleted());
    assertEquals(second, loaded.updatedAt());
  }

  private String newJob() {
    String jobId = UUID.randomUUID().toString();
    jobs.insertJob(
        jobId,
        new ScrapeJobRequest("plombier", "Testland", 0, 3, 50, "client-a", false),
        new ScrapeJobPlan(List.of(), 0, 0, 0, 0.0, false),
        Instant.now());
    return jobId;
  }
}
