package com.gentoro.jobcontrol.jobs;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class InMemoryJobRepositoryTest {

  @Test
  void tracksStatusTransitionsAndTimestamps() {
    InMemoryJobRepository repository = new InMemoryJobRepository();
    repository.create(JobRecord.queued("a", "Job A"));

    JobRecord queued = repository.get("a").orElseThrow();
    assertEquals(JobStatus.QUEUED, queued.status());
    assertNull(queued.startedAt());

    repository.updateStatus("a", JobStatus.RUNNING, null);
    JobRecord running = repository.get("a").orElseThrow();
    assertNotNull(running.startedAt());
    assertNull(running.finishedAt());

    repository.updateStatus("a", JobStatus.COMPLETED, "all good");
    JobRecord done = repository.get("a").orElseThrow();
    assertEquals(JobStatus.COMPLETED, done.status());
    assertEquals("all good", done.message());
    assertEquals(running.startedAt(), done.startedAt());
    assertNotNull(done.finishedAt());
    assertEquals("Job A", done.name());
  }

  @Test
  void ignoresUpdatesForUnknownIds() {
    InMemoryJobRepository repository = new InMemoryJobRepository();
    repository.updateStatus("ghost", JobStatus.FAILED, "nope");
    assertTrue(repository.get("ghost").isEmpty());
    assertEquals(List.of(), repository.list());
  }

  @Test
  void listsRecords() {
    InMemoryJobRepository repository = new InMemoryJobRepository();
    repository.create(JobRecord.queued("a", "a"));
    repository.create(JobRecord.queued("b", "b"));
    assertEquals(2, repository.list().size());
  }
}
