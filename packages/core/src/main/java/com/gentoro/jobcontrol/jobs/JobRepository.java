package com.gentoro.jobcontrol.jobs;

import java.util.List;
import java.util.Optional;

/**
 * Durable job history. The manager calls it on admission, start and terminal transitions, always
 * from the controller thread.
 */
public interface JobRepository {
  /** Store a new record, replacing any previous record with the same id. */
  void create(JobRecord record);

  /** Update status and message of an existing record; unknown ids are ignored. */
  void updateStatus(String id, JobStatus status, String message);

  Optional<JobRecord> get(String id);

  List<JobRecord> list();
}
