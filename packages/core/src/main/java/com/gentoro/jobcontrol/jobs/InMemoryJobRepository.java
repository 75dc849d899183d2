package com.gentoro.jobcontrol.jobs;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Simple in-memory JobRepository implementation. */
public final class InMemoryJobRepository implements JobRepository {
  private final Map<String, JobRecord> map = new ConcurrentHashMap<>();

  @Override
  public void create(JobRecord record) {
    map.put(record.id(), record);
  }

  @Override
  public void updateStatus(String id, JobStatus status, String message) {
    map.computeIfPresent(id, (key, current) -> current.withStatus(status, message));
  }

  @Override
  public Optional<JobRecord> get(String id) {
    return Optional.ofNullable(map.get(id));
  }

  @Override
  public List<JobRecord> list() {
    return map.values().stream().sorted(Comparator.comparing(JobRecord::createdAt)).toList();
  }
}
