package com.gentoro.jobcontrol.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base unchecked exception of the job control core. Carries an error code and an optional
 * key/value context that ends up in logs and in {@link ErrorDetails}.
 */
public class JobControlException extends RuntimeException {
  private final JobControlErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public JobControlException(JobControlErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public JobControlException(JobControlErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public JobControlErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /** Attach a context entry; returns {@code this} for chaining at the throw site. */
  public JobControlException withContext(String key, Object value) {
    context.put(key, value);
    return this;
  }
}
