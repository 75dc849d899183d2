package com.gentoro.jobcontrol.exception;

/** Invalid or unreadable configuration. */
public class ConfigurationException extends JobControlException {
  public ConfigurationException(String message) {
    super(JobControlErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(JobControlErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
