package com.gentoro.jobcontrol;

import com.gentoro.jobcontrol.exception.ValidationException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;

/**
 * Command line arguments in {@code --name value} form. A name not followed by a value is stored
 * as the flag value {@code "true"}.
 */
public class StartupParameters {
  private static final String PREFIX = "--";

  private final Map<String, String> parameters = new LinkedHashMap<>();

  public StartupParameters(String[] args) {
    if (args == null) return;
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (!arg.startsWith(PREFIX) || arg.length() == PREFIX.length()) {
        throw new ValidationException("Unexpected startup argument: " + arg);
      }
      String name = arg.substring(PREFIX.length());
      String value = "true";
      int eq = name.indexOf('=');
      if (eq > 0) {
        value = name.substring(eq + 1);
        name = name.substring(0, eq);
      } else if (i + 1 < args.length && !args[i + 1].startsWith(PREFIX)) {
        value = args[++i];
      }
      parameters.put(name, value);
    }
  }

  public boolean hasParameter(String name) {
    return parameters.containsKey(name);
  }

  /** Returns the parameter converted to {@code type}, or {@code null} when it is absent. */
  public <T> T getParameter(String name, Class<T> type) {
    String raw = parameters.get(name);
    if (raw == null) return null;
    try {
      if (type == String.class) return type.cast(raw);
      if (type == Integer.class) return type.cast(Integer.valueOf(raw.trim()));
      if (type == Long.class) return type.cast(Long.valueOf(raw.trim()));
      if (type == Boolean.class) return type.cast(Boolean.valueOf(raw.trim()));
      if (type == Path.class) return type.cast(Path.of(raw));
    } catch (RuntimeException e) {
      throw new ValidationException(
          "Startup parameter '%s' is not a valid %s: %s".formatted(name, type.getSimpleName(), raw),
          e);
    }
    throw new ValidationException("Unsupported parameter type: " + type.getName());
  }

  /** External YAML configuration passed with {@code --config-file}, if any. */
  public Path configFile() {
    String raw = getParameter("config-file", String.class);
    return StringUtils.isBlank(raw) ? null : Path.of(raw.trim());
  }

  public Map<String, String> asMap() {
    return Collections.unmodifiableMap(parameters);
  }
}
