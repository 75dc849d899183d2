package com.gentoro.jobcontrol;

import com.gentoro.jobcontrol.exception.ConfigurationException;
import com.gentoro.jobcontrol.logging.LoggingService;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.slf4j.Logger;

/**
 * Loads the application configuration: bundled {@code application.yaml} defaults, optionally
 * overridden by an external YAML file.
 */
public class ConfigurationProvider {
  private static final Logger log = LoggingService.getLogger(ConfigurationProvider.class);

  static final String DEFAULTS_RESOURCE = "/application.yaml";

  private final Configuration config;

  public ConfigurationProvider(Path overrideFile) {
    CompositeConfiguration composite = new CompositeConfiguration();
    if (overrideFile != null) {
      composite.addConfiguration(loadFile(overrideFile));
      log.info("Loaded configuration overrides from {}", overrideFile.toAbsolutePath());
    }
    composite.addConfiguration(loadDefaults());
    this.config = composite;
  }

  public Configuration config() {
    return config;
  }

  private static YAMLConfiguration loadDefaults() {
    YAMLConfiguration yaml = new YAMLConfiguration();
    try (InputStream in = ConfigurationProvider.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
      if (in == null) {
        log.warn("No {} found on the classpath, using built-in defaults", DEFAULTS_RESOURCE);
        return yaml;
      }
      yaml.read(new InputStreamReader(in, StandardCharsets.UTF_8));
      return yaml;
    } catch (IOException | org.apache.commons.configuration2.ex.ConfigurationException e) {
      throw new ConfigurationException("Failed to read bundled " + DEFAULTS_RESOURCE, e);
    }
  }

  private static YAMLConfiguration loadFile(Path file) {
    if (!Files.isRegularFile(file)) {
      throw new ConfigurationException("Configuration file does not exist: " + file);
    }
    YAMLConfiguration yaml = new YAMLConfiguration();
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      yaml.read(reader);
      return yaml;
    } catch (IOException | org.apache.commons.configuration2.ex.ConfigurationException e) {
      throw new ConfigurationException("Failed to read configuration file " + file, e);
    }
  }
}
