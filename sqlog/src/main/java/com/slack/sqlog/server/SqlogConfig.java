package com.slack.sqlog.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.annotations.VisibleForTesting;
import com.slack.sqlog.config.SqlogConfigs;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.text.StringSubstitutor;
import org.apache.commons.text.lookup.StringLookup;

/**
 * Loads and holds the process configuration. Files may be YAML or JSON; {@code ${VAR}} references
 * are substituted from the environment before parsing.
 */
public class SqlogConfig {

  private static final ObjectMapper JSON_READER =
      new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private static SqlogConfig _instance = null;

  @VisibleForTesting
  static SqlogConfigs.SqlogConfig fromJsonConfig(String jsonStr) throws JsonProcessingException {
    SqlogConfigs.SqlogConfig config =
        JSON_READER.readValue(jsonStr, SqlogConfigs.SqlogConfig.class);
    if (config == null) {
      throw new IllegalArgumentException("Config is empty");
    }
    ValidateSqlogConfig.validateConfig(config);
    return config;
  }

  @VisibleForTesting
  public static SqlogConfigs.SqlogConfig fromYamlConfig(String yamlStr)
      throws JsonProcessingException {
    return fromYamlConfig(yamlStr, System::getenv);
  }

  @VisibleForTesting
  public static SqlogConfigs.SqlogConfig fromYamlConfig(
      String yamlStr, StringLookup variableResolver) throws JsonProcessingException {
    StringSubstitutor substitute = new StringSubstitutor(variableResolver);
    ObjectMapper yamlReader = new ObjectMapper(new YAMLFactory());
    ObjectMapper jsonWriter = new ObjectMapper();

    Object obj = yamlReader.readValue(substitute.replace(yamlStr), Object.class);
    return fromJsonConfig(jsonWriter.writeValueAsString(obj));
  }

  @VisibleForTesting
  static void reset() {
    _instance = null;
  }

  public static void initFromFile(Path cfgFilePath) throws IOException {
    if (_instance == null) {
      if (Files.notExists(cfgFilePath)) {
        throw new IllegalArgumentException(
            "Missing config file at: " + cfgFilePath.toAbsolutePath());
      }

      String filename = cfgFilePath.getFileName().toString();
      if (filename.endsWith(".yaml") || filename.endsWith(".yml")) {
        _instance = new SqlogConfig(fromYamlConfig(Files.readString(cfgFilePath)));
      } else if (filename.endsWith(".json")) {
        _instance = new SqlogConfig(fromJsonConfig(Files.readString(cfgFilePath)));
      } else {
        throw new IllegalArgumentException(
            "Invalid config file format provided - must be either .json or .yaml");
      }
    }
  }

  public static SqlogConfigs.SqlogConfig get() {
    if (_instance == null) {
      throw new IllegalStateException("SqlogConfig not initialized");
    }
    return _instance.config;
  }

  private final SqlogConfigs.SqlogConfig config;

  private SqlogConfig(SqlogConfigs.SqlogConfig config) {
    this.config = config;
  }
}
