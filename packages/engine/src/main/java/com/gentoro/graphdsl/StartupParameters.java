package com.gentoro.graphdsl;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/** Command line parameters of {@link GraphDslApp}, given as {@code --name value} pairs. */
public class StartupParameters {

  final Map<String, String> parameters = new HashMap<>();

  {
    parameters.put("config-file", ConfigurationProvider.DEFAULT_LOCATION);
  }

  public StartupParameters(String[] arguments) {
    this.parameters.putAll(parseArguments(arguments));
    this.validate();
  }

  private Map<String, String> parseArguments(String[] arguments) {
    Map<String, String> result = new HashMap<>();
    for (int p = 0; p < arguments.length; p++) {
      if (!arguments[p].startsWith("--")) {
        throw new IllegalArgumentException("Unexpected argument: " + arguments[p]);
      }
      String paramName = arguments[p].substring(2);
      String paramValue = "true";
      if (p < arguments.length - 1) {
        String next = arguments[p + 1];
        if (!next.startsWith("--")) {
          paramValue = next;
          p++;
        }
      }
      result.put(paramName, paramValue);
    }
    return result;
  }

  private void validate() {
    if (isHelp()) {
      return;
    }
    if (!parameters.containsKey("dsl")) {
      throw new IllegalArgumentException("Missing required parameter --dsl <file>");
    }
    if (!parameters.containsKey("tree")) {
      throw new IllegalArgumentException("Missing required parameter --tree <file.json>");
    }
    if (parameters.containsKey("format")) {
      OutputFormat.parse(parameters.get("format"));
    }
    if (parameters.get("config-file") == null || parameters.get("config-file").isBlank()) {
      throw new IllegalArgumentException("Missing config file location");
    }
  }

  public boolean isHelp() {
    return parameters.containsKey("help");
  }

  /**
   * Returns the configuration location string. Examples: "classpath:application.yaml",
   * "/etc/graphdsl.yaml", "config/local.yaml".
   */
  public String configFile() {
    return getOptionalParameter("config-file").orElse(ConfigurationProvider.DEFAULT_LOCATION);
  }

  public String getParameter(String name) {
    return parameters.get(name);
  }

  public Optional<String> getOptionalParameter(String name) {
    return Optional.ofNullable(parameters.get(name));
  }

  public boolean isParameterPresent(String name) {
    return parameters.containsKey(name);
  }

  public static String usage() {
    return "Usage: graph-dsl --dsl <file> --tree <file.json> [--globals <file.json>]"
        + " [--format json|text] [--output <file>] [--config-file <location>]";
  }
}
