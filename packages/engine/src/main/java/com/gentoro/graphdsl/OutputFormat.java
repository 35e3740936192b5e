package com.gentoro.graphdsl;

import org.apache.commons.lang3.EnumUtils;

/** How a finished graph is written. */
public enum OutputFormat {
  JSON,
  TEXT;

  /**
   * @throws IllegalArgumentException for anything but {@code json} or {@code text}
   */
  public static OutputFormat parse(String value) {
    OutputFormat format =
        value == null ? null : EnumUtils.getEnumIgnoreCase(OutputFormat.class, value.trim());
    if (format == null) {
      throw new IllegalArgumentException(
          "Unsupported output format '" + value + "'; expected json or text");
    }
    return format;
  }
}
