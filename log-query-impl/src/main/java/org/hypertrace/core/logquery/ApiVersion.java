package org.hypertrace.core.logquery;

import java.util.Locale;

/** Version of the HTTP API a request came through, deciding the JSON shape of some answers. */
public enum ApiVersion {
  LEGACY(0),
  V1(1);

  private static final String V1_PATH_FRAGMENT = "/loki/api/v1";

  private final int value;

  ApiVersion(int value) {
    this.value = value;
  }

  public int getValue() {
    return value;
  }

  public static ApiVersion fromPath(String path) {
    return path != null && path.toLowerCase(Locale.ROOT).contains(V1_PATH_FRAGMENT) ? V1 : LEGACY;
  }

  public static ApiVersion fromValue(int value) {
    return value == V1.value ? V1 : LEGACY;
  }
}
