package io.agenthive.model;

final class ModelGuards {

  private ModelGuards() {
  }

  static String requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(field + " must not be null or blank");
    }
    return value;
  }

  static String emptyIfNull(String value) {
    return value == null ? "" : value;
  }
}
