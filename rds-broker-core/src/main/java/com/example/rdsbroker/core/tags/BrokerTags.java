package com.example.rdsbroker.core.tags;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/** Tag keys the broker writes on the instances and snapshots it manages. */
public final class BrokerTags {

  public static final String BROKER_NAME = "Broker Name";
  public static final String SPACE_ID = "Space ID";
  public static final String ORGANIZATION_ID = "Organization ID";
  public static final String PLAN_ID = "Plan ID";
  public static final String SERVICE_ID = "Service ID";
  public static final String SKIP_FINAL_SNAPSHOT = "SkipFinalSnapshot";
  public static final String EXTENSIONS = "Extensions";

  private static final String LIST_SEPARATOR = ":";

  private BrokerTags() {}

  /** Joins extension names into the single value stored under {@link #EXTENSIONS}. */
  public static String joinList(final List<String> values) {
    return String.join(LIST_SEPARATOR, values);
  }

  /** Splits an {@link #EXTENSIONS} value; blank input yields an empty list. */
  public static List<String> splitList(final String value) {
    if (value == null || value.isBlank()) return List.of();
    return Arrays.stream(value.split(LIST_SEPARATOR)).filter(s -> !s.isBlank()).toList();
  }

  /** Converts an ordered tag list to a map, last value winning for duplicate keys. */
  public static Map<String, String> toMap(final List<Tag> tags) {
    return tags.stream()
        .collect(Collectors.toMap(Tag::key, Tag::value, (first, second) -> second, LinkedHashMap::new));
  }
}
