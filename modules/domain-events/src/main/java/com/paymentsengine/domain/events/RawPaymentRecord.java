package com.paymentsengine.domain.events;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One input row before validation: field name to raw cell text, exactly as the reader saw it.
 * Absent cells are absent from the map, empty cells map to an empty string.
 */
public record RawPaymentRecord(long lineNumber, Map<String, String> fields) {
  public RawPaymentRecord {
    Objects.requireNonNull(fields, "fields must not be null");
    fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }

  public Optional<String> field(String name) {
    return Optional.ofNullable(fields.get(name));
  }
}
