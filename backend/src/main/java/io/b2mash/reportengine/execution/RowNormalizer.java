package io.b2mash.reportengine.execution;

import io.b2mash.reportengine.catalog.StandardFields;
import io.b2mash.reportengine.compiler.FieldBinding;
import io.b2mash.reportengine.compiler.LdapSyntax;
import io.b2mash.reportengine.source.SourceKind;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Converts backend records into rows keyed by catalog field name with values typed by the field's
 * semantic type: {@code String}, {@code Long}, {@code Boolean}, {@code Instant} or a {@code List}
 * of strings. Unreadable or unparseable attributes become {@code null} plus a row warning.
 */
public class RowNormalizer {

  private static final Pattern DIGITS = Pattern.compile("-?\\d+");
  private static final Pattern GENERALIZED_TIME = Pattern.compile("\\d{14}(\\.\\d+)?Z");

  public record NormalizedRow(Map<String, Object> values, List<ExecutionWarning> warnings) {}

  public NormalizedRow normalize(
      RawRecord record, List<FieldBinding> bindings, SourceKind source, int rowIndex) {
    var values = new LinkedHashMap<String, Object>();
    var warnings = new ArrayList<ExecutionWarning>();
    for (var binding : bindings) {
      var error = record.attributeErrors().get(binding.nativeName());
      if (error != null) {
        values.put(binding.name(), null);
        warnings.add(
            new ExecutionWarning(
                ExecutionWarning.ATTRIBUTE_UNREADABLE,
                rowIndex,
                binding.name(),
                "Attribute '" + binding.nativeName() + "' could not be read: " + error));
        continue;
      }
      var raw = lookup(record.attributes(), binding.nativeName());
      try {
        values.put(binding.name(), convert(binding, raw, source));
      } catch (IllegalArgumentException | DateTimeParseException e) {
        values.put(binding.name(), null);
        warnings.add(
            new ExecutionWarning(
                ExecutionWarning.VALUE_UNPARSEABLE,
                rowIndex,
                binding.name(),
                "Value '"
                    + raw
                    + "' of '"
                    + binding.nativeName()
                    + "' is not a valid "
                    + binding.semanticType().name().toLowerCase()));
      }
    }
    return new NormalizedRow(Collections.unmodifiableMap(values), warnings);
  }

  /** Supports slash paths into nested objects, e.g. {@code signInActivity/lastSignInDateTime}. */
  private static Object lookup(Map<String, Object> attributes, String nativeName) {
    if (attributes.containsKey(nativeName) || !nativeName.contains("/")) {
      return attributes.get(nativeName);
    }
    Object current = attributes;
    for (var segment : nativeName.split("/")) {
      if (!(current instanceof Map<?, ?> map)) {
        return null;
      }
      current = map.get(segment);
    }
    return current;
  }

  private Object convert(FieldBinding binding, Object raw, SourceKind source) {
    if (raw == null) {
      return null;
    }
    if (source == SourceKind.DIRECTORY
        && StandardFields.DIRECTORY_ENABLED.equals(binding.name())) {
      var flags = toLong(single(raw));
      return flags == null ? null : (flags & LdapSyntax.ACCOUNT_DISABLE_FLAG) == 0;
    }
    return switch (binding.semanticType()) {
      case STRING, REFERENCE -> text(single(raw));
      case INTEGER -> toLong(single(raw));
      case BOOLEAN -> toBoolean(single(raw));
      case DATETIME -> toInstant(single(raw), binding.nativeName());
      case ARRAY -> toList(raw);
    };
  }

  private static Object single(Object raw) {
    if (raw instanceof Collection<?> items) {
      return items.isEmpty() ? null : items.iterator().next();
    }
    return raw;
  }

  private static String text(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof byte[] bytes) {
      return HexFormat.of().formatHex(bytes);
    }
    return value.toString();
  }

  private static Long toLong(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Number number) {
      return number.longValue();
    }
    var text = value.toString().trim();
    if (text.isEmpty()) {
      return null;
    }
    try {
      return Long.parseLong(text);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("not an integer: " + text, e);
    }
  }

  private static Boolean toBoolean(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Boolean bool) {
      return bool;
    }
    var text = value.toString().trim();
    if (text.isEmpty()) {
      return null;
    }
    return switch (text.toLowerCase()) {
      case "true", "yes", "1" -> true;
      case "false", "no", "0" -> false;
      default -> throw new IllegalArgumentException("not a boolean: " + text);
    };
  }

  private static Instant toInstant(Object value, String nativeName) {
    if (value == null) {
      return null;
    }
    if (value instanceof Instant instant) {
      return instant;
    }
    if (value instanceof Number number) {
      return LdapSyntax.fromFileTime(number.longValue());
    }
    var text = value.toString().trim();
    if (text.isEmpty()) {
      return null;
    }
    if (DIGITS.matcher(text).matches()) {
      if (!LdapSyntax.isFileTimeAttribute(nativeName) && text.length() != 18) {
        throw new IllegalArgumentException("not a timestamp: " + text);
      }
      return LdapSyntax.fromFileTime(Long.parseLong(text));
    }
    if (GENERALIZED_TIME.matcher(text).matches()) {
      return LdapSyntax.parseGeneralizedTime(text);
    }
    if (text.length() == 10) {
      return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
    }
    if (text.endsWith("Z")) {
      return Instant.parse(text);
    }
    if (text.contains("+") || text.lastIndexOf('-') > 9) {
      return OffsetDateTime.parse(text).toInstant();
    }
    return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
  }

  private static List<String> toList(Object raw) {
    var items = new ArrayList<String>();
    if (raw instanceof Collection<?> values) {
      for (var v : values) {
        if (v != null) {
          items.add(text(v));
        }
      }
    } else if (!raw.toString().isEmpty()) {
      items.add(text(raw));
    }
    return List.copyOf(items);
  }
}
