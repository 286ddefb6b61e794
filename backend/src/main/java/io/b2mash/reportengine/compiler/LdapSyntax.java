package io.b2mash.reportengine.compiler;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.util.Set;

/** Value encodings of the directory backend. */
public final class LdapSyntax {

  /** 100ns intervals between 1601-01-01 and 1970-01-01. */
  public static final long FILETIME_EPOCH_OFFSET = 116_444_736_000_000_000L;

  /** Matching rule for "any of these bits set" on userAccountControl. */
  public static final String BITWISE_AND_RULE = "1.2.840.113556.1.4.803";

  public static final int ACCOUNT_DISABLE_FLAG = 2;

  /** Attributes stored as Windows file time integers rather than generalized time strings. */
  public static final Set<String> FILETIME_ATTRIBUTES =
      Set.of(
          "lastlogontimestamp",
          "lastlogon",
          "pwdlastset",
          "accountexpires",
          "lockouttime",
          "badpasswordtime");

  private static final DateTimeFormatter GENERALIZED_TIME_OUT =
      DateTimeFormatter.ofPattern("yyyyMMddHHmmss'.0Z'").withZone(ZoneOffset.UTC);

  private static final DateTimeFormatter GENERALIZED_TIME_IN =
      new DateTimeFormatterBuilder()
          .appendPattern("yyyyMMddHHmmss")
          .optionalStart()
          .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
          .optionalEnd()
          .appendLiteral('Z')
          .toFormatter()
          .withZone(ZoneOffset.UTC);

  private LdapSyntax() {}

  /** Escapes a value for use inside a search filter (RFC 4515). */
  public static String escapeFilterValue(String value) {
    var sb = new StringBuilder(value.length());
    for (char c : value.toCharArray()) {
      switch (c) {
        case '\\' -> sb.append("\\5c");
        case '*' -> sb.append("\\2a");
        case '(' -> sb.append("\\28");
        case ')' -> sb.append("\\29");
        case '\0' -> sb.append("\\00");
        default -> sb.append(c);
      }
    }
    return sb.toString();
  }

  public static boolean isFileTimeAttribute(String attribute) {
    return FILETIME_ATTRIBUTES.contains(attribute.toLowerCase());
  }

  public static long toFileTime(Instant instant) {
    long hundredNanos = instant.getEpochSecond() * 10_000_000L + instant.getNano() / 100;
    return hundredNanos + FILETIME_EPOCH_OFFSET;
  }

  /** Returns {@code null} for 0 and the "never" sentinel, which the backend uses for unset. */
  public static Instant fromFileTime(long fileTime) {
    if (fileTime <= 0 || fileTime == Long.MAX_VALUE) {
      return null;
    }
    long unixHundredNanos = fileTime - FILETIME_EPOCH_OFFSET;
    return Instant.ofEpochSecond(
        Math.floorDiv(unixHundredNanos, 10_000_000L),
        Math.floorMod(unixHundredNanos, 10_000_000L) * 100);
  }

  public static String toGeneralizedTime(Instant instant) {
    return GENERALIZED_TIME_OUT.format(instant);
  }

  public static Instant parseGeneralizedTime(String value) {
    return Instant.from(GENERALIZED_TIME_IN.parse(value));
  }
}
