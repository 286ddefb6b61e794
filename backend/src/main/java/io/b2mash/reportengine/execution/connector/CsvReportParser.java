package io.b2mash.reportengine.execution.connector;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Minimal RFC 4180 reader for usage report downloads. */
final class CsvReportParser {

  private CsvReportParser() {}

  /** Parses a report into rows keyed by header name. Blank lines are skipped. */
  static List<Map<String, String>> parse(String csv) {
    var lines = records(csv);
    if (lines.isEmpty()) {
      return List.of();
    }
    var header = lines.get(0);
    var rows = new ArrayList<Map<String, String>>(lines.size() - 1);
    for (int i = 1; i < lines.size(); i++) {
      var values = lines.get(i);
      var row = new LinkedHashMap<String, String>();
      for (int c = 0; c < header.size(); c++) {
        row.put(header.get(c), c < values.size() ? values.get(c) : null);
      }
      rows.add(row);
    }
    return rows;
  }

  static List<String> header(String csv) {
    var lines = records(csv);
    return lines.isEmpty() ? List.of() : lines.get(0);
  }

  private static List<List<String>> records(String csv) {
    var text = csv.startsWith("\uFEFF") ? csv.substring(1) : csv;
    var records = new ArrayList<List<String>>();
    var fields = new ArrayList<String>();
    var field = new StringBuilder();
    boolean quoted = false;
    boolean fieldStarted = false;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (quoted) {
        if (c == '"' && i + 1 < text.length() && text.charAt(i + 1) == '"') {
          field.append('"');
          i++;
        } else if (c == '"') {
          quoted = false;
        } else {
          field.append(c);
        }
        continue;
      }
      switch (c) {
        case '"' -> {
          quoted = true;
          fieldStarted = true;
        }
        case ',' -> {
          fields.add(field.toString());
          field.setLength(0);
          fieldStarted = true;
        }
        case '\r' -> {}
        case '\n' -> {
          endRecord(records, fields, field, fieldStarted);
          fields = new ArrayList<>();
          field.setLength(0);
          fieldStarted = false;
        }
        default -> {
          field.append(c);
          fieldStarted = true;
        }
      }
    }
    endRecord(records, fields, field, fieldStarted);
    return records;
  }

  private static void endRecord(
      List<List<String>> records, List<String> fields, StringBuilder field, boolean started) {
    if (!started && fields.isEmpty()) {
      return;
    }
    fields.add(field.toString());
    records.add(List.copyOf(fields));
  }
}
