package org.wikipedia.history;

import java.util.Locale;

public enum ReportFormat {
  TEXT,
  JSON;

  static ReportFormat fromName(String name) {
    return valueOf(name.toUpperCase(Locale.ROOT));
  }
}
