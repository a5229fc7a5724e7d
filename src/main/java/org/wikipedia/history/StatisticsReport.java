package org.wikipedia.history;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The results of the statistics queries in execution order.
 */
final class StatisticsReport {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
          .configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false)
          .enable(SerializationFeature.INDENT_OUTPUT)
          .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

  private final List<Entry> entries = new ArrayList<>();

  void add(String description, Timed<?> result) {
    entries.add(new Entry(result.getLabel(), description, result.getDuration().toMillis(), result.getValue()));
  }

  List<Entry> getEntries() {
    return Collections.unmodifiableList(entries);
  }

  Optional<Entry> getEntry(String label) {
    return entries.stream().filter(entry -> entry.getLabel().equals(label)).findFirst();
  }

  void write(Writer writer, ReportFormat format) throws IOException {
    switch (format) {
      case TEXT:
        writeText(writer);
        break;
      case JSON:
        OBJECT_MAPPER.writeValue(writer, entries);
        writer.flush();
        break;
      default:
        throw new IllegalArgumentException("Unsupported report format: " + format);
    }
  }

  private void writeText(Writer writer) throws IOException {
    for (Entry entry : entries) {
      writer.append("********** ").append(entry.getLabel()).append(": ").append(entry.getDescription()).append('\n');
      if (entry.getValue() instanceof Collection) {
        for (Object element : (Collection<?>) entry.getValue()) {
          writer.append(String.valueOf(element)).append('\n');
        }
      } else {
        writer.append(String.valueOf(entry.getValue())).append('\n');
      }
      writer.append("Processing ").append(entry.getLabel()).append(" took ")
              .append(Long.toString(entry.getDurationMillis())).append(" ms.\n");
    }
    writer.flush();
  }

  static final class Entry {
    private final String label;
    private final String description;
    private final long durationMillis;
    private final Object value;

    private Entry(String label, String description, long durationMillis, Object value) {
      this.label = label;
      this.description = description;
      this.durationMillis = durationMillis;
      this.value = value;
    }

    public String getLabel() {
      return label;
    }

    public String getDescription() {
      return description;
    }

    public long getDurationMillis() {
      return durationMillis;
    }

    public Object getValue() {
      return value;
    }
  }
}
