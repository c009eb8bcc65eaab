package io.taskvault.tasks;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import io.taskvault.error.ValidationException;
import io.taskvault.model.TaskDraft;

import java.io.IOException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns CSV or pipe-delimited text into task drafts.
 *
 * <p>CSV needs a header row; recognized columns are {@code title}, {@code description},
 * {@code project}, {@code duration} and {@code due_date}, others are ignored. Text files hold one
 * task per line as {@code Title | Description | Project | Duration | Due Date}; blank lines and
 * lines starting with {@code #} are skipped. Dates are ISO ({@code 2024-05-01}) or US style
 * ({@code 5/1/2024}).
 */
public final class TaskImporter {
    private static final DateTimeFormatter US_DATE = DateTimeFormatter.ofPattern("M/d/uuuu", Locale.ROOT);
    private static final CsvMapper CSV = new CsvMapper();

    public enum Format {
        CSV,
        TXT;

        public static Format fromFileName(String fileName) {
            String lower = fileName == null ? "" : fileName.toLowerCase(Locale.ROOT);
            if (lower.endsWith(".csv")) {
                return CSV;
            }
            if (lower.endsWith(".txt")) {
                return TXT;
            }
            throw new ValidationException("file", "unsupported format, use .csv or .txt");
        }

        public static Format fromString(String raw) {
            for (Format value : values()) {
                if (value.name().equalsIgnoreCase(raw)) {
                    return value;
                }
            }
            throw new ValidationException("format", "must be csv or txt");
        }
    }

    public Parsed parse(Format format, String content) {
        String text = content == null ? "" : content;
        return format == Format.CSV ? parseCsv(text) : parseText(text);
    }

    Parsed parseCsv(String content) {
        List<TaskDraft> drafts = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<Map<String, String>> rows = CSV.readerForMapOf(String.class)
                .with(schema)
                .with(CsvParser.Feature.TRIM_SPACES)
                .readValues(content)) {
            int row = 1;
            while (rows.hasNextValue()) {
                row++;
                Map<String, String> values = rows.nextValue();
                String title = value(values, "title");
                if (title.isEmpty()) {
                    errors.add("Row " + row + ": Title is required");
                    continue;
                }
                String rawDuration = value(values, "duration");
                Integer duration = null;
                if (!rawDuration.isEmpty()) {
                    try {
                        duration = Integer.parseInt(rawDuration);
                    } catch (NumberFormatException e) {
                        errors.add("Row " + row + ": Invalid duration '" + rawDuration + "', using default");
                    }
                }
                String rawDate = value(values, "due_date");
                LocalDate due = null;
                if (!rawDate.isEmpty()) {
                    due = parseDate(rawDate);
                    if (due == null) {
                        errors.add("Row " + row + ": Invalid date format for '" + rawDate + "'");
                    }
                }
                drafts.add(new TaskDraft(title, value(values, "description"), value(values, "project"), due, duration));
            }
        } catch (IOException | RuntimeException e) {
            errors.add("CSV parsing error: " + e.getMessage());
        }
        return new Parsed(drafts, errors);
    }

    Parsed parseText(String content) {
        List<TaskDraft> drafts = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        String[] lines = content.split("\\R");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].strip();
            int lineNo = i + 1;
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            String[] parts = line.split("\\|", -1);
            String title = part(parts, 0);
            if (title.isEmpty()) {
                errors.add("Line " + lineNo + ": Title is required");
                continue;
            }
            Integer duration = null;
            String rawDuration = part(parts, 3);
            if (!rawDuration.isEmpty()) {
                try {
                    duration = Integer.parseInt(rawDuration);
                } catch (NumberFormatException e) {
                    errors.add("Line " + lineNo + ": Invalid duration '" + rawDuration + "'");
                }
            }
            LocalDate due = null;
            String rawDate = part(parts, 4);
            if (!rawDate.isEmpty()) {
                due = parseDate(rawDate);
                if (due == null) {
                    errors.add("Line " + lineNo + ": Invalid date format '" + rawDate + "'");
                }
            }
            drafts.add(new TaskDraft(title, part(parts, 1), part(parts, 2), due, duration));
        }
        return new Parsed(drafts, errors);
    }

    static LocalDate parseDate(String raw) {
        try {
            return LocalDate.parse(raw);
        } catch (DateTimeParseException ignored) {
            // fall through to the US layout
        }
        try {
            return LocalDate.parse(raw, US_DATE);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String value(Map<String, String> row, String column) {
        for (Map.Entry<String, String> entry : row.entrySet()) {
            if (entry.getKey() != null && entry.getKey().strip().equalsIgnoreCase(column)) {
                return entry.getValue() == null ? "" : entry.getValue().strip();
            }
        }
        return "";
    }

    private static String part(String[] parts, int index) {
        return index < parts.length ? parts[index].strip() : "";
    }

    /**
     * Drafts read from the input plus one message per line or row that was skipped or adjusted.
     */
    public record Parsed(List<TaskDraft> drafts, List<String> errors) {
        public Parsed {
            drafts = List.copyOf(drafts);
            errors = List.copyOf(errors);
        }
    }
}
