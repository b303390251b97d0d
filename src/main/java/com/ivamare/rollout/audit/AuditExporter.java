package com.ivamare.rollout.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ivamare.rollout.exception.RolloutException;
import com.ivamare.rollout.model.AuditEvent;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders audit events as JSON, CSV or a fixed-width text table.
 */
public class AuditExporter {

    private static final List<String> COLUMNS = List.of(
        "audit_id", "correlation_id", "event_type", "actor", "timestamp", "payload");

    private static final int MAX_TABLE_PAYLOAD = 80;

    private final ObjectMapper objectMapper;
    private final CsvMapper csvMapper = new CsvMapper();

    public AuditExporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Export events.
     *
     * @param events Events in the order they should appear
     * @param format Output format
     * @return The rendered export
     */
    public String export(List<AuditEvent> events, AuditExportFormat format) {
        return switch (format) {
            case JSON -> toJson(events);
            case CSV -> toCsv(events);
            case TABLE -> toTable(events);
        };
    }

    private String toJson(List<AuditEvent> events) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (AuditEvent event : events) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("audit_id", event.auditId());
            row.put("correlation_id", event.correlationId());
            row.put("event_type", event.eventType());
            row.put("actor", event.actor());
            row.put("timestamp", event.timestamp().toString());
            row.put("payload", event.payload());
            rows.add(row);
        }
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new RolloutException("Failed to export audit events as JSON", e);
        }
    }

    private String toCsv(List<AuditEvent> events) {
        CsvSchema.Builder schema = CsvSchema.builder();
        COLUMNS.forEach(schema::addColumn);
        List<Map<String, Object>> rows = new ArrayList<>();
        for (AuditEvent event : events) {
            rows.add(flatRow(event));
        }
        StringWriter out = new StringWriter();
        try (SequenceWriter writer = csvMapper.writer(schema.build().withHeader()).writeValues(out)) {
            writer.writeAll(rows);
        } catch (IOException e) {
            throw new RolloutException("Failed to export audit events as CSV", e);
        }
        return out.toString();
    }

    private String toTable(List<AuditEvent> events) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (AuditEvent event : events) {
            Map<String, Object> row = flatRow(event);
            String payload = (String) row.get("payload");
            if (payload.length() > MAX_TABLE_PAYLOAD) {
                row.put("payload", payload.substring(0, MAX_TABLE_PAYLOAD - 3) + "...");
            }
            rows.add(row);
        }

        int[] widths = new int[COLUMNS.size()];
        for (int i = 0; i < COLUMNS.size(); i++) {
            widths[i] = COLUMNS.get(i).length();
            for (Map<String, Object> row : rows) {
                widths[i] = Math.max(widths[i], String.valueOf(row.get(COLUMNS.get(i))).length());
            }
        }

        StringBuilder out = new StringBuilder();
        appendLine(out, widths, new ArrayList<>(COLUMNS));
        List<String> rule = new ArrayList<>();
        for (int width : widths) {
            rule.add("-".repeat(width));
        }
        appendLine(out, widths, rule);
        for (Map<String, Object> row : rows) {
            List<String> cells = new ArrayList<>();
            for (String column : COLUMNS) {
                cells.add(String.valueOf(row.get(column)));
            }
            appendLine(out, widths, cells);
        }
        return out.toString();
    }

    private Map<String, Object> flatRow(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("audit_id", event.auditId());
        row.put("correlation_id", event.correlationId());
        row.put("event_type", event.eventType());
        row.put("actor", event.actor() != null ? event.actor() : "");
        row.put("timestamp", event.timestamp().toString());
        try {
            row.put("payload", objectMapper.writeValueAsString(event.payload()));
        } catch (JsonProcessingException e) {
            throw new RolloutException("Failed to serialize audit payload", e);
        }
        return row;
    }

    private static void appendLine(StringBuilder out, int[] widths, List<String> cells) {
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) {
                out.append(" | ");
            }
            String cell = cells.get(i);
            out.append(cell);
            if (i < cells.size() - 1) {
                out.append(" ".repeat(widths[i] - cell.length()));
            }
        }
        out.append('\n');
    }
}
