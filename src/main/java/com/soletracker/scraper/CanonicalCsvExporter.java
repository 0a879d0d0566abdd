package com.soletracker.scraper;

import com.opencsv.CSVWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Exports the canonical records of a namespace to {@code <dir>/<namespace>.csv} using OpenCSV.
 * <p>
 * Columns follow {@link CanonicalFieldRegistry} order after the id; unregistered fields are not exported.
 * List fields, provenance and contributing sources are written as JSON, dates in ISO-8601.
 *
 * @author Sole Tracker Ingest Team
 * @since 1.0
 */
public class CanonicalCsvExporter {
    private static final Logger logger = LoggerFactory.getLogger(CanonicalCsvExporter.class);

    private final Path outputDir;

    public CanonicalCsvExporter(Path outputDir) {
        this.outputDir = outputDir;
    }

    /**
     * Header row: {@code id}, the registered fields, then {@code contributing_sources}, {@code field_provenance} and {@code merged_at}.
     */
    public static List<String> header() {
        List<String> header = new ArrayList<>();
        header.add("id");
        header.addAll(CanonicalFieldRegistry.getFieldNames());
        header.add("contributing_sources");
        header.add("field_provenance");
        header.add("merged_at");
        return header;
    }

    /**
     * Writes all records of a namespace.
     * @param namespace canonical namespace, used as the file name
     * @param records records to export
     * @return path of the written file
     * @throws IOException if the file cannot be written
     */
    public Path export(String namespace, Collection<CanonicalRecord> records) throws IOException {
        if (records == null) {
            throw new IllegalArgumentException("Record list cannot be null");
        }
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("Namespace cannot be null or empty");
        }
        Path file = Utils.ensureDirectory(outputDir).resolve(Utils.sanitizeFilename(namespace) + ".csv");
        List<String> fieldNames = CanonicalFieldRegistry.getFieldNames();
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(out)) {
            writer.writeNext(header().toArray(String[]::new));
            for (CanonicalRecord record : records) {
                List<String> row = new ArrayList<>();
                row.add(record.id());
                for (String field : fieldNames) row.add(cell(record.field(field)));
                row.add(json(new ArrayList<>(record.contributingSources())));
                row.add(json(CanonicalRowMapper.provenanceColumn(record)));
                row.add(record.mergedAt() == null ? "" : record.mergedAt().toString());
                writer.writeNext(row.toArray(String[]::new));
            }
        }
        logger.info("Wrote {} canonical records to CSV file: {}", records.size(), file);
        return file;
    }

    private static String cell(Object value) throws IOException {
        if (value == null) return "";
        if (value instanceof Collection<?>) return json(value);
        return Utils.singleLine(value.toString());
    }

    private static String json(Object value) throws IOException {
        try {
            return CanonicalRecordCodec.toJson(value);
        } catch (StoreException e) {
            throw new IOException(e.getMessage(), e);
        }
    }
}
