package com.mlorenc.project.board.service;

import com.mlorenc.project.board.exception.ValidationException;
import com.mlorenc.project.board.model.BulkRow;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads and writes {@code item_id,field_name,value} CSV. Blank lines, {@code #} comments and a
 * leading header row are skipped; unquoted commas past the second column stay in the value.
 */
@Service
public class BulkRowCsvCodec {

    private static final String[] HEADER = {"item_id", "field_name", "value"};
    private static final Set<String> HEADER_FIRST_CELLS = Set.of("item_id", "itemid");

    private static final CSVFormat READ_FORMAT = CSVFormat.DEFAULT.builder()
            .setCommentMarker('#')
            .setIgnoreEmptyLines(true)
            .setIgnoreSurroundingSpaces(true)
            .build();

    private static final CSVFormat WRITE_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader(HEADER)
            .build();

    public List<BulkRow> read(String csv) {
        if (csv == null || csv.isBlank()) {
            return List.of();
        }
        List<BulkRow> rows = new ArrayList<>();
        try (CSVParser parser = READ_FORMAT.parse(new StringReader(csv))) {
            boolean firstRecord = true;
            for (CSVRecord record : parser) {
                if (firstRecord && isHeader(record)) {
                    firstRecord = false;
                    continue;
                }
                firstRecord = false;
                rows.add(toRow(record));
            }
        } catch (IOException | UncheckedIOException | IllegalStateException ex) {
            throw new ValidationException("Malformed bulk update CSV: %s", ex.getMessage());
        }
        return rows;
    }

    public String write(List<BulkRow> rows) {
        StringWriter out = new StringWriter();
        try (CSVPrinter printer = new CSVPrinter(out, WRITE_FORMAT)) {
            for (BulkRow row : rows) {
                printer.printRecord(row.itemId(), row.fieldName(), row.value());
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Could not write bulk update CSV", ex);
        }
        return out.toString();
    }

    private static boolean isHeader(CSVRecord record) {
        return record.size() > 0 && HEADER_FIRST_CELLS.contains(record.get(0).strip().toLowerCase(Locale.ROOT));
    }

    private static BulkRow toRow(CSVRecord record) {
        String itemId = record.size() > 0 ? record.get(0) : "";
        String fieldName = record.size() > 1 ? record.get(1) : "";
        List<String> rest = new ArrayList<>();
        for (int i = 2; i < record.size(); i++) {
            rest.add(record.get(i));
        }
        String value = String.join(",", rest);
        return new BulkRow(record.getRecordNumber(), itemId, fieldName, value);
    }
}
