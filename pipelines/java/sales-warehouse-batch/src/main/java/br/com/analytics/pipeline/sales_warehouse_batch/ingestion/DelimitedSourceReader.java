package br.com.analytics.pipeline.sales_warehouse_batch.ingestion;

import br.com.analytics.pipeline.sales_warehouse_batch.exception.IngestionException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class DelimitedSourceReader {

    private final CSVFormat format;
    private final Charset charset;
    private final boolean headerRowPresent;

    public DelimitedSourceReader(String fieldDelimiter, Charset charset, boolean headerRowPresent) {
        this.format = CSVFormat.DEFAULT.builder()
                .setDelimiter(fieldDelimiter)
                .setIgnoreEmptyLines(true)
                .build();
        this.charset = charset;
        this.headerRowPresent = headerRowPresent;
    }

    public List<Object[]> read(RawSourceTable source, Path file) {
        String entity = source.tableName();
        if (!Files.isReadable(file)) {
            throw new IngestionException(entity, "Source file " + file + " is missing or unreadable");
        }

        List<RawSourceTable.SourceColumn> columns = source.columns();
        List<Object[]> rows = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(file, charset);
             CSVParser parser = format.parse(reader)) {
            boolean skipHeader = headerRowPresent;
            for (CSVRecord record : parser) {
                if (skipHeader) {
                    skipHeader = false;
                    continue;
                }
                if (record.size() != columns.size()) {
                    throw new IngestionException(entity, String.format(
                            "%s line %d: expected %d fields but found %d",
                            file.getFileName(), parser.getCurrentLineNumber(), columns.size(), record.size()));
                }
                rows.add(convert(entity, file, record, columns));
            }
        } catch (IOException e) {
            throw new IngestionException(entity, "Failed to read " + file + ": " + e.getMessage(), e);
        }
        return rows;
    }

    private Object[] convert(String entity, Path file, CSVRecord record, List<RawSourceTable.SourceColumn> columns) {
        Object[] row = new Object[columns.size()];
        for (int i = 0; i < columns.size(); i++) {
            RawSourceTable.SourceColumn column = columns.get(i);
            String value = record.get(i);
            try {
                row[i] = column.type().parse(value);
            } catch (RuntimeException e) {
                throw new IngestionException(entity, String.format(
                        "%s record %d: cannot read '%s' as %s for column %s",
                        file.getFileName(), record.getRecordNumber(), value, column.type(), column.name()), e);
            }
        }
        return row;
    }
}
