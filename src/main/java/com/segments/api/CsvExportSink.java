package com.segments.api;

import com.segments.infrastructure.store.RowSink;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.Flushable;
import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Writes streamed rows as CSV: the column names first, then one record per row.
 */
public class CsvExportSink implements RowSink, Flushable {

    private final CSVPrinter printer;

    public CsvExportSink(Writer writer) throws IOException {
        this.printer = new CSVPrinter(writer, CSVFormat.DEFAULT);
    }

    @Override
    public void columns(List<String> names) throws IOException {
        printer.printRecord(names);
    }

    @Override
    public void row(List<Object> values) throws IOException {
        printer.printRecord(values);
    }

    @Override
    public void flush() throws IOException {
        printer.flush();
    }
}
