package com.itdesk.backend.service;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/** Geração de CSV em memória para os downloads de usuários e de logs. */
final class CsvSupport {

    private CsvSupport() {
    }

    @FunctionalInterface
    interface Rows {
        void print(CSVPrinter printer) throws IOException;
    }

    static ByteArrayInputStream write(CSVFormat format, Rows rows) {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream();
             Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, format)) {
            rows.print(printer);
            printer.flush();
            return new ByteArrayInputStream(out.toByteArray());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to generate CSV: " + e.getMessage(), e);
        }
    }
}
