package com.plant.flowsheet.wiring;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes observation rows as CSV: a header {@code step,time,<columns>}, then
 * one line per row. Flushes at the end of each batch.
 */
public final class CsvObservationSink implements ObservationSink {
    private final Writer out;
    private final StringBuilder line = new StringBuilder(256);

    public CsvObservationSink(Writer out, List<String> columns) {
        this.out = out;
        line.append("step,time");
        for (String c : columns)
            line.append(',').append(c);
        writeLine();
    }

    public static CsvObservationSink toFile(Path path, List<String> columns) {
        try {
            return new CsvObservationSink(Files.newBufferedWriter(path, StandardCharsets.UTF_8), columns);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot open " + path, e);
        }
    }

    @Override
    public void onRow(long step, double time, double[] values, int length) {
        line.append(step).append(',').append(time);
        for (int i = 0; i < length; i++)
            line.append(',').append(values[i]);
        writeLine();
    }

    @Override
    public void onBatchEnd() {
        try {
            out.flush();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public void close() {
        try {
            out.close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void writeLine() {
        try {
            out.append(line).append('\n');
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } finally {
            line.setLength(0);
        }
    }
}
