package org.screenmatch;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Line-by-line writing of the semicolon separated match report. Every line is appended and flushed on its own, so a
 * report stays readable when the tool stops half way.
 */
public class CsvUtils {

    private static void deleteFile(Path csvFile) {
        try {
            Files.deleteIfExists(csvFile);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete file " + csvFile, e);
        }
    }

    /** Starts a fresh report holding only the header line. */
    public static void prepareFile(Path csvFile) {
        deleteFile(csvFile);
        writeLineToFile(csvFile, MatchReportEntry.getCsvHeader());
    }

    public static void writeLineToFile(Path csvFile, String line) {
        try (BufferedWriter writer = Files.newBufferedWriter(csvFile, StandardOpenOption.APPEND, StandardOpenOption.CREATE)) {
            writer.write(line);
            writer.newLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write to file " + csvFile, e);
        }
    }
}
