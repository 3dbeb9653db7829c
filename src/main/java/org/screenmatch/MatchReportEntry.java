package org.screenmatch;

import java.nio.file.Path;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/**
 * One match found by the command line tool, as it goes into the CSV report.
 */
class MatchReportEntry {
    private static final DecimalFormat SCORE_FORMAT = new DecimalFormat("0.##########", DecimalFormatSymbols.getInstance(Locale.ROOT));

    public final Path needle;
    public final Path haystack;
    public final double similarity;
    public final Match match;

    MatchReportEntry(Path needle, Path haystack, double similarity, Match match) {
        this.needle = needle;
        this.haystack = haystack;
        this.similarity = similarity;
        this.match = match;
    }

    public String toString() {
        return "Result:" +
               "\n  needle               " + needle +
               "\n  haystack             " + haystack +
               "\n  similarity           " + similarity +
               "\n  region               " + match.getRegion() +
               "\n  score                " + formatScore(match.getScore());
    }

    public static String getCsvHeader() {
        return "needle;haystack;similarity;x;y;width;height;score";
    }

    public String toCsvString() {
        Region r = match.getRegion();
        return needle.getFileName() + ";" + haystack.getFileName() + ";" + similarity + ";"
               + r.getX() + ";" + r.getY() + ";" + r.getWidth() + ";" + r.getHeight() + ";"
               + formatScore(match.getScore());
    }

    private static String formatScore(double score) {
        synchronized (SCORE_FORMAT) {
            return SCORE_FORMAT.format(score);
        }
    }
}
