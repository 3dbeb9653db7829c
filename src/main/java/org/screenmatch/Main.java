package org.screenmatch;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;

/**
 * Offline check of a pattern against a saved screenshot:
 * <pre>
 *   java -Dscreenmatch.output=out -jar screenmatch.jar button.png screenshot.png 0.9
 * </pre>
 * Writes the screenshot with every match outlined and a {@code matches.csv} report into the output directory.
 */
public class Main {
    private static final Logger l = LogManager.getLogger(Main.class);
    public static final Path DIR_OUTPUT = Path.of(System.getProperty("screenmatch.output", "output"));
    public static final String CSV_FILENAME = "matches.csv";

    private static Mat readImage(Path image, int codec) {
        Mat img = Imgcodecs.imread(image.toString(), codec);
        l.debug("Read image '{}' using codec {}, {}", image, codec, img);
        if (img.empty()) {
            throw new ImageLoadException("Failed to read image " + image);
        }
        return img;
    }

    private static Path writeImage(Path file, Mat img) {
        l.debug("Write image '{}'", file);
        if (!Imgcodecs.imwrite(file.toString(), img)) {
            throw new ImageLoadException("Failed to write image " + file);
        }
        return file;
    }

    public static void createAndCleanDirectory(Path directoryPath) {
        l.debug("Creating/cleaning directory {}", directoryPath.toAbsolutePath());
        try {
            Files.createDirectories(directoryPath);
            FileUtils.cleanDirectory(directoryPath.toFile());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to prepare directory " + directoryPath, e);
        }
    }

    /**
     * Finds every occurrence of the needle in the haystack and reports them into {@code outputDirectory}.
     */
    public static List<MatchReportEntry> run(Path needle, Path haystack, double similarity, Path outputDirectory) throws IOException {
        OpenCvLoader.load();
        createAndCleanDirectory(outputDirectory);

        Pattern pattern = Pattern.fromFile(needle).similar(similarity);
        Mat haystackImg = readImage(haystack, Imgcodecs.IMREAD_COLOR);
        ImageMatcher matcher = new ImageMatcher().withMinSimilarity(similarity);

        l.info("Searching '{}' in '{}' with similarity {}", needle.getFileName(), haystack.getFileName(), similarity);
        List<Match> matches = matcher.findAll(haystackImg, pattern);
        l.info("Found {} matches", matches.size());

        Path csvFile = outputDirectory.resolve(CSV_FILENAME);
        CsvUtils.prepareFile(csvFile);
        List<MatchReportEntry> entries = new ArrayList<>();
        Mat haystackWithRect = haystackImg.clone();
        Scalar color = new Scalar(0, 255, 255); // yellow
        int i = 1;
        for (Match match : matches) {
            MatchReportEntry entry = new MatchReportEntry(needle, haystack, similarity, match);
            l.debug("{}/{} {}", i++, matches.size(), entry);
            entries.add(entry);
            CsvUtils.writeLineToFile(csvFile, entry.toCsvString());

            // draw AROUND the match, out of bounds is clipped by OpenCV
            Region r = match.getRegion();
            Point rectTopLeft = new Point(r.getX() - 1, r.getY() - 1);
            Point rectBottomRight = new Point(r.getX() + r.getWidth(), r.getY() + r.getHeight());
            Imgproc.rectangle(haystackWithRect, rectTopLeft, rectBottomRight, color, 1);
        }

        String filename = String.format("%s_in_%s.png",
            FilenameUtils.getBaseName(needle.toString()), FilenameUtils.getBaseName(haystack.toString()));
        writeImage(outputDirectory.resolve(filename), haystackWithRect);

        haystackWithRect.release();
        haystackImg.release();
        return entries;
    }

    public static void main(String[] args) throws IOException {
        if (args.length < 2) {
            l.error("Usage: Main <needle-image> <haystack-image> [similarity]");
            System.exit(1);
        }
        double similarity = args.length > 2 ? Double.parseDouble(args[2]) : Pattern.DEFAULT_SIMILARITY;
        List<MatchReportEntry> entries = run(Path.of(args[0]), Path.of(args[1]), similarity, DIR_OUTPUT);
        for (MatchReportEntry entry : entries) {
            l.info(entry);
        }
        l.info("Report written to {}", DIR_OUTPUT.resolve(CSV_FILENAME).toAbsolutePath());
    }
}
