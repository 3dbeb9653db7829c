package org.screenmatch;

import java.awt.Point;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

public class PatternTest {

    @BeforeAll
    static void loadOpenCv() {
        OpenCvLoader.load();
    }

    @Test
    void testDefaults() {
        Pattern pattern = new Pattern(new byte[]{1, 2, 3});
        assertEquals(Pattern.DEFAULT_SIMILARITY, pattern.getSimilarity());
        assertEquals(new Point(0, 0), pattern.getTargetOffset());
        assertEquals("pattern", pattern.getName());
        assertEquals(3, pattern.dataSize());
        assertTrue(pattern.isValid());
        assertFalse(new Pattern(new byte[0]).isValid());
    }

    @Test
    void testSimilarityIsClamped() {
        Pattern pattern = new Pattern(new byte[]{1});
        assertEquals(1.0, pattern.similar(1.5).getSimilarity());
        assertEquals(0.0, pattern.similar(-0.2).getSimilarity());
        assertEquals(0.85, pattern.similar(0.85).getSimilarity());
    }

    @Test
    void testBuildersReturnCopies() {
        Pattern original = new Pattern(new byte[]{1});
        Pattern changed = original.similar(0.9).targetOffset(3, 4).named("ok-button");
        assertEquals(Pattern.DEFAULT_SIMILARITY, original.getSimilarity());
        assertEquals("pattern", original.getName());
        assertEquals(0.9, changed.getSimilarity());
        assertEquals(new Point(3, 4), changed.getTargetOffset());
        assertEquals("ok-button", changed.getName());
    }

    @Test
    void testImageDataIsCopied() {
        byte[] data = {1, 2, 3};
        Pattern pattern = new Pattern(data);
        data[0] = 9;
        assertEquals(1, pattern.getImageData()[0]);
        pattern.getImageData()[1] = 9;
        assertEquals(2, pattern.getImageData()[1]);
        pattern.getTargetOffset().x = 50;
        assertEquals(0, pattern.getTargetOffset().x);
    }

    @Test
    void testFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("button.png");
        Files.write(file, new byte[]{4, 5, 6});
        Pattern pattern = Pattern.fromFile(file);
        assertArrayEquals(new byte[]{4, 5, 6}, pattern.getImageData());
        assertEquals("button.png", pattern.getName());
    }

    @Test
    void testFromMissingFileThrows(@TempDir Path dir) {
        assertThrows(IOException.class, () -> Pattern.fromFile(dir.resolve("missing.png")));
    }

    @Test
    void testFromImageEncodesPng() {
        Pattern pattern = Pattern.fromImage(TestImages.button());
        LuminanceImage decoded = LuminanceImage.decode(pattern.getImageData());
        assertEquals(40, decoded.getWidth());
        assertEquals(20, decoded.getHeight());
        assertEquals(255, decoded.get(0, 0));
        assertEquals(0, decoded.get(2, 2));
        assertEquals(255, decoded.get(6, 8));
    }

    @Test
    void testEquality() {
        Pattern a = new Pattern(new byte[]{1, 2}).similar(0.8);
        Pattern b = new Pattern(new byte[]{1, 2}).similar(0.8);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, b.similar(0.9));
        assertNotEquals(a, b.named("other"));
    }
}
