package org.screenmatch;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

import static org.junit.jupiter.api.Assertions.*;

public class LuminanceImageTest {

    @BeforeAll
    static void loadOpenCv() {
        OpenCvLoader.load();
    }

    @Test
    void testGrayBgrKeepsItsValue() {
        LuminanceImage image = LuminanceImage.of(TestImages.canvas(7, 5, 128));
        assertEquals(7, image.getWidth());
        assertEquals(5, image.getHeight());
        assertEquals(128, image.get(6, 4));
    }

    @Test
    void testSingleAndFourChannelImages() {
        Mat gray = new Mat(3, 4, CvType.CV_8UC1, new Scalar(200));
        assertEquals(200, LuminanceImage.of(gray).get(3, 2));

        Mat bgra = new Mat(3, 4, CvType.CV_8UC4, new Scalar(255, 255, 255, 255));
        assertEquals(255, LuminanceImage.of(bgra).get(0, 0));
    }

    @Test
    void testSubmatIsReadCorrectly() {
        Mat canvas = TestImages.canvas(20, 20, 0);
        TestImages.fill(canvas, 10, 10, 5, 5, TestImages.WHITE);
        Mat sub = canvas.submat(8, 16, 8, 16);
        LuminanceImage image = LuminanceImage.of(sub);
        assertEquals(8, image.getWidth());
        assertEquals(0, image.get(1, 1));
        assertEquals(255, image.get(2, 2));
        assertEquals(255, image.get(6, 6));
        assertEquals(0, image.get(7, 7));
    }

    @Test
    void testEmptyMat() {
        LuminanceImage image = LuminanceImage.of(new Mat());
        assertEquals(0, image.getWidth());
        assertEquals(0, image.getHeight());
    }

    @Test
    void testPixelCountMustMatchDimensions() {
        assertThrows(IllegalArgumentException.class, () -> new LuminanceImage(2, 2, new int[3]));
    }

    @Test
    void testDecodeRejectsGarbage() {
        assertThrows(ImageLoadException.class, () -> LuminanceImage.decode(new byte[0]));
        assertThrows(ImageLoadException.class, () -> LuminanceImage.decode(new byte[]{1, 2, 3, 4, 5}));
    }
}
