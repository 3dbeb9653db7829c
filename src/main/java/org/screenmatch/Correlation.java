package org.screenmatch;

/**
 * Normalized cross-correlation between a template and the equally sized window of a target at a given offset:
 * <pre>
 *   sum(target * template) / sqrt(sum(target^2) * sum(template^2))
 * </pre>
 * No mean subtraction, so the score is invariant to uniform brightness scaling but not to offsets.
 */
public final class Correlation {

    private Correlation() {
    }

    /**
     * @return the correlation score, or 0.0 when the window leaves the target or either window is all black
     */
    public static double score(LuminanceImage target, TemplateStatistics stats, int offsetX, int offsetY) {
        int tw = stats.getWidth();
        int th = stats.getHeight();
        if (offsetX < 0 || offsetY < 0
            || offsetX + tw > target.getWidth()
            || offsetY + th > target.getHeight()) {
            return 0.0;
        }

        int[] screen = target.pixels();
        int[] template = stats.getLuminance().pixels();
        int stride = target.getWidth();

        long sumProducts = 0;
        long sumTargetSquares = 0;
        for (int ty = 0; ty < th; ty++) {
            int screenRow = (offsetY + ty) * stride + offsetX;
            int templateRow = ty * tw;
            // a row of up to ~33000 pixels fits in int before being widened
            int rowProducts = 0;
            int rowSquares = 0;
            for (int tx = 0; tx < tw; tx++) {
                int s = screen[screenRow + tx];
                rowProducts += s * template[templateRow + tx];
                rowSquares += s * s;
            }
            sumProducts += rowProducts;
            sumTargetSquares += rowSquares;
        }

        double denominator = Math.sqrt((double) sumTargetSquares * stats.getSumOfSquares());
        if (denominator < Math.ulp(1.0)) {
            return 0.0;
        }
        return sumProducts / denominator;
    }
}
