package org.screenmatch;

/**
 * How much of an image changed between two snapshots.
 * A pixel counts as changed when its luminance moved by more than {@link #PIXEL_THRESHOLD}.
 */
public final class ImageDifference {
    public static final int PIXEL_THRESHOLD = 20;

    private ImageDifference() {
    }

    /**
     * @return fraction of changed pixels in [0, 1]; 1.0 if the sizes differ, 0.0 for two empty images
     */
    public static double changedFraction(LuminanceImage before, LuminanceImage after) {
        if (before.getWidth() != after.getWidth() || before.getHeight() != after.getHeight()) {
            return 1.0;
        }
        int[] a = before.pixels();
        int[] b = after.pixels();
        if (a.length == 0) {
            return 0.0;
        }
        int changed = 0;
        for (int i = 0; i < a.length; i++) {
            if (Math.abs(a[i] - b[i]) > PIXEL_THRESHOLD) {
                changed++;
            }
        }
        return (double) changed / a.length;
    }

    public static double changedPercent(LuminanceImage before, LuminanceImage after) {
        return changedFraction(before, after) * 100.0;
    }
}
