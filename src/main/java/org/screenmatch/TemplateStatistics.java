package org.screenmatch;

/**
 * Template luminance plus the sum of its squared values, computed once per search call.
 */
public final class TemplateStatistics {
    private final LuminanceImage luminance;
    private final double sumOfSquares;

    private TemplateStatistics(LuminanceImage luminance, double sumOfSquares) {
        this.luminance = luminance;
        this.sumOfSquares = sumOfSquares;
    }

    public static TemplateStatistics precompute(LuminanceImage template) {
        long sum = 0;
        for (int value : template.pixels()) {
            sum += (long) value * value;
        }
        return new TemplateStatistics(template, sum);
    }

    public static TemplateStatistics precompute(Pattern pattern) {
        return precompute(LuminanceImage.decode(pattern.imageDataUnsafe()));
    }

    public LuminanceImage getLuminance() {
        return luminance;
    }

    public int getWidth() {
        return luminance.getWidth();
    }

    public int getHeight() {
        return luminance.getHeight();
    }

    public double getSumOfSquares() {
        return sumOfSquares;
    }
}
