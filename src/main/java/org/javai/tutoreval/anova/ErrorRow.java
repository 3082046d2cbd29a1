package org.javai.tutoreval.anova;

/**
 * Pooled within-cell variation.
 */
public record ErrorRow(double ss, int df, double ms) {
}
