package me.golemcore.archivist.domain.model;

/**
 * Ranking signals attached to a memory item. All values are clamped to
 * [0, 1]. They influence ordering only, never correctness.
 */
public record ItemQuality(double authority, double feedback, double accessCost) {

    public static final ItemQuality DEFAULT = new ItemQuality(0.5, 0.5, 0.1);
    public static final ItemQuality LEVEL_ONE = new ItemQuality(0.8, 0.7, 0.2);
    public static final ItemQuality MERGED = new ItemQuality(0.9, 0.8, 0.1);
    public static final ItemQuality PLACEHOLDER = new ItemQuality(0.5, 0.5, 0.1);

    public ItemQuality {
        authority = clamp(authority);
        feedback = clamp(feedback);
        accessCost = clamp(accessCost);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value) || value < 0.0) {
            return 0.0;
        }
        return Math.min(value, 1.0);
    }
}
