package com.vistaplan.orchestrator.model;

import java.util.Optional;

/**
 * Output resolution tiers offered to users.
 *
 * The window is the accepted range for the longer edge of an image, in pixels.
 */
public enum QualityTier {

    Q1K(800, 1200),
    Q2K(1800, 2400),
    Q4K(3600, 4200);

    private final int minLongEdge;
    private final int maxLongEdge;

    QualityTier(int minLongEdge, int maxLongEdge) {
        this.minLongEdge = minLongEdge;
        this.maxLongEdge = maxLongEdge;
    }

    public int minLongEdge() { return minLongEdge; }
    public int maxLongEdge() { return maxLongEdge; }

    public boolean accepts(int width, int height) {
        int longEdge = Math.max(width, height);
        return longEdge >= minLongEdge && longEdge <= maxLongEdge;
    }

    /** Label as shown to users: "1K", "2K", "4K". */
    public String label() {
        return name().substring(1);
    }

    public static Optional<QualityTier> fromLabel(String label) {
        if (label == null) return Optional.empty();
        for (QualityTier t : values()) {
            if (t.label().equalsIgnoreCase(label.trim())) return Optional.of(t);
        }
        return Optional.empty();
    }

    /** Steps 0–3 always render at 2K regardless of what the user picked. */
    public static QualityTier effectiveFor(int step, QualityTier requested) {
        return step <= 3 ? Q2K : requested;
    }
}
