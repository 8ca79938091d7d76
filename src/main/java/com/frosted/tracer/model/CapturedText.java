package com.frosted.tracer.model;

/**
 * Text handed over by the recognition collaborator together with its confidence in [0, 1].
 */
public final class CapturedText {
    private final String text;
    private final double confidence;

    public CapturedText(String text, double confidence) {
        this.text = text != null ? text : "";
        this.confidence = confidence;
    }

    /** Typed or pasted text, fully trusted. */
    public static CapturedText typed(String text) {
        return new CapturedText(text, 1.0);
    }

    public String getText() { return text; }

    public double getConfidence() { return confidence; }
}
