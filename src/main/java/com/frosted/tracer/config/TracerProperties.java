package com.frosted.tracer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings under {@code tracer.*} in application.properties.
 */
@ConfigurationProperties("tracer")
public class TracerProperties {
    /** Recognition confidence below which a capture is not parsed, unless the request sets its own. */
    private double minConfidence = 0.6;
    private final Cors cors = new Cors();

    public double getMinConfidence() { return minConfidence; }
    public void setMinConfidence(double minConfidence) { this.minConfidence = minConfidence; }
    public Cors getCors() { return cors; }

    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

        public List<String> getAllowedOrigins() { return allowedOrigins; }
        public void setAllowedOrigins(List<String> allowedOrigins) { this.allowedOrigins = allowedOrigins; }
    }
}
