package com.sketchmath.server.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class PipelineConfig {
    public static final String DEGREES = "degrees";
    public static final String RADIANS = "radians";

    // "degrees" rewrites trig arguments to radians before parsing, "radians" leaves them alone
    public String angleUnit = DEGREES;
    public int significantDigits = 12;
    public int maxRootIterations = 500;
    public double rootTolerance = 1.0e-12;

    public PipelineConfig() {
    }

    public PipelineConfig(String angleUnit, int significantDigits, int maxRootIterations, double rootTolerance) {
        this.angleUnit = angleUnit;
        this.significantDigits = significantDigits;
        this.maxRootIterations = maxRootIterations;
        this.rootTolerance = rootTolerance;
    }

    public static PipelineConfig defaults() {
        return new PipelineConfig(DEGREES, 12, 500, 1.0e-12);
    }

    public boolean anglesInDegrees() {
        return !RADIANS.equalsIgnoreCase(angleUnit);
    }

    public PipelineConfig copy() {
        return new PipelineConfig(this.angleUnit, this.significantDigits, this.maxRootIterations,
                this.rootTolerance);
    }
}
