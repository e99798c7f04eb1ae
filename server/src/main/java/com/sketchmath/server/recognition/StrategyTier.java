package com.sketchmath.server.recognition;

public enum StrategyTier {
    PRIMARY,
    FALLBACK
}
