package com.sketchmath.server.recognition;

import com.sketchmath.server.pipeline.Candidate;

import java.util.List;

/**
 * One source of recognized text. Primary strategies are always consulted;
 * fallback strategies only when no primary candidate survives cleaning.
 */
public interface RecognitionStrategy {

    String getName();

    StrategyTier getTier();

    List<Candidate> recognize(RecognitionInput input);
}
