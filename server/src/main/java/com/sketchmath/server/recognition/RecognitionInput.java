package com.sketchmath.server.recognition;

import com.sketchmath.server.pipeline.Candidate;

import java.util.Collections;
import java.util.List;

/** Everything recognizers may look at for one request. */
public class RecognitionInput {

    private final List<Candidate> candidates;
    private final List<Candidate> fallbackCandidates;

    public RecognitionInput(List<Candidate> candidates, List<Candidate> fallbackCandidates) {
        this.candidates = candidates != null ? candidates : Collections.emptyList();
        this.fallbackCandidates = fallbackCandidates != null ? fallbackCandidates : Collections.emptyList();
    }

    public List<Candidate> getCandidates() {
        return candidates;
    }

    public List<Candidate> getFallbackCandidates() {
        return fallbackCandidates;
    }
}
