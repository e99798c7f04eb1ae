package com.sketchmath.server.recognition;

import com.sketchmath.server.pipeline.Candidate;

import java.util.List;

/**
 * Candidates that were recognized upstream and sent along with the request.
 */
public class SuppliedCandidateStrategy implements RecognitionStrategy {

    private final StrategyTier tier;

    public SuppliedCandidateStrategy(StrategyTier tier) {
        this.tier = tier;
    }

    public static SuppliedCandidateStrategy primary() {
        return new SuppliedCandidateStrategy(StrategyTier.PRIMARY);
    }

    public static SuppliedCandidateStrategy fallback() {
        return new SuppliedCandidateStrategy(StrategyTier.FALLBACK);
    }

    @Override
    public String getName() {
        return "supplied-" + tier.name().toLowerCase();
    }

    @Override
    public StrategyTier getTier() {
        return tier;
    }

    @Override
    public List<Candidate> recognize(RecognitionInput input) {
        return tier == StrategyTier.PRIMARY ? input.getCandidates() : input.getFallbackCandidates();
    }
}
