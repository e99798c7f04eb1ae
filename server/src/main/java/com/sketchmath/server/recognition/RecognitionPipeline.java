package com.sketchmath.server.recognition;

import com.sketchmath.server.pipeline.Candidate;
import com.sketchmath.server.pipeline.CandidateSelector;
import com.sketchmath.server.pipeline.MathPipeline;
import com.sketchmath.server.pipeline.SolveResult;
import com.sketchmath.server.pipeline.normalize.NormalizedExpression;
import com.sketchmath.server.pipeline.normalize.OcrCandidateCleaner;
import com.sketchmath.server.pipeline.normalize.SelectionPostProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Recognized text to solved result. Primary candidates are cleaned, scored
 * and the best one solved; fallback text is only surfaced, never solved.
 */
public class RecognitionPipeline {

    private static final Logger logger = LoggerFactory.getLogger(RecognitionPipeline.class);

    private final List<RecognitionStrategy> strategies;
    private final MathPipeline mathPipeline;
    private final OcrCandidateCleaner cleaner = new OcrCandidateCleaner();
    private final CandidateSelector selector = new CandidateSelector();
    private final SelectionPostProcessor postProcessor = new SelectionPostProcessor();

    public RecognitionPipeline(List<RecognitionStrategy> strategies, MathPipeline mathPipeline) {
        this.strategies = new ArrayList<>(strategies);
        this.mathPipeline = mathPipeline;
    }

    public RecognitionOutcome recognize(RecognitionInput input) {
        List<String> cleaned = new ArrayList<>();
        for (Candidate candidate : collect(input, StrategyTier.PRIMARY)) {
            NormalizedExpression text = cleaner.clean(candidate.getRawText());
            if (!text.isEmpty()) {
                cleaned.add(text.getText());
            } else {
                logger.debug("Dropping empty candidate from {}", candidate.getSourceTag());
            }
        }

        int selected = selector.selectIndex(cleaned);
        if (selected >= 0) {
            String best = cleaned.get(selected);
            String processed = postProcessor.postProcess(best);
            logger.info("OCR output (best of {} candidates): {}", cleaned.size(), best);
            logger.info("Post-processed result: {}", processed);

            if (!postProcessor.hasOperator(processed)) {
                return RecognitionOutcome.noOperator(best, processed);
            }
            SolveResult result = mathPipeline.solveQuestion(processed);
            return RecognitionOutcome.solved(best, processed, result);
        }

        logger.info("No primary candidate survived, trying fallback recognizers");
        for (Candidate candidate : collect(input, StrategyTier.FALLBACK)) {
            if (candidate.getRawText() != null && !candidate.getRawText().trim().isEmpty()) {
                return RecognitionOutcome.fallbackText(postProcessor.postProcessFallback(candidate.getRawText()));
            }
        }

        logger.info("All recognizers failed to extract any text");
        return RecognitionOutcome.nothingRecognized();
    }

    private List<Candidate> collect(RecognitionInput input, StrategyTier tier) {
        List<Candidate> candidates = new ArrayList<>();
        for (RecognitionStrategy strategy : strategies) {
            if (strategy.getTier() != tier) {
                continue;
            }
            List<Candidate> produced = strategy.recognize(input);
            logger.debug("Strategy {} produced {} candidates", strategy.getName(), produced.size());
            for (Candidate candidate : produced) {
                if (candidate != null) {
                    candidates.add(candidate);
                }
            }
        }
        return candidates;
    }
}
