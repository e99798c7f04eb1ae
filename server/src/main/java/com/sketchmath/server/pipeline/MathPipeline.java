package com.sketchmath.server.pipeline;

import com.sketchmath.server.pipeline.normalize.NormalizedExpression;
import com.sketchmath.server.pipeline.normalize.TextRepairNormalizer;
import com.sketchmath.server.pipeline.symbolic.SymbolicEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Question text and diagram labels in, structured answer out:
 * preprocess, normalize, substitute labels, validate, convert angles, solve.
 * Holds no per-request state.
 */
public class MathPipeline {

    private static final Logger logger = LoggerFactory.getLogger(MathPipeline.class);

    private final PipelineConfig config;
    private final QuestionPreprocessor preprocessor = new QuestionPreprocessor();
    private final TextRepairNormalizer normalizer = new TextRepairNormalizer();
    private final LabelSubstitutionEngine substitutionEngine = new LabelSubstitutionEngine();
    private final StructuralValidator validator = new StructuralValidator();
    private final AngleUnitNormalizer angleNormalizer = new AngleUnitNormalizer();
    private final SolveDispatcher dispatcher;

    public MathPipeline(PipelineConfig config, SymbolicEngine engine) {
        this.config = config;
        this.dispatcher = new SolveDispatcher(engine);
    }

    public SolveResult solveQuestion(String question, List<Label> labels) {
        if (question == null || question.isEmpty()) {
            return SolveResult.failure(SolveErrorKind.EMPTY_INPUT, "No question provided");
        }
        logger.info("Original question: '{}'", question);

        String preprocessed = preprocessor.preprocess(question);
        logger.info("After preprocessing: '{}'", preprocessed);

        NormalizedExpression cleaned = normalizer.normalize(preprocessed);
        logger.info("After cleaning: '{}'", cleaned);

        SubstitutionResult substituted = substitutionEngine.substitute(cleaned.getText(), labels);
        logger.info("After label substitution: '{}'", substituted.getText());

        ValidationVerdict verdict = validator.validate(substituted.getText());
        if (!verdict.isOk()) {
            logger.info("Rejected '{}': {}", substituted.getText(), verdict.getReason());
            return SolveResult.failure(SolveErrorKind.VALIDATION, verdict.getReason());
        }

        String prepared = substituted.getText();
        if (config.anglesInDegrees()) {
            prepared = angleNormalizer.toRadians(prepared);
            logger.info("After degree conversion: '{}'", prepared);
        }
        return dispatcher.dispatch(prepared);
    }

    public SolveResult solveQuestion(String question) {
        return solveQuestion(question, List.of());
    }
}
