package com.sketchmath.server.service;

import com.sketchmath.server.pipeline.Label;
import com.sketchmath.server.pipeline.MathPipeline;
import com.sketchmath.server.pipeline.PipelineConfig;
import com.sketchmath.server.pipeline.SolveResult;
import com.sketchmath.server.pipeline.symbolic.DefaultSymbolicEngine;
import com.sketchmath.server.recognition.RecognitionInput;
import com.sketchmath.server.recognition.RecognitionOutcome;
import com.sketchmath.server.recognition.RecognitionPipeline;
import com.sketchmath.server.recognition.SuppliedCandidateStrategy;
import com.sketchmath.server.util.PipelineConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class MathSolvingService {

    private static final Logger logger = LoggerFactory.getLogger(MathSolvingService.class);

    private final PipelineConfig config;
    private final MathPipeline mathPipeline;
    private final RecognitionPipeline recognitionPipeline;

    public MathSolvingService() {
        this(PipelineConfigLoader.load());
    }

    public MathSolvingService(PipelineConfig config) {
        this.config = config;
        this.mathPipeline = new MathPipeline(config, new DefaultSymbolicEngine(config));
        this.recognitionPipeline = new RecognitionPipeline(
                List.of(SuppliedCandidateStrategy.primary(), SuppliedCandidateStrategy.fallback()),
                mathPipeline);
        logger.info("Math solving service ready: angleUnit={}, significantDigits={}", config.angleUnit,
                config.significantDigits);
    }

    public PipelineConfig getConfig() {
        return config;
    }

    public SolveResult solve(String question, List<Label> labels) {
        return mathPipeline.solveQuestion(question, labels);
    }

    public RecognitionOutcome solveRecognized(RecognitionInput input) {
        return recognitionPipeline.recognize(input);
    }
}
