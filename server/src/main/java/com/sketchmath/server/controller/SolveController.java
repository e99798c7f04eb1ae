package com.sketchmath.server.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sketchmath.server.pipeline.Candidate;
import com.sketchmath.server.pipeline.Label;
import com.sketchmath.server.pipeline.SolveResult;
import com.sketchmath.server.recognition.RecognitionInput;
import com.sketchmath.server.recognition.RecognitionOutcome;
import com.sketchmath.server.service.MathSolvingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
public class SolveController {

    private static final Logger logger = LoggerFactory.getLogger(SolveController.class);
    private final MathSolvingService solvingService;

    public SolveController(MathSolvingService solvingService) {
        this.solvingService = solvingService;
    }

    public static class SolveRequest {
        public String question;
        public List<Label> labels;
        // Carried for the drawing client; the solver does not read strokes.
        public List<Object> strokes;
    }

    @JsonInclude(JsonInclude.Include.ALWAYS)
    public static class SolveResponse {
        public String result;
        public String steps;
        public String error;

        static SolveResponse from(SolveResult solved) {
            SolveResponse response = new SolveResponse();
            response.result = solved.getResultText();
            response.steps = solved.getSteps();
            response.error = solved.getError();
            return response;
        }
    }

    public static class RecognitionRequest {
        public List<Candidate> candidates;
        @JsonProperty("fallback_candidates")
        public List<Candidate> fallbackCandidates;
    }

    @PostMapping("/solve")
    public ResponseEntity<SolveResponse> solve(@RequestBody SolveRequest request) {
        logger.info("Solving question: '{}'", request.question);
        logger.info("Labels: {}", request.labels);

        SolveResult solved = solvingService.solve(request.question, request.labels);
        if (!solved.isSuccess()) {
            logger.info("Solve failed: {}", solved.getError());
        }
        return ResponseEntity.ok(SolveResponse.from(solved));
    }

    @PostMapping("/ocr")
    public ResponseEntity<Map<String, Object>> recognize(@RequestBody RecognitionRequest request) {
        RecognitionOutcome outcome = solvingService
                .solveRecognized(new RecognitionInput(request.candidates, request.fallbackCandidates));

        Map<String, Object> body = new LinkedHashMap<>();
        switch (outcome.getType()) {
            case SOLVED:
                SolveResult solved = outcome.getSolveResult();
                body.put("ocr_output", outcome.getOcrOutput());
                body.put("postprocessed", outcome.getPostprocessed());
                body.put("result", solved.getResultText());
                body.put("steps", solved.getSteps());
                body.put("error", solved.getError());
                break;
            case NO_OPERATOR:
                body.put("error", outcome.getSolveResult().getError());
                body.put("ocr_output", outcome.getOcrOutput());
                body.put("postprocessed", outcome.getPostprocessed());
                break;
            default:
                body.put("text", outcome.getPostprocessed());
                break;
        }
        return ResponseEntity.ok(body);
    }
}
