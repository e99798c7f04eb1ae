package com.sketchmath.server.recognition;

import com.sketchmath.server.pipeline.SolveErrorKind;
import com.sketchmath.server.pipeline.SolveResult;

public final class RecognitionOutcome {

    public enum Type {
        SOLVED,
        NO_OPERATOR,
        FALLBACK_TEXT,
        NOTHING_RECOGNIZED
    }

    public static final String NO_OPERATOR_MESSAGE = "No math operator detected in OCR output.";

    private final Type type;
    private final String ocrOutput;
    private final String postprocessed;
    private final SolveResult solveResult;

    private RecognitionOutcome(Type type, String ocrOutput, String postprocessed, SolveResult solveResult) {
        this.type = type;
        this.ocrOutput = ocrOutput;
        this.postprocessed = postprocessed;
        this.solveResult = solveResult;
    }

    public static RecognitionOutcome solved(String ocrOutput, String postprocessed, SolveResult result) {
        return new RecognitionOutcome(Type.SOLVED, ocrOutput, postprocessed, result);
    }

    public static RecognitionOutcome noOperator(String ocrOutput, String postprocessed) {
        return new RecognitionOutcome(Type.NO_OPERATOR, ocrOutput, postprocessed,
                SolveResult.failure(SolveErrorKind.NO_OPERATOR, NO_OPERATOR_MESSAGE));
    }

    public static RecognitionOutcome fallbackText(String text) {
        return new RecognitionOutcome(Type.FALLBACK_TEXT, null, text, null);
    }

    public static RecognitionOutcome nothingRecognized() {
        return new RecognitionOutcome(Type.NOTHING_RECOGNIZED, null, "", null);
    }

    public Type getType() {
        return type;
    }

    /** The selected candidate after OCR cleanup. */
    public String getOcrOutput() {
        return ocrOutput;
    }

    /**
     * Text after selection post-processing. For fallback outcomes this is the
     * only text there is.
     */
    public String getPostprocessed() {
        return postprocessed;
    }

    /** Null for fallback and empty outcomes. */
    public SolveResult getSolveResult() {
        return solveResult;
    }

    @Override
    public String toString() {
        return "RecognitionOutcome{" + type + ", '" + postprocessed + "'}";
    }
}
