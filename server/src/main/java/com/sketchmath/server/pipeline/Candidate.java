package com.sketchmath.server.pipeline;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/** One raw text guess from a recognition pass. */
public final class Candidate {

    private final String rawText;
    private final String sourceTag;

    @JsonCreator
    public Candidate(@JsonProperty("raw_text") String rawText, @JsonProperty("source_tag") String sourceTag) {
        this.rawText = rawText == null ? "" : rawText;
        this.sourceTag = sourceTag == null ? "unknown" : sourceTag;
    }

    @JsonProperty("raw_text")
    public String getRawText() {
        return rawText;
    }

    @JsonProperty("source_tag")
    public String getSourceTag() {
        return sourceTag;
    }

    @Override
    public String toString() {
        return "Candidate{" + sourceTag + ": '" + rawText + "'}";
    }
}
