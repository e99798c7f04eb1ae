package com.sketchmath.server.controller;

import com.sketchmath.server.pipeline.PipelineConfig;
import com.sketchmath.server.service.MathSolvingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.nullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class SolveControllerTest {

    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        MathSolvingService service = new MathSolvingService(PipelineConfig.defaults());
        mockMvc = MockMvcBuilders.standaloneSetup(new SolveController(service))
                .setControllerAdvice(new RequestErrorHandler())
                .build();
    }

    private org.springframework.test.web.servlet.ResultActions postJson(String path, String body) throws Exception {
        return mockMvc.perform(post(path).contentType(MediaType.APPLICATION_JSON).content(body));
    }

    @Test
    public void testSolveEquation() throws Exception {
        postJson("/solve", "{\"question\": \"x+5=10\", \"labels\": [], \"strokes\": []}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result").value("[5]"))
                .andExpect(jsonPath("$.steps").value(containsString("Solution: [5]")))
                .andExpect(jsonPath("$.error").value(nullValue()));
    }

    @Test
    public void testSolveWithLabels() throws Exception {
        postJson("/solve", "{\"question\": \"a+b=10\", \"labels\": [{\"text\": \"a\", \"value\": 3}, {\"text\": \"b=4\"}]}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.steps").value(containsString("3+4=10")));
    }

    @Test
    public void testSolveEmptyQuestion() throws Exception {
        postJson("/solve", "{}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result").value(nullValue()))
                .andExpect(jsonPath("$.steps").value(nullValue()))
                .andExpect(jsonPath("$.error").value("No question provided"));
    }

    @Test
    public void testMalformedJson() throws Exception {
        postJson("/solve", "{not json")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Malformed JSON request body"));
    }

    @Test
    public void testOcrSolved() throws Exception {
        postJson("/ocr", "{\"candidates\": [{\"raw_text\": \"l2+3\", \"source_tag\": \"handwriting\"}]}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ocr_output").value("12+3"))
                .andExpect(jsonPath("$.postprocessed").value("12+3"))
                .andExpect(jsonPath("$.result").value("15"))
                .andExpect(jsonPath("$.error").value(nullValue()));
    }

    @Test
    public void testOcrNoOperator() throws Exception {
        postJson("/ocr", "{\"candidates\": [{\"raw_text\": \"123\"}]}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.error").value("No math operator detected in OCR output."))
                .andExpect(jsonPath("$.ocr_output").value("123"))
                .andExpect(jsonPath("$.postprocessed").value("123"));
    }

    @Test
    public void testOcrFallbackText() throws Exception {
        postJson("/ocr", "{\"candidates\": [], \"fallback_candidates\": [{\"raw_text\": \"lO+O\"}]}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.text").value("10+0"));
    }

    @Test
    public void testOcrNothingRecognized() throws Exception {
        postJson("/ocr", "{}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.text").value(""));
    }
}
