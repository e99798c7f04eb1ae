package com.sketchmath.server.tools;

import com.sketchmath.server.pipeline.MathPipeline;
import com.sketchmath.server.pipeline.PipelineConfig;
import com.sketchmath.server.pipeline.SolutionFormatter;
import com.sketchmath.server.pipeline.SolveResult;
import com.sketchmath.server.pipeline.symbolic.DefaultSymbolicEngine;
import com.sketchmath.server.util.PipelineConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Offline tool that solves a file of questions, one per line. Blank lines
 * are skipped.
 * Usage: QuestionBatchSolver <questionsFile> [outputFile]
 */
public class QuestionBatchSolver {

    private static final Logger logger = LoggerFactory.getLogger(QuestionBatchSolver.class);

    private final MathPipeline pipeline;
    private final SolutionFormatter formatter = new SolutionFormatter();

    public QuestionBatchSolver(PipelineConfig config) {
        this.pipeline = new MathPipeline(config, new DefaultSymbolicEngine(config));
    }

    public static void main(String[] args) {
        if (args.length < 1) {
            System.err.println("Usage: QuestionBatchSolver <questionsFile> [outputFile]");
            System.exit(1);
        }

        Path input = Paths.get(args[0]);
        if (!Files.isRegularFile(input)) {
            System.err.println("Invalid questions file: " + args[0]);
            System.exit(1);
        }

        QuestionBatchSolver solver = new QuestionBatchSolver(PipelineConfigLoader.load());
        try {
            if (args.length > 1) {
                try (Writer out = Files.newBufferedWriter(Paths.get(args[1]), StandardCharsets.UTF_8)) {
                    solver.run(input, out);
                }
            } else {
                Writer out = new PrintWriter(System.out);
                solver.run(input, out);
                out.flush();
            }
        } catch (IOException e) {
            logger.error("Batch solve failed", e);
            System.exit(1);
        }
    }

    /**
     * Solves every question in the file and writes the formatted answers.
     *
     * @return number of questions solved without error
     */
    public int run(Path questionsFile, Writer out) throws IOException {
        List<String> lines = Files.readAllLines(questionsFile, StandardCharsets.UTF_8);
        logger.info("Solving questions from {}", questionsFile.toAbsolutePath());

        int total = 0;
        int solved = 0;
        for (String line : lines) {
            String question = line.trim();
            if (question.isEmpty()) {
                continue;
            }
            total++;
            SolveResult result = pipeline.solveQuestion(question);
            if (result.isSuccess()) {
                solved++;
            } else {
                logger.warn("Question {} failed: {}", total, result.getError());
            }
            out.write("Q" + total + ": " + question + "\n");
            out.write(formatter.format(result) + "\n\n");
        }

        logger.info("Batch complete: {} of {} questions solved", solved, total);
        return solved;
    }
}
