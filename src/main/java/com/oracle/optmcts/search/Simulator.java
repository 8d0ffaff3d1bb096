package com.oracle.optmcts.search;

import com.oracle.optmcts.core.CodeGenerator;
import com.oracle.optmcts.core.ExecutionReport;
import com.oracle.optmcts.core.ExecutionSandbox;
import com.oracle.optmcts.core.GroundTruthOracle;
import com.oracle.optmcts.core.Retries;
import com.oracle.optmcts.core.RetryPolicy;
import com.oracle.optmcts.core.StructuredOutputParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.backoff.BackOffExecution;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * Turns a complete formulation into a program, runs it and repairs it until it prints an answer.
 * The judged score is filled in later by the {@link Evaluator}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Simulator {

    private final CodeGenerator codeGenerator;
    private final ExecutionSandbox sandbox;
    private final GroundTruthOracle oracle;

    public SimulationResult simulate(SearchContext context, List<FormulationNode> path) {
        FormulationNode leaf = path.get(path.size() - 1);
        if (!leaf.isComplete()) {
            throw new IllegalArgumentException("Only complete formulations can be simulated, got " + leaf.getLayer());
        }
        String formulation = Formulations.render(path);
        RetryPolicy policy = context.getSettings().getExecutionRetry();
        BackOffExecution backOff = policy.toBackOff().start();

        String code = null;
        String lastError = null;
        ExecutionReport report = null;
        Double answer = null;
        int attempts = 0;

        while (attempts < policy.maxAttempts()) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Simulation cancelled");
            }
            attempts++;
            try {
                code = code == null
                        ? codeGenerator.generate(context.getProblem(), formulation)
                        : codeGenerator.repair(context.getProblem(), code, lastError);
            } catch (CancellationException e) {
                throw e;
            } catch (RuntimeException e) {
                lastError = "Code generation failed: " + e.getMessage();
                log.warn("Attempt {}/{}: {}", attempts, policy.maxAttempts(), lastError);
                report = ExecutionReport.failure(lastError);
                pauseBeforeNext(attempts, policy, backOff);
                continue;
            }

            report = sandbox.execute(code);
            Optional<Double> extracted = report.isSuccess()
                    ? AnswerExtractor.lastNumber(report.getOutput())
                    : Optional.empty();
            if (extracted.isPresent()) {
                answer = extracted.get();
                break;
            }
            lastError = failureReason(report);
            log.warn("Attempt {}/{} did not produce an answer: {}", attempts, policy.maxAttempts(),
                    StructuredOutputParser.abbreviate(lastError, 300));
            pauseBeforeNext(attempts, policy, backOff);
        }

        boolean success = report != null && report.isSuccess();
        Double finalAnswer = answer;
        boolean matches = finalAnswer != null && context.groundTruth()
                .map(truth -> oracle.compare(finalAnswer, truth, context.getSettings().getAnswerTolerance()))
                .orElse(false);

        SimulationResult result = SimulationResult.builder()
                .code(code)
                .output(report == null ? "" : report.getOutput())
                .errorMessage(success && answer != null ? null : lastError)
                .feasible(success)
                .error(!success)
                .timedOut(report != null && report.isTimedOut())
                .extractedAnswer(answer)
                .answerMatches(matches)
                .attempts(attempts)
                .build();
        log.info("Simulation finished after {} attempt(s): success={}, answer={}, matches={}",
                attempts, success, answer, matches);
        return result;
    }

    private static String failureReason(ExecutionReport report) {
        if (report.isTimedOut()) {
            return "Execution timed out. " + nullToEmpty(report.getError());
        }
        if (!report.isSuccess()) {
            return nullToEmpty(report.getError());
        }
        return "Program finished but printed no numeric answer. Output: " + nullToEmpty(report.getOutput());
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    private static void pauseBeforeNext(int attempts, RetryPolicy policy, BackOffExecution backOff) {
        if (attempts < policy.maxAttempts()) {
            Retries.pause(backOff.nextBackOff(), "Simulation");
        }
    }
}
