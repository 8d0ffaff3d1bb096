package com.oracle.optmcts.config;

import com.oracle.optmcts.core.RetryPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "optmcts")
@Data
public class OptMctsConfig {

    /**
     * Chat model provider: auto, openai, anthropic or google (google-genai is accepted).
     * Defaults to spring.ai.model.chat in application.yml, which decides which chat model exists.
     */
    private String provider = "auto";

    /**
     * Maximum search iterations per problem
     */
    private int iterationBudget = 20;

    /**
     * Local uncertainty above which a triggered node is re-expanded (eta)
     */
    private double reexpansionThreshold = 0.3;

    /**
     * UCB exploration weight
     */
    private double explorationConstant = 2.0;

    /**
     * Candidates requested per expansion
     */
    private int candidatesPerExpansion = 3;

    /**
     * Upper bound on alternatives kept under one node
     */
    private int maxChildrenPerNode = 5;

    /**
     * Candidates more similar than this to an existing sibling are pruned
     */
    private double similarityThreshold = 0.8;

    /**
     * Similarity strategy: "lexical" or "embedding"
     */
    private String similarity = "lexical";

    /**
     * Repeated judgments per evaluation (K)
     */
    private int judgmentSamples = 3;

    /**
     * Most recent knowledge base entries injected into an expansion prompt
     */
    private int guidanceWindow = 3;

    /**
     * Relative tolerance for the ground-truth comparison
     */
    private double answerTolerance = 0.10;

    /**
     * Temperature for formulation element generation
     */
    private double expansionTemperature = 0.7;

    /**
     * Temperature for code generation and repair
     */
    private double codeTemperature = 0.0;

    /**
     * Temperature for solution judgments
     */
    private double scoringTemperature = 0.5;

    /**
     * Timeout for each concurrent model call in seconds
     */
    private int modelCallTimeoutSeconds = 120;

    /**
     * Issue expansion candidates and judgments concurrently
     */
    private boolean parallelModelCalls = true;

    /**
     * Threads in the shared model-call pool
     */
    private int modelCallThreads = 6;

    /**
     * Retries for malformed or failed model calls
     */
    private RetryPolicy modelRetry = RetryPolicy.builder()
            .maxRetries(2)
            .initialBackoffMs(500)
            .build();

    /**
     * Repair-and-rerun attempts for generated code
     */
    private RetryPolicy executionRetry = RetryPolicy.immediate(12);
}
