package com.vivek.core.iteration;

import com.vivek.core.context.ContextCategory;
import com.vivek.core.context.ContextCursor;
import com.vivek.core.context.ContextStore;
import com.vivek.core.context.StoreInvariantException;
import com.vivek.core.gateway.Generator;
import com.vivek.core.gateway.Reviewer;
import com.vivek.core.llm.LlmProperties;
import com.vivek.core.logging.MdcContext;
import com.vivek.core.metrics.VivekMetrics;
import com.vivek.core.model.FailureReason;
import com.vivek.core.model.QualityJudgment;
import com.vivek.core.model.QualityPolicy;
import com.vivek.core.model.SamplingParams;
import com.vivek.core.model.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Drives one work item through generate, review and refine until a candidate meets the
 * item's quality threshold or the iteration budget runs out.
 *
 * <p>Each iteration builds a prompt from the item and its retrieved history, generates a
 * candidate, and reviews it against the user's request. Acceptance is decided here from the
 * review score and the mode's {@link QualityPolicy}; the reviewer's own pass flag is ignored.
 * Every generation is recorded as an {@code action} item under the item's task. Rejected
 * candidates leave their feedback as a {@code learning} item, so the next prompt picks it up.
 * The accepted candidate is recorded as a {@code result} item and completes the task.
 */
@Service
public class IterationController {

    private static final Logger log = LoggerFactory.getLogger(IterationController.class);

    private final Generator generator;
    private final Reviewer reviewer;
    private final PromptBuilder promptBuilder;
    private final TransportRetry transportRetry;
    private final QualityProperties qualityProperties;
    private final LlmProperties llmProperties;
    private final VivekMetrics metrics;

    public IterationController(Generator generator, Reviewer reviewer, PromptBuilder promptBuilder,
                               TransportRetry transportRetry, QualityProperties qualityProperties,
                               LlmProperties llmProperties, VivekMetrics metrics) {
        this.generator = generator;
        this.reviewer = reviewer;
        this.promptBuilder = promptBuilder;
        this.transportRetry = transportRetry;
        this.qualityProperties = qualityProperties;
        this.llmProperties = llmProperties;
        this.metrics = metrics;
    }

    /**
     * Runs the loop for {@code item} against the task the cursor points at.
     *
     * @return the accepted candidate
     * @throws QualityExhaustedException when no candidate passed within the iteration budget
     * @throws TransportException        when generator or reviewer stayed unreachable after retries
     * @throws StoreInvariantException   when the cursor does not point at an existing task
     */
    public IterationOutcome execute(WorkItem item, String request, ContextStore store, ContextCursor cursor,
                                    IterationListener listener) {
        String taskId = cursor.taskId();
        if (taskId == null || store.getTask(taskId).isEmpty()) {
            throw new StoreInvariantException("No task for work item " + item.id() + " at cursor " + cursor);
        }

        QualityPolicy policy = qualityProperties.policyFor(item.mode());
        SamplingParams sampling = llmProperties.samplingFor(item.mode());
        String mode = item.mode().label();
        String reviewRequest = reviewRequest(request, item);
        List<String> tags = item.effectiveTags();
        var machine = new IterationMachine(policy.maxIterations());

        log.info("Work item {} [{}] {}: threshold={}, maxIterations={}",
                item.id(), mode, item.filePath(), policy.threshold(), policy.maxIterations());

        while (true) {
            transition(listener, item, machine, machine::startGenerating);
            int iteration = machine.iterations() + 1;
            MdcContext.setIteration(iteration);

            var prompt = promptBuilder.build(item, store, cursor);
            metrics.recordRetrievalHits(prompt.history().size());
            log.debug("Iteration {} prompt: ~{} tokens, {} history entries",
                    iteration, prompt.estimatedTokens(), prompt.history().size());

            String candidate;
            QualityJudgment judgment;
            try {
                candidate = transportRetry.execute("generate " + item.id(),
                        () -> generator.generate(prompt.text(), sampling),
                        retry -> metrics.recordTransportRetry("generate"));
                transition(listener, item, machine, machine::candidateGenerated);
                store.addItem(actionContent(item, iteration, candidate), ContextCategory.ACTION, tags, taskId);

                QualityJudgment review = transportRetry.execute("review " + item.id(),
                        () -> reviewer.review(reviewRequest, candidate, item.mode()),
                        retry -> metrics.recordTransportRetry("review"));
                judgment = QualityJudgment.of(review.score(), review.feedback(), policy);
                if (judgment.passed() != review.passed()) {
                    log.debug("Reviewer verdict for {} overridden: score {} against threshold {}",
                            item.id(), format(review.score()), policy.threshold());
                }
            } catch (TransportException e) {
                transition(listener, item, machine, machine::transportFailed);
                metrics.incrementEscalations(FailureReason.TRANSPORT_EXHAUSTED.name());
                log.error("Work item {} failed on transport after {} iteration(s): {}",
                        item.id(), machine.iterations(), e.getMessage());
                throw e;
            }

            QualityJudgment verdict = judgment;
            IterationState next = transition(listener, item, machine, () -> machine.judged(verdict));
            metrics.recordJudgment(mode, judgment.passed(), judgment.score());

            switch (next) {
                case ACCEPTED -> {
                    log.info("Work item {} ACCEPTED on iteration {} (score {})",
                            item.id(), machine.iterations(), format(judgment.score()));
                    store.addItem(resultContent(item, judgment, candidate), ContextCategory.RESULT, tags, taskId);
                    store.completeTask(taskId, candidate);
                    metrics.recordIterationDepth(machine.iterations());
                    return new IterationOutcome(candidate, machine.iterations(), judgment);
                }
                case EXHAUSTED -> {
                    log.warn("Work item {} EXHAUSTED after {} iteration(s), last score {}",
                            item.id(), machine.iterations(), format(judgment.score()));
                    metrics.recordIterationDepth(machine.iterations());
                    metrics.incrementEscalations(FailureReason.QUALITY_EXHAUSTED.name());
                    throw new QualityExhaustedException(item.id(), machine.iterations(), judgment);
                }
                default -> {
                    log.info("Work item {} rejected on iteration {} (score {}), refining",
                            item.id(), machine.iterations(), format(judgment.score()));
                    store.addItem(learningContent(item, machine.iterations(), judgment),
                            ContextCategory.LEARNING, tags, taskId);
                }
            }
        }
    }

    static String reviewRequest(String request, WorkItem item) {
        return request + "\n\nFile: " + item.filePath()
                + "\nMode: " + item.mode().label()
                + "\nTask: " + item.description();
    }

    private static String actionContent(WorkItem item, int iteration, String candidate) {
        return "Generated " + item.filePath() + " [" + item.mode().label() + "] iteration " + iteration
                + " (~" + TokenEstimator.estimate(candidate) + " tokens)";
    }

    private static String learningContent(WorkItem item, int iteration, QualityJudgment judgment) {
        return "Review of " + item.filePath() + " (iteration " + iteration + ", score "
                + format(judgment.score()) + "): " + judgment.feedback();
    }

    private static String resultContent(WorkItem item, QualityJudgment judgment, String candidate) {
        return "Accepted " + item.filePath() + " (score " + format(judgment.score()) + ")\n" + candidate;
    }

    private static String format(double score) {
        return String.format(Locale.ROOT, "%.2f", score);
    }

    private IterationState transition(IterationListener listener, WorkItem item, IterationMachine machine,
                                      Supplier<IterationState> step) {
        IterationState from = machine.state();
        IterationState to = step.get();
        log.debug("Work item {}: {} -> {}", item.id(), from, to);
        listener.onTransition(item, from, to, machine.iterations(), machine.lastJudgment());
        return to;
    }
}
