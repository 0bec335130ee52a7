package com.vivek.core.llm;

import com.vivek.core.gateway.Reviewer;
import com.vivek.core.iteration.QualityProperties;
import com.vivek.core.iteration.TransportException;
import com.vivek.core.model.ExecutionMode;
import com.vivek.core.model.QualityJudgment;
import com.vivek.core.model.QualityPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * {@link Reviewer} that asks the chat model for a structured verdict, using the sampling and
 * quality threshold of the item's mode. Without a mode, {@code coder} settings apply.
 * <p>
 * A reply that cannot be parsed counts as a failing review with score 0, so the refine loop
 * keeps going. An unreachable model or an empty reply is a {@link TransportException}.
 */
@Component
public class LlmReviewer implements Reviewer {

    private static final Logger log = LoggerFactory.getLogger(LlmReviewer.class);

    private static final String SYSTEM_PROMPT = """
            You are a strict code reviewer. Judge whether the candidate file fully and correctly \
            satisfies the request and task. Give a score between 0.0 and 1.0, list concrete issues \
            and actionable suggestions, and summarize your assessment.""";

    private final LlmService llmService;
    private final LlmProperties llmProperties;
    private final QualityProperties qualityProperties;

    public LlmReviewer(LlmService llmService, LlmProperties llmProperties, QualityProperties qualityProperties) {
        this.llmService = llmService;
        this.llmProperties = llmProperties;
        this.qualityProperties = qualityProperties;
    }

    @Override
    public QualityJudgment review(String request, String candidate) {
        return review(request, candidate, ExecutionMode.CODER);
    }

    @Override
    public QualityJudgment review(String request, String candidate, ExecutionMode mode) {
        QualityPolicy policy = qualityProperties.policyFor(mode);
        String userPrompt = "Request:\n" + request + "\n\nCandidate:\n" + candidate;
        ReviewVerdict verdict;
        try {
            verdict = llmService.structuredCall(SYSTEM_PROMPT, userPrompt, ReviewVerdict.class,
                    llmProperties.samplingFor(mode));
        } catch (LlmParseException e) {
            log.warn("Unparseable review verdict, treating as failed review: {}", e.getMessage());
            return new QualityJudgment(0.0, false, "Review could not be parsed: " + e.getMessage());
        } catch (LlmEmptyResponseException e) {
            throw new TransportException("Reviewer returned no content", e);
        } catch (RuntimeException e) {
            throw new TransportException("Reviewer call failed: " + e.getMessage(), e);
        }
        if (verdict == null) {
            log.warn("Null review verdict, treating as failed review");
            return new QualityJudgment(0.0, false, "Reviewer returned no verdict");
        }

        double score = normalizeScore(verdict.score());
        var judgment = QualityJudgment.of(score, feedback(verdict), policy);
        log.info("Review {} [{}]: score {} against threshold {}",
                judgment.passed() ? "PASSED" : "FAILED", mode.label(), score, policy.threshold());
        return judgment;
    }

    static double normalizeScore(double raw) {
        if (Double.isNaN(raw) || raw <= 0.0) {
            return 0.0;
        }
        double score = raw > 1.0 ? raw / 10.0 : raw;
        return Math.min(1.0, score);
    }

    static String feedback(ReviewVerdict verdict) {
        var text = new StringBuilder();
        if (verdict.summary() != null && !verdict.summary().isBlank()) {
            text.append(verdict.summary().trim());
        }
        appendList(text, "Issues", verdict.issues());
        appendList(text, "Suggestions", verdict.suggestions());
        return text.toString();
    }

    private static void appendList(StringBuilder text, String heading, List<String> entries) {
        if (entries == null || entries.isEmpty()) {
            return;
        }
        if (text.length() > 0) {
            text.append('\n');
        }
        text.append(heading).append(':');
        for (String entry : entries) {
            text.append("\n- ").append(entry);
        }
    }
}
