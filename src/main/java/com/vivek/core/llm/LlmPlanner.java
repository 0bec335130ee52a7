package com.vivek.core.llm;

import com.vivek.core.gateway.Planner;
import com.vivek.core.iteration.TransportException;
import com.vivek.core.model.ExecutionMode;
import com.vivek.core.model.FileStatus;
import com.vivek.core.model.WorkItem;
import com.vivek.core.scheduler.PlanInvalidException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link Planner} that asks the chat model for a structured plan and assigns item ids
 * ({@code ITEM-001}, {@code ITEM-002}, ...) in plan order.
 */
@Component
public class LlmPlanner implements Planner {

    private static final Logger log = LoggerFactory.getLogger(LlmPlanner.class);

    private static final String SYSTEM_PROMPT = """
            You are a software architect. Break the request into the smallest set of work items, \
            one file per item. Use mode "coder" for implementation files and "sdet" for test files. \
            Express dependencies as zero-based indices into your own list; never create cycles. \
            Give each item a few short retrieval tags describing its concerns.""";

    private final LlmService llmService;
    private final LlmProperties properties;

    public LlmPlanner(LlmService llmService, LlmProperties properties) {
        this.llmService = llmService;
        this.properties = properties;
    }

    @Override
    public List<WorkItem> plan(String request) {
        PlanDraft draft;
        try {
            draft = llmService.structuredCall(SYSTEM_PROMPT, request, PlanDraft.class, properties.plannerSampling());
        } catch (LlmParseException e) {
            throw new PlanInvalidException("Planner output could not be parsed: " + e.getMessage(), e);
        } catch (LlmEmptyResponseException e) {
            throw new TransportException("Planner returned no content", e);
        } catch (RuntimeException e) {
            throw new TransportException("Planner call failed: " + e.getMessage(), e);
        }
        if (draft == null || draft.workItems() == null || draft.workItems().isEmpty()) {
            throw new PlanInvalidException("Planner produced no work items");
        }
        List<WorkItem> items = toWorkItems(draft.workItems());
        log.info("Planner produced {} work items", items.size());
        return items;
    }

    static List<WorkItem> toWorkItems(List<PlanDraft.PlannedItem> planned) {
        var items = new ArrayList<WorkItem>(planned.size());
        for (int i = 0; i < planned.size(); i++) {
            var p = planned.get(i);
            if (p == null) {
                throw new PlanInvalidException("Planner produced an empty work item at index " + i);
            }
            try {
                items.add(new WorkItem(
                        "ITEM-%03d".formatted(i + 1),
                        p.filePath(),
                        FileStatus.fromValue(p.fileStatus()),
                        ExecutionMode.fromValue(p.mode()),
                        p.description(),
                        p.dependencies(),
                        p.tags(),
                        p.language()));
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new PlanInvalidException("Invalid work item at index " + i + ": " + e.getMessage(), e);
            }
        }
        return items;
    }
}
