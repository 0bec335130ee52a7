package com.vivek.core.scheduler;

import com.vivek.core.model.ExecutionMode;
import com.vivek.core.model.WorkItem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class DependencySchedulerTest {

    private final DependencyScheduler scheduler = new DependencyScheduler();

    private static WorkItem item(String id, Integer... deps) {
        return new WorkItem(id, "src/" + id + ".java", ExecutionMode.CODER, "Write " + id, Arrays.asList(deps));
    }

    private static List<String> ids(List<WorkItem> items) {
        return items.stream().map(WorkItem::id).toList();
    }

    @Nested
    @DisplayName("ordering")
    class Ordering {

        @Test
        @DisplayName("siblings sharing one dependency form a single batch after it")
        void fanOut() {
            var schedule = scheduler.schedule(List.of(item("A"), item("B", 0), item("C", 0)));

            assertEquals(2, schedule.batches().size());
            assertEquals(List.of("A"), ids(schedule.batches().get(0)));
            assertEquals(List.of("B", "C"), ids(schedule.batches().get(1)));
            assertEquals(List.of("A", "B", "C"), ids(schedule.order()));
            assertEquals(3, schedule.size());
        }

        @Test
        void independentItemsKeepPlanOrder() {
            var schedule = scheduler.schedule(List.of(item("X"), item("Y"), item("Z")));
            assertEquals(1, schedule.batches().size());
            assertEquals(List.of("X", "Y", "Z"), ids(schedule.order()));
        }

        @Test
        void diamond() {
            var schedule = scheduler.schedule(List.of(
                    item("D", 1, 2), item("B", 3), item("C", 3), item("A")));
            assertEquals(List.of("A", "B", "C", "D"), ids(schedule.order()));
            assertEquals(3, schedule.batches().size());
        }

        @Test
        void duplicateDependencyIndicesCountOnce() {
            var schedule = scheduler.schedule(List.of(item("A"), item("B", 0, 0)));
            assertEquals(List.of("A", "B"), ids(schedule.order()));
        }

        @Test
        @DisplayName("random acyclic plans: every item appears once, after its dependencies")
        void randomDagsRespectDependencies() {
            var random = new Random(42);
            for (int round = 0; round < 200; round++) {
                int n = 1 + random.nextInt(12);
                // Dependencies only point to higher indices so the graph stays acyclic.
                var items = new ArrayList<WorkItem>();
                for (int i = 0; i < n; i++) {
                    var deps = new ArrayList<Integer>();
                    for (int j = i + 1; j < n; j++) {
                        if (random.nextInt(4) == 0) {
                            deps.add(j);
                        }
                    }
                    items.add(item("I" + i, deps.toArray(Integer[]::new)));
                }

                var schedule = scheduler.schedule(items);
                var order = schedule.order();
                assertEquals(n, order.size());
                assertEquals(n, order.stream().map(WorkItem::id).distinct().count());

                var batchOf = new HashMap<String, Integer>();
                for (int b = 0; b < schedule.batches().size(); b++) {
                    for (WorkItem w : schedule.batches().get(b)) {
                        batchOf.put(w.id(), b);
                    }
                }
                for (WorkItem w : items) {
                    for (int dep : w.dependencyIds()) {
                        assertTrue(batchOf.get(items.get(dep).id()) < batchOf.get(w.id()),
                                () -> w.id() + " scheduled before dependency " + dep);
                    }
                }
            }
        }
    }

    @Nested
    @DisplayName("invalid plans")
    class Invalid {

        @Test
        void cycleNamesStuckItems() {
            var ex = assertThrows(PlanInvalidException.class,
                    () -> scheduler.schedule(List.of(item("A", 1), item("B", 0), item("C"))));
            assertTrue(ex.getMessage().contains("A"));
            assertTrue(ex.getMessage().contains("B"));
            assertFalse(ex.getMessage().contains("C"));
        }

        @Test
        void selfDependency() {
            assertThrows(PlanInvalidException.class, () -> scheduler.schedule(List.of(item("A", 0))));
        }

        @Test
        void outOfRangeDependency() {
            assertThrows(PlanInvalidException.class, () -> scheduler.schedule(List.of(item("A", 1))));
            assertThrows(PlanInvalidException.class, () -> scheduler.schedule(List.of(item("A", -1))));
        }

        @Test
        void duplicateIds() {
            assertThrows(PlanInvalidException.class, () -> scheduler.schedule(List.of(item("A"), item("A"))));
        }

        @Test
        void emptyPlan() {
            assertThrows(PlanInvalidException.class, () -> scheduler.schedule(List.of()));
            assertThrows(PlanInvalidException.class, () -> scheduler.schedule(null));
        }

        @Test
        void missingFields() {
            var noPath = new WorkItem("A", " ", ExecutionMode.CODER, "desc", List.of());
            var noDescription = new WorkItem("A", "a.java", ExecutionMode.CODER, "", List.of());
            var noId = new WorkItem(null, "a.java", ExecutionMode.CODER, "desc", List.of());
            assertThrows(PlanInvalidException.class, () -> scheduler.validate(List.of(noPath)));
            assertThrows(PlanInvalidException.class, () -> scheduler.validate(List.of(noDescription)));
            assertThrows(PlanInvalidException.class, () -> scheduler.validate(List.of(noId)));
        }
    }
}
