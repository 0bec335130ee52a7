package com.vivek.core.iteration;

import com.vivek.core.model.QualityJudgment;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IterationMachineTest {

    private static final QualityJudgment PASS = new QualityJudgment(0.9, true, "good");
    private static final QualityJudgment FAIL = new QualityJudgment(0.3, false, "missing tests");

    private static void cycle(IterationMachine machine, QualityJudgment judgment) {
        machine.startGenerating();
        machine.candidateGenerated();
        machine.judged(judgment);
    }

    @Test
    void acceptedOnFirstPass() {
        var machine = new IterationMachine(3);
        assertEquals(IterationState.PENDING, machine.state());
        assertEquals(IterationState.GENERATING, machine.startGenerating());
        assertEquals(IterationState.REVIEWING, machine.candidateGenerated());
        assertEquals(IterationState.ACCEPTED, machine.judged(PASS));
        assertEquals(1, machine.iterations());
        assertSame(PASS, machine.lastJudgment());
        assertTrue(machine.state().isTerminal());
    }

    @Test
    @DisplayName("failed reviews refine until the budget is spent")
    void exhaustsAfterMaxIterations() {
        var machine = new IterationMachine(3);
        cycle(machine, FAIL);
        assertEquals(IterationState.REFINING, machine.state());
        cycle(machine, FAIL);
        assertEquals(IterationState.REFINING, machine.state());
        cycle(machine, FAIL);
        assertEquals(IterationState.EXHAUSTED, machine.state());
        assertEquals(3, machine.iterations());
        assertFalse(machine.exhaustedByTransport());
    }

    @Test
    void singleIterationBudget() {
        var machine = new IterationMachine(1);
        cycle(machine, FAIL);
        assertEquals(IterationState.EXHAUSTED, machine.state());
    }

    @Test
    void acceptedAfterRefinement() {
        var machine = new IterationMachine(3);
        cycle(machine, FAIL);
        cycle(machine, PASS);
        assertEquals(IterationState.ACCEPTED, machine.state());
        assertEquals(2, machine.iterations());
    }

    @Test
    void transportFailureExhausts() {
        var machine = new IterationMachine(3);
        machine.startGenerating();
        assertEquals(IterationState.EXHAUSTED, machine.transportFailed());
        assertTrue(machine.exhaustedByTransport());
        assertEquals(0, machine.iterations());
    }

    @Test
    @DisplayName("out-of-order transitions are rejected")
    void illegalTransitions() {
        var machine = new IterationMachine(2);
        assertThrows(IllegalStateException.class, machine::candidateGenerated);
        assertThrows(IllegalStateException.class, () -> machine.judged(PASS));
        assertThrows(IllegalStateException.class, machine::transportFailed);

        cycle(machine, PASS);
        assertThrows(IllegalStateException.class, machine::startGenerating);
    }

    @Test
    void budgetMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new IterationMachine(0));
    }
}
