package com.ttp.trust.engine;

import com.ttp.trust.api.Truncation;
import org.junit.Test;

import static org.junit.Assert.*;

public class WorkBudgetTest {

    @Test
    public void testNodeBudget() {
        WorkBudget budget = new WorkBudget(2, 10_000);
        assertTrue(budget.tryVisit());
        assertTrue(budget.tryVisit());
        assertFalse(budget.tryVisit());
        assertEquals(2, budget.visited());
        assertEquals(Truncation.NODE_BUDGET, budget.truncation());
        assertTrue(budget.isCancelled());
    }

    @Test
    public void testFirstReasonSticks() {
        WorkBudget budget = new WorkBudget(10, 10_000);
        budget.markFanOutLimited();
        assertEquals(Truncation.FAN_OUT, budget.truncation());
        assertTrue(budget.tryVisit());

        budget.cancel(Truncation.DEADLINE);
        budget.cancel(Truncation.NODE_BUDGET);
        assertEquals(Truncation.DEADLINE, budget.truncation());
        assertFalse(budget.tryVisit());
    }

    @Test
    public void testDeadline() throws InterruptedException {
        WorkBudget budget = new WorkBudget(10, 1);
        Thread.sleep(20);
        assertFalse(budget.tryVisit());
        assertEquals(Truncation.DEADLINE, budget.truncation());
        assertEquals(0L, budget.remainingNanos());
    }
}
