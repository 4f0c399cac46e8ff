package edu.stanford.futuredata.tsquery.task;

import edu.stanford.futuredata.tsquery.TaskResponse;
import edu.stanford.futuredata.tsquery.utilities.ErrorKind;
import edu.stanford.futuredata.tsquery.utilities.QueryException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class TaskContextTest {

    private static class CountingMerger implements ResultMerger {
        final AtomicInteger merges = new AtomicInteger(0);
        final List<QueryException> completions = new ArrayList<>();
        int completeCalls = 0;

        @Override
        public void merge(TaskResponse response) {
            merges.incrementAndGet();
        }

        @Override
        public synchronized void complete(QueryException error) {
            completeCalls++;
            completions.add(error);
        }
    }

    private static TaskResponse completed() {
        return TaskResponse.newBuilder().setTaskID("t-1").setCompleted(true).build();
    }

    @Test
    public void testCompletesAfterExpectedResults() {
        CountingMerger merger = new CountingMerger();
        TaskContext ctx = new TaskContext("t-1", TaskType.ROOT, "n", "", 3, merger);
        assertFalse(ctx.receiveResult(completed()));
        assertFalse(ctx.receiveResult(TaskResponse.newBuilder().setTaskID("t-1").build()));
        assertFalse(ctx.receiveResult(completed()));
        assertFalse(ctx.isCompleted());
        assertTrue(ctx.receiveResult(completed()));
        assertTrue(ctx.isCompleted());
        assertTrue(ctx.isTerminal());
        assertEquals(4, merger.merges.get());
        assertEquals(1, merger.completeCalls);
        assertNull(merger.completions.get(0));
        assertTrue(ctx.getError().isEmpty());
    }

    @Test
    public void testErrorLatchesAndDropsLaterResults() {
        CountingMerger merger = new CountingMerger();
        TaskContext ctx = new TaskContext("t-1", TaskType.INTERMEDIATE, "n", "p-1", 3, merger);
        assertFalse(ctx.receiveResult(completed()));
        assertTrue(ctx.receiveResult(TaskResponse.newBuilder().setTaskID("t-1").setErrMsg("disk on fire").build()));
        assertTrue(ctx.isCompleted());
        assertFalse(ctx.receiveResult(completed()));
        assertFalse(ctx.receiveResult(TaskResponse.newBuilder().setTaskID("t-1").setErrMsg("second").build()));
        assertEquals(1, merger.merges.get());
        assertEquals(1, merger.completeCalls);
        assertEquals("disk on fire", merger.completions.get(0).getMessage());
        assertEquals(ErrorKind.EXECUTION, ctx.getError().orElseThrow().getKind());
    }

    @Test
    public void testDuplicateCompletionIsDropped() {
        CountingMerger merger = new CountingMerger();
        TaskContext ctx = new TaskContext("t-1", TaskType.ROOT, "n", "", 1, merger);
        assertTrue(ctx.receiveResult(completed()));
        assertFalse(ctx.receiveResult(completed()));
        assertEquals(1, merger.merges.get());
        assertEquals(1, merger.completeCalls);
    }

    @Test
    public void testFailIsOneShot() {
        CountingMerger merger = new CountingMerger();
        TaskContext ctx = new TaskContext("t-1", TaskType.ROOT, "n", "", 2, merger);
        assertTrue(ctx.fail(QueryException.timeout("t-1")));
        assertFalse(ctx.fail(QueryException.cancelled("t-1")));
        assertEquals(1, merger.completeCalls);
        assertEquals(ErrorKind.EXECUTION, ctx.getError().orElseThrow().getKind());
    }

    @Test
    public void testConcurrentCompletionsTerminateOnce() throws InterruptedException {
        int n = 64;
        CountingMerger merger = new CountingMerger();
        TaskContext ctx = new TaskContext("t-1", TaskType.ROOT, "n", "", n, merger);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger terminations = new AtomicInteger(0);
        for (int i = 0; i < n; i++) {
            pool.submit(() -> {
                start.await();
                if (ctx.receiveResult(completed())) {
                    terminations.incrementAndGet();
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        assertEquals(1, terminations.get());
        assertEquals(n, merger.merges.get());
        assertEquals(1, merger.completeCalls);
        assertTrue(ctx.isCompleted());
    }
}
