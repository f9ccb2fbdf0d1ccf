package com.libran.dictionary.merge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Compensating transaction for fragment relocation.
 * Each completed step registers an undo action; if a later step fails, or the transaction
 * is closed without {@link #markSuccess()}, the undo actions run in reverse order.
 *
 * <pre>
 * try (RelocationTransaction tx = new RelocationTransaction()) {
 *     for (String name : names) {
 *         tx.execute("move " + name, () -&gt; store.move(name, PENDING, MERGED),
 *                 () -&gt; store.move(name, MERGED, PENDING));
 *     }
 *     tx.markSuccess();
 * }
 * </pre>
 */
public class RelocationTransaction implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RelocationTransaction.class);

    private final Deque<CompensatingAction> compensationStack = new ArrayDeque<>();
    private boolean success = false;
    private boolean closed = false;
    private final List<String> failedCompensations = new ArrayList<>();
    private int completedSteps;

    /**
     * A step that may fail with an I/O error.
     */
    @FunctionalInterface
    public interface Step {
        void run() throws IOException;
    }

    /**
     * Runs a step and registers its compensation. If the step fails, every previously
     * registered compensation runs in reverse order and the failure is rethrown.
     */
    public void execute(String description, Step operation, Step compensation) throws IOException {
        if (closed) {
            throw new IllegalStateException("Transaction is already closed");
        }

        try {
            log.debug("relocation.step description='{}'", description);
            operation.run();
            completedSteps++;
            compensationStack.push(new CompensatingAction(description, compensation));
        } catch (IOException | RuntimeException e) {
            log.warn("relocation.stepFailed description='{}' error={}. Rolling back {} step(s)",
                    description, e.getMessage(), compensationStack.size());
            runCompensations();
            throw e;
        }
    }

    public void markSuccess() {
        this.success = true;
    }

    public boolean isSuccess() {
        return success;
    }

    public int completedSteps() {
        return completedSteps;
    }

    /**
     * Descriptions of the steps whose compensation failed, in the order they were undone.
     * A non-empty list means those steps still have effect and the store needs manual
     * attention.
     */
    public List<String> failedCompensations() {
        return List.copyOf(failedCompensations);
    }

    @Override
    public void close() {
        if (!closed && !success) {
            log.warn("relocation.closedWithoutSuccess pendingCompensations={}", compensationStack.size());
            runCompensations();
        }
        closed = true;
    }

    private void runCompensations() {
        while (!compensationStack.isEmpty()) {
            CompensatingAction action = compensationStack.pop();
            try {
                log.debug("relocation.compensate description='{}'", action.description);
                action.compensation.run();
            } catch (IOException | RuntimeException e) {
                failedCompensations.add(action.description);
                log.error("relocation.compensationFailed description='{}' error={}", action.description, e.getMessage());
            }
        }
    }

    private record CompensatingAction(String description, Step compensation) {}
}
