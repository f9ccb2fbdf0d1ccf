package com.libran.dictionary.merge;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the relocation compensating transaction.
 */
class RelocationTransactionTest {

    @Test
    void successfulTransaction_noCompensationsRun() throws IOException {
        List<String> log = new ArrayList<>();

        try (RelocationTransaction tx = new RelocationTransaction()) {
            tx.execute("step1", () -> log.add("op1"), () -> log.add("comp1"));
            tx.execute("step2", () -> log.add("op2"), () -> log.add("comp2"));
            tx.markSuccess();
            assertEquals(2, tx.completedSteps());
        }

        assertEquals(List.of("op1", "op2"), log);
    }

    @Test
    void failedStep_runsCompensationsInReverse() {
        List<String> log = new ArrayList<>();

        assertThrows(IOException.class, () -> {
            try (RelocationTransaction tx = new RelocationTransaction()) {
                tx.execute("step1", () -> log.add("op1"), () -> log.add("comp1"));
                tx.execute("step2", () -> log.add("op2"), () -> log.add("comp2"));
                tx.execute("step3", () -> {
                    throw new IOException("step3 failed");
                }, () -> log.add("comp3"));
            }
        });

        assertEquals(List.of("op1", "op2", "comp2", "comp1"), log);
    }

    @Test
    void closedWithoutSuccess_runsAllCompensations() throws IOException {
        List<String> log = new ArrayList<>();

        RelocationTransaction tx = new RelocationTransaction();
        tx.execute("step1", () -> log.add("op1"), () -> log.add("comp1"));
        tx.execute("step2", () -> log.add("op2"), () -> log.add("comp2"));
        tx.close();

        assertEquals(List.of("op1", "op2", "comp2", "comp1"), log);
        assertFalse(tx.isSuccess());
    }

    @Test
    void compensationFailure_continuesRemainingCompensations() throws IOException {
        List<String> log = new ArrayList<>();

        RelocationTransaction tx = new RelocationTransaction();
        tx.execute("step1", () -> log.add("op1"), () -> log.add("comp1"));
        tx.execute("step2", () -> log.add("op2"), () -> {
            throw new IOException("compensation failed");
        });
        tx.close();

        assertEquals(List.of("op1", "op2", "comp1"), log);
        assertEquals(List.of("step2"), tx.failedCompensations());
    }

    @Test
    void executeAfterClose_throws() {
        RelocationTransaction tx = new RelocationTransaction();
        tx.markSuccess();
        tx.close();

        assertThrows(IllegalStateException.class, () -> tx.execute("late", () -> {}, () -> {}));
    }
}
