package com.synthetic.issuance.domain.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UnitOfWorkTest {

    private final Counter failures = new SimpleMeterRegistry().counter("failures");
    private final UnitOfWork uow = new UnitOfWork("op", Instant.EPOCH, failures);

    @Test
    @DisplayName("rollback replays reversals newest first")
    void rollbackLifo() {
        List<String> order = new ArrayList<>();
        uow.onRollback("a", () -> order.add("a"));
        uow.onRollback("b", () -> order.add("b"));
        uow.onRollback("c", () -> order.add("c"));

        uow.rollback(new RuntimeException("cause"));

        assertEquals(List.of("c", "b", "a"), order);
        assertFalse(uow.isActive());
    }

    @Test
    @DisplayName("a failing reversal does not stop the rest")
    void failingReversalContinues() {
        List<String> order = new ArrayList<>();
        RuntimeException cause = new RuntimeException("cause");
        uow.onRollback("a", () -> order.add("a"));
        uow.onRollback("broken", () -> {
            throw new IllegalStateException("refused");
        });

        uow.rollback(cause);

        assertEquals(List.of("a"), order);
        assertEquals(1, cause.getSuppressed().length);
        assertEquals(1.0, failures.count());
    }

    @Test
    @DisplayName("after-commit actions run on commit only")
    void afterCommit() {
        List<String> ran = new ArrayList<>();
        uow.afterCommit(() -> ran.add("event"));
        uow.onRollback("undo", () -> ran.add("undo"));

        uow.commit();
        uow.rollback(null);

        assertEquals(List.of("event"), ran);
    }

    @Test
    @DisplayName("after-commit actions are dropped on rollback")
    void afterCommitDroppedOnRollback() {
        List<String> ran = new ArrayList<>();
        uow.afterCommit(() -> ran.add("event"));

        uow.rollback(null);

        assertTrue(ran.isEmpty());
    }

    @Test
    @DisplayName("a failing after-commit action does not undo the commit")
    void afterCommitFailureSwallowed() {
        List<String> ran = new ArrayList<>();
        uow.afterCommit(() -> {
            throw new IllegalStateException("sink down");
        });
        uow.afterCommit(() -> ran.add("second"));

        assertDoesNotThrow(uow::commit);
        assertEquals(List.of("second"), ran);
    }

    @Test
    @DisplayName("registering after completion is an error")
    void closed() {
        uow.commit();
        assertThrows(IllegalStateException.class, () -> uow.onRollback("late", () -> { }));
        assertThrows(IllegalStateException.class, uow::commit);
    }
}
