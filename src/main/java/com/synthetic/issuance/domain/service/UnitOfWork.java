package com.synthetic.issuance.domain.service;

import io.micrometer.core.instrument.Counter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Undo journal of one engine operation. Ledger mutations and completed collaborator interactions
 * register their reversal here; {@link #rollback(Throwable)} replays them newest first.
 * Not thread-safe: one instance lives inside one guarded call.
 */
@Slf4j
public final class UnitOfWork {

    private final String operation;
    private final Instant now;
    private final Counter compensationFailures;

    private final Deque<Undo> undoLog = new ArrayDeque<>();
    private final List<Runnable> afterCommit = new ArrayList<>();
    private State state = State.ACTIVE;

    public UnitOfWork(String operation, Instant now, Counter compensationFailures) {
        this.operation = operation;
        this.now = now;
        this.compensationFailures = compensationFailures;
    }

    public String operation() {
        return operation;
    }

    public Instant now() {
        return now;
    }

    public void onRollback(String description, Runnable undo) {
        requireActive();
        undoLog.push(new Undo(description, undo));
    }

    public void afterCommit(Runnable action) {
        requireActive();
        afterCommit.add(action);
    }

    public void commit() {
        requireActive();
        state = State.COMMITTED;
        undoLog.clear();
        for (Runnable action : afterCommit) {
            try {
                action.run();
            } catch (RuntimeException e) {
                log.error("[UnitOfWork] after-commit 작업 실패: op={}", operation, e);
            }
        }
        afterCommit.clear();
    }

    /**
     * Reverts everything registered so far. A reversal that throws is logged, counted and attached
     * to {@code cause} as suppressed; the remaining reversals still run.
     */
    public void rollback(Throwable cause) {
        if (state != State.ACTIVE) return;
        state = State.ROLLED_BACK;
        afterCommit.clear();

        while (!undoLog.isEmpty()) {
            Undo undo = undoLog.pop();
            try {
                undo.action().run();
            } catch (RuntimeException e) {
                compensationFailures.increment();
                log.error("[UnitOfWork] 보상 실패: op={}, step='{}'", operation, undo.description(), e);
                if (cause != null) {
                    cause.addSuppressed(e);
                }
            }
        }
    }

    public boolean isActive() {
        return state == State.ACTIVE;
    }

    private void requireActive() {
        if (state != State.ACTIVE) {
            throw new IllegalStateException("unit of work already " + state + ": " + operation);
        }
    }

    private enum State { ACTIVE, COMMITTED, ROLLED_BACK }

    private record Undo(String description, Runnable action) {}
}
