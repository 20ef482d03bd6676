package com.synthetic.issuance.domain.service;

import com.synthetic.issuance.domain.error.ReentrancyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Scoped lock around the engine's mutating entry points.
 * <p>
 * The lock serializes callers from different threads. The {@code entered} flag rejects a second
 * guarded call on the thread that already holds the lock, which is what a token collaborator
 * calling back into the engine mid-transfer looks like.
 */
@Slf4j
@Component
public class ReentrancyGuard {

    private final ReentrantLock lock = new ReentrantLock();
    private boolean entered;

    public <T> T guarded(String operation, Supplier<T> body) {
        lock.lock();
        try {
            if (entered) {
                log.warn("[Guard] 재진입 차단: op={}, thread={}", operation, Thread.currentThread().getName());
                throw new ReentrancyException(operation);
            }
            entered = true;
            try {
                return body.get();
            } finally {
                entered = false;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs a read under the lock without claiming the guarded region, so collaborator callbacks
     * may still observe engine state.
     */
    public <T> T read(Supplier<T> body) {
        lock.lock();
        try {
            return body.get();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEntered() {
        lock.lock();
        try {
            return entered;
        } finally {
            lock.unlock();
        }
    }
}
