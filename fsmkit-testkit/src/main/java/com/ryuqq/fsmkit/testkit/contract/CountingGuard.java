package com.ryuqq.fsmkit.testkit.contract;

import com.ryuqq.fsmkit.core.guard.Guard;
import com.ryuqq.fsmkit.core.guard.GuardContext;
import com.ryuqq.fsmkit.core.guard.GuardDecision;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link Guard} wrapper that counts invocations and keeps the contexts it was given.
 *
 * <p>Used to verify that idempotent replays never re-evaluate guards.</p>
 *
 * @author FsmKit Team
 * @since 1.0.0
 */
public class CountingGuard implements Guard {

    private final Guard delegate;
    private final AtomicInteger invocations = new AtomicInteger();
    private final CopyOnWriteArrayList<GuardContext> contexts = new CopyOnWriteArrayList<>();

    /**
     * Creates a counting guard.
     *
     * @param delegate guard producing the actual decision
     * @throws IllegalArgumentException if delegate is null
     */
    public CountingGuard(Guard delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.delegate = delegate;
    }

    @Override
    public GuardDecision check(GuardContext context) {
        invocations.incrementAndGet();
        contexts.add(context);
        return delegate.check(context);
    }

    public int invocations() {
        return invocations.get();
    }

    public List<GuardContext> contexts() {
        return List.copyOf(contexts);
    }

    public void reset() {
        invocations.set(0);
        contexts.clear();
    }
}
