package com.ryuqq.fsmkit.testkit.contract;

import com.ryuqq.fsmkit.core.exception.TransitionLogStoreException;
import com.ryuqq.fsmkit.core.log.TransitionLog;
import com.ryuqq.fsmkit.core.spi.TransitionLogStore;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test double for {@link TransitionLogStore} that records every call and can inject failures.
 *
 * <p><strong>Recorded data:</strong></p>
 * <ul>
 *   <li>Number of get/put calls</li>
 *   <li>Keys passed to put, in call order</li>
 * </ul>
 *
 * <p><strong>Failure injection:</strong></p>
 * <ul>
 *   <li>{@link #failGets(boolean)}: every get throws {@link TransitionLogStoreException}</li>
 *   <li>{@link #failPuts(boolean)}: every put throws {@link TransitionLogStoreException}</li>
 * </ul>
 *
 * <p>Writes use last-write-wins semantics, matching the simplest store a caller might supply.</p>
 *
 * @author FsmKit Team
 * @since 1.0.0
 */
public class RecordingTransitionLogStore implements TransitionLogStore {

    private final ConcurrentHashMap<String, TransitionLog> logs = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<String> putKeys = new CopyOnWriteArrayList<>();
    private final AtomicInteger getCount = new AtomicInteger();
    private final AtomicInteger putCount = new AtomicInteger();
    private final AtomicBoolean failGets = new AtomicBoolean();
    private final AtomicBoolean failPuts = new AtomicBoolean();

    @Override
    public Optional<TransitionLog> get(String key) throws TransitionLogStoreException {
        getCount.incrementAndGet();
        if (failGets.get()) {
            throw new TransitionLogStoreException("injected get failure for key " + key);
        }
        return Optional.ofNullable(logs.get(key));
    }

    @Override
    public void put(String key, TransitionLog transitionLog) throws TransitionLogStoreException {
        putCount.incrementAndGet();
        if (failPuts.get()) {
            throw new TransitionLogStoreException("injected put failure for key " + key);
        }
        putKeys.add(key);
        logs.put(key, transitionLog);
    }

    /**
     * Enables or disables get failures.
     *
     * @param fail true to make every get throw
     */
    public void failGets(boolean fail) {
        failGets.set(fail);
    }

    /**
     * Enables or disables put failures.
     *
     * @param fail true to make every put throw
     */
    public void failPuts(boolean fail) {
        failPuts.set(fail);
    }

    public int getCount() {
        return getCount.get();
    }

    public int putCount() {
        return putCount.get();
    }

    public List<String> putKeys() {
        return List.copyOf(putKeys);
    }

    public int size() {
        return logs.size();
    }

    /**
     * Clears stored logs, counters and injected failures.
     */
    public void clear() {
        logs.clear();
        putKeys.clear();
        getCount.set(0);
        putCount.set(0);
        failGets.set(false);
        failPuts.set(false);
    }
}
