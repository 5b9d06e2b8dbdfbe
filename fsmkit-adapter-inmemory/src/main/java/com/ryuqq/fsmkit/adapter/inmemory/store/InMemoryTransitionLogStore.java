package com.ryuqq.fsmkit.adapter.inmemory.store;

import com.ryuqq.fsmkit.core.exception.TransitionLogStoreException;
import com.ryuqq.fsmkit.core.log.TransitionLog;
import com.ryuqq.fsmkit.core.spi.TransitionLogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link TransitionLogStore} for testing and reference purposes.
 *
 * <p>This implementation provides thread-safe idempotency record storage
 * using {@link ConcurrentHashMap}. With {@link InMemoryStoreConfig.WritePolicy#FIRST_WRITE_WINS}
 * (the default) writes go through {@link ConcurrentHashMap#putIfAbsent}, so the first
 * recorded outcome for a key is the one every later retry observes, even when two
 * retries race past {@code get}.</p>
 *
 * <p><strong>Write Policies:</strong></p>
 * <ul>
 *   <li>FIRST_WRITE_WINS: atomic put-if-absent, later writes for the key are ignored</li>
 *   <li>LAST_WRITE_WINS: plain overwrite</li>
 * </ul>
 *
 * <p><strong>Capacity:</strong> a put of a new key beyond {@code maxEntries} fails with
 * {@link TransitionLogStoreException}. Existing keys can always be rewritten.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>No expiry of old keys</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * TransitionLogStore store = new InMemoryTransitionLogStore();
 * IdempotentMachine im = IdempotentMachine.create(machine, store, IdempotencyKeys.fingerprint());
 * </pre>
 *
 * @author FsmKit Team
 * @since 1.0.0
 */
public class InMemoryTransitionLogStore implements TransitionLogStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTransitionLogStore.class);

    /**
     * Idempotency key → TransitionLog storage.
     */
    private final ConcurrentHashMap<String, TransitionLog> logs;

    private final InMemoryStoreConfig config;

    /**
     * Creates a new store with the default configuration.
     */
    public InMemoryTransitionLogStore() {
        this(new InMemoryStoreConfig());
    }

    /**
     * Creates a new store with the given configuration.
     *
     * @param config store configuration
     * @throws IllegalArgumentException if config is null
     */
    public InMemoryTransitionLogStore(InMemoryStoreConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.logs = new ConcurrentHashMap<>();
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalArgumentException if key is null
     */
    @Override
    public Optional<TransitionLog> get(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return Optional.ofNullable(logs.get(key));
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>FIRST_WRITE_WINS: {@link ConcurrentHashMap#putIfAbsent}</li>
     *   <li>LAST_WRITE_WINS: {@link ConcurrentHashMap#put}</li>
     *   <li>Capacity check is best-effort under concurrent writers of distinct new keys</li>
     * </ul>
     *
     * @throws IllegalArgumentException if key or transitionLog is null
     * @throws TransitionLogStoreException if the store is full and key is new
     */
    @Override
    public void put(String key, TransitionLog transitionLog) throws TransitionLogStoreException {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (transitionLog == null) {
            throw new IllegalArgumentException("transitionLog cannot be null");
        }

        if (!logs.containsKey(key) && logs.size() >= config.maxEntries()) {
            log.warn("Rejected transition log for key {}: capacity {} reached",
                key, config.maxEntries());
            throw new TransitionLogStoreException(
                "in-memory store capacity exceeded (maxEntries: " + config.maxEntries() + ")");
        }

        if (config.writePolicy() == InMemoryStoreConfig.WritePolicy.FIRST_WRITE_WINS) {
            TransitionLog existing = logs.putIfAbsent(key, transitionLog);
            if (existing != null && !existing.equals(transitionLog)) {
                log.debug("Ignored write for key {}: first write already recorded", key);
            }
            return;
        }
        logs.put(key, transitionLog);
    }

    /**
     * Returns the active configuration.
     *
     * @return store configuration
     */
    public InMemoryStoreConfig config() {
        return config;
    }

    /**
     * Clears all stored transition logs.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public void clear() {
        logs.clear();
    }

    /**
     * Returns the number of stored keys.
     *
     * @return the number of keys
     */
    public int size() {
        return logs.size();
    }
}
