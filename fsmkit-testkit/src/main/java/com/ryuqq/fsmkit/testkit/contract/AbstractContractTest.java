package com.ryuqq.fsmkit.testkit.contract;

import com.ryuqq.fsmkit.core.exception.FsmException;
import com.ryuqq.fsmkit.core.guard.GuardDecision;
import com.ryuqq.fsmkit.core.guard.Guards;
import com.ryuqq.fsmkit.core.idempotency.IdempotencyKeyFunction;
import com.ryuqq.fsmkit.core.idempotency.IdempotentMachine;
import com.ryuqq.fsmkit.core.log.TransitionLog;
import com.ryuqq.fsmkit.core.machine.Machine;
import com.ryuqq.fsmkit.core.machine.Transition;
import com.ryuqq.fsmkit.core.machine.TransitionResult;
import com.ryuqq.fsmkit.core.model.Event;
import com.ryuqq.fsmkit.core.model.State;
import com.ryuqq.fsmkit.core.spi.TransitionLogStore;
import org.junit.jupiter.api.BeforeEach;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Abstract base class for Contract Tests.
 *
 * <p>This class provides a "transfer-intent" machine, counting guards and helper methods
 * shared by contract and scenario tests. Subclasses decide which
 * {@link TransitionLogStore} implementation is exercised.</p>
 *
 * <p><strong>Fixture Machine ("transfer-intent"):</strong></p>
 * <pre>
 * PENDING   --SUBMIT--&gt;  SUBMITTED   (submitGuard: always allow)
 * SUBMITTED --APPROVE--&gt; APPROVED    (approveGuard: meta "approver" required)
 * SUBMITTED --CANCEL--&gt;  CANCELLED   (no guard)
 * </pre>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * public class MyStoreContractTest extends AbstractContractTest {
 *     {@literal @}Override
 *     protected TransitionLogStore createStore() {
 *         return new MyStore();
 *     }
 * }
 * </pre>
 *
 * @author FsmKit Team
 * @since 1.0.0
 */
public abstract class AbstractContractTest {

    protected static final String MACHINE_NAME = "transfer-intent";
    protected static final Instant T0 = Instant.parse("2026-02-15T00:00:00Z");

    protected Machine machine;
    protected TransitionLogStore store;
    protected CountingGuard submitGuard;
    protected CountingGuard approveGuard;

    /**
     * Creates the store under test. Called once per test.
     *
     * @return a fresh, empty store
     */
    protected abstract TransitionLogStore createStore();

    /**
     * Sets up test fixtures before each test.
     *
     * @throws FsmException if the fixture machine cannot be built
     */
    @BeforeEach
    void setUpFixtures() throws FsmException {
        store = createStore();
        submitGuard = new CountingGuard(Guards.allowAll());
        approveGuard = new CountingGuard(context -> context.meta().containsKey("approver")
            ? GuardDecision.allow()
            : GuardDecision.deny("approver_required"));

        machine = Machine.create(MACHINE_NAME);
        machine.setInitial(State.of("PENDING"));
        machine.register(Transition.of("PENDING", "SUBMIT", "SUBMITTED").named("submit").guardedBy(submitGuard));
        machine.register(Transition.of("SUBMITTED", "APPROVE", "APPROVED").named("approve").guardedBy(approveGuard));
        machine.register(Transition.of("SUBMITTED", "CANCEL", "CANCELLED").named("cancel"));
    }

    /**
     * Wraps the fixture machine with the store under test.
     *
     * @param keyFunction idempotency key function
     * @return idempotent machine
     * @throws FsmException never for non-null arguments
     */
    protected IdempotentMachine idempotent(IdempotencyKeyFunction keyFunction) throws FsmException {
        return IdempotentMachine.create(machine, store, keyFunction);
    }

    /**
     * Key function that ignores at, meta and input (one key per machine instance and event).
     *
     * @param eventId external event id
     * @return key function producing {@code machineId:event:<eventId>}
     */
    protected IdempotencyKeyFunction fixedEventKey(String eventId) {
        return (machineName, machineId, from, on, at, meta, input) -> machineId + ":event:" + eventId;
    }

    /**
     * Builds an insertion-ordered meta map from key/value pairs.
     *
     * @param keyValues alternating keys and values
     * @return mutable meta map
     */
    protected Map<String, String> meta(String... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("keyValues must be pairs");
        }
        Map<String, String> meta = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            meta.put(keyValues[i], keyValues[i + 1]);
        }
        return meta;
    }

    protected static State state(String value) {
        return State.of(value);
    }

    protected static Event event(String value) {
        return Event.of(value);
    }

    /**
     * Asserts that two logs are identical, field by field and canonically.
     *
     * @param expected the expected log
     * @param actual the actual log
     */
    protected void assertSameLog(TransitionLog expected, TransitionLog actual) {
        assertEquals(expected, actual, "Transition logs should be equal");
        assertEquals(expected.canonicalString(), actual.canonicalString(),
            "Canonical strings should be identical");
    }

    /**
     * Asserts an allowed result with the given next state.
     *
     * @param result the result
     * @param expectedNext expected next state value
     */
    protected void assertAllowed(TransitionResult result, String expectedNext) {
        assertTrue(result.isSuccess(),
            String.format("Expected success but got error: %s", result.error()));
        assertEquals(State.of(expectedNext), result.next());
        assertTrue(result.log().allowed(), "Log should be allowed");
    }
}
