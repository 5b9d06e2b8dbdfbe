package com.ryuqq.fsmkit.core.machine;

import com.ryuqq.fsmkit.core.exception.ErrorKind;
import com.ryuqq.fsmkit.core.exception.FsmException;
import com.ryuqq.fsmkit.core.guard.GuardContext;
import com.ryuqq.fsmkit.core.guard.GuardDecision;
import com.ryuqq.fsmkit.core.guard.Guards;
import com.ryuqq.fsmkit.core.log.ReasonCode;
import com.ryuqq.fsmkit.core.model.Event;
import com.ryuqq.fsmkit.core.model.State;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Machine 구성 및 평가 테스트.
 *
 * @author FsmKit Team
 * @since 1.0.0
 */
class MachineTest {

    private static final Instant AT = Instant.parse("2026-02-15T00:00:00Z");

    private Machine machine;

    @BeforeEach
    void setUp() throws FsmException {
        machine = Machine.create("transfer-intent");
    }

    // ============================================================
    // 1. 생성
    // ============================================================

    @Test
    void create_NameTrimmed() throws FsmException {
        // When
        Machine m = Machine.create("  orders  ");

        // Then
        assertEquals("orders", m.name());
        assertTrue(m.transitions().isEmpty());
        assertTrue(m.initial().isEmpty());
    }

    @Test
    void create_NameLengthBoundary() throws FsmException {
        // When & Then
        assertEquals(128, Machine.create("m".repeat(128)).name().length());
        FsmException error = assertThrows(FsmException.class, () -> Machine.create("m".repeat(129)));
        assertEquals(ErrorKind.INVALID_MACHINE_NAME, error.kind());
    }

    @Test
    void create_BlankOrNullName_Rejected() {
        // When & Then
        assertTrue(assertThrows(FsmException.class, () -> Machine.create("   "))
            .is(ErrorKind.INVALID_MACHINE_NAME));
        assertTrue(assertThrows(FsmException.class, () -> Machine.create(null))
            .is(ErrorKind.INVALID_MACHINE_NAME));
    }

    @Test
    void setInitial_ValidState_Normalized() throws FsmException {
        // When
        machine.setInitial(State.of(" PENDING "));

        // Then
        assertEquals(State.of("PENDING"), machine.initial().orElseThrow());
    }

    @Test
    void setInitial_InvalidState_Rejected() {
        // When & Then
        FsmException error = assertThrows(FsmException.class, () -> machine.setInitial(State.of("BAD STATE")));
        assertEquals(ErrorKind.INVALID_STATE, error.kind());
        assertTrue(machine.initial().isEmpty());
    }

    // ============================================================
    // 2. 등록 / 조회
    // ============================================================

    @Test
    void register_ThenLookup_ReturnsTransition() throws FsmException {
        // Given
        machine.register(Transition.of("PENDING", "SUBMIT", "SUBMITTED").named("submit"));

        // When
        Transition found = machine.lookup(State.of("PENDING"), Event.of("SUBMIT")).orElseThrow();

        // Then
        assertEquals(State.of("SUBMITTED"), found.to());
        assertEquals("submit", found.name());
    }

    @Test
    void register_WhitespaceValues_StoredNormalized() throws FsmException {
        // Given
        machine.register(Transition.of(" PENDING ", "\tSUBMIT", "SUBMITTED  ").named(" submit "));

        // When
        Transition found = machine.lookup(State.of("PENDING"), Event.of("SUBMIT")).orElseThrow();

        // Then
        assertEquals(Transition.of("PENDING", "SUBMIT", "SUBMITTED").named("submit"), found);
        assertTrue(machine.lookup(State.of("  PENDING"), Event.of("SUBMIT ")).isPresent(),
            "Lookup normalizes its arguments");
    }

    @Test
    void register_DuplicateFromOn_RejectedRegardlessOfTarget() throws FsmException {
        // Given
        machine.register(Transition.of("PENDING", "SUBMIT", "SUBMITTED"));

        // When
        FsmException error = assertThrows(FsmException.class,
            () -> machine.register(Transition.of("PENDING", " SUBMIT ", "REJECTED")));

        // Then
        assertEquals(ErrorKind.DUPLICATE_TRANSITION, error.kind());
        assertEquals(State.of("SUBMITTED"),
            machine.lookup(State.of("PENDING"), Event.of("SUBMIT")).orElseThrow().to());
    }

    @Test
    void register_InvalidIdentifier_Rejected() {
        // When & Then
        assertEquals(ErrorKind.INVALID_TRANSITION, assertThrows(FsmException.class,
            () -> machine.register(Transition.of("BAD STATE", "SUBMIT", "SUBMITTED"))).kind());
        assertEquals(ErrorKind.INVALID_TRANSITION, assertThrows(FsmException.class,
            () -> machine.register(Transition.of("PENDING", "BAD@EVENT", "SUBMITTED"))).kind());
        assertEquals(ErrorKind.INVALID_TRANSITION, assertThrows(FsmException.class,
            () -> machine.register(Transition.of("PENDING", "SUBMIT", ""))).kind());
        assertTrue(machine.transitions().isEmpty());
    }

    @Test
    void register_Null_ThrowsIllegalArgument() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> machine.register(null));
    }

    @Test
    void lookup_Unknown_ReturnsEmpty() {
        // When & Then
        assertTrue(machine.lookup(State.of("PENDING"), Event.of("SUBMIT")).isEmpty());
    }

    @Test
    void transitions_SortedByFromOnTo() throws FsmException {
        // Given
        machine.register(Transition.of("SUBMITTED", "CANCEL", "CANCELLED"));
        machine.register(Transition.of("PENDING", "SUBMIT", "SUBMITTED"));
        machine.register(Transition.of("SUBMITTED", "APPROVE", "APPROVED"));
        machine.register(Transition.of("APPROVED", "SETTLE", "SETTLED"));

        // When
        List<Transition> transitions = machine.transitions();

        // Then
        assertEquals(List.of(
            Transition.of("APPROVED", "SETTLE", "SETTLED"),
            Transition.of("PENDING", "SUBMIT", "SUBMITTED"),
            Transition.of("SUBMITTED", "APPROVE", "APPROVED"),
            Transition.of("SUBMITTED", "CANCEL", "CANCELLED")
        ), transitions);
        assertThrows(UnsupportedOperationException.class, () -> transitions.add(Transition.of("A", "B", "C")));
    }

    // ============================================================
    // 3. 평가 (가드 없음)
    // ============================================================

    @Test
    void next_RegisteredTransition_Allowed() throws FsmException {
        // Given
        machine.register(Transition.of("PENDING", "SUBMIT", "SUBMITTED"));

        // When
        TransitionResult result = machine.next("tx-1", State.of("PENDING"), Event.of("SUBMIT"), AT,
            Map.of("source", "api"), null);

        // Then
        assertTrue(result.isSuccess());
        assertEquals(State.of("SUBMITTED"), result.next());
        assertEquals("tx-1", result.log().machineId());
        assertEquals(ReasonCode.OK, result.log().reason());
        assertTrue(result.log().allowed());
        assertEquals(AT, result.log().at());
        assertEquals(Map.of("source", "api"), result.log().meta());
    }

    @Test
    void next_TrimmedAndUntrimmedInputs_IdenticalOutcomeOnAllowedPath() throws FsmException {
        // Given
        machine.register(Transition.of("PENDING", "SUBMIT", "SUBMITTED"));

        // When
        TransitionResult trimmed = machine.next("tx-1", State.of("PENDING"), Event.of("SUBMIT"), AT, null, null);
        TransitionResult untrimmed = machine.next("tx-1", State.of(" PENDING"), Event.of("SUBMIT  "), AT, null, null);

        // Then
        assertEquals(State.of("SUBMITTED"), untrimmed.orThrow());
        assertEquals(trimmed, untrimmed);
        assertEquals(trimmed.log().canonicalString(), untrimmed.log().canonicalString());
    }

    @Test
    void next_TrimmedAndUntrimmedInputs_IdenticalOutcomeOnNoTransitionPath() throws FsmException {
        // Given
        machine.register(Transition.of("PENDING", "SUBMIT", "SUBMITTED"));

        // When
        TransitionResult trimmed = machine.next("tx-1", State.of("PENDING"), Event.of("CANCEL"), AT, null, null);
        TransitionResult untrimmed = machine.next("tx-1", State.of("\tPENDING "), Event.of(" CANCEL"), AT, null, null);

        // Then
        assertEquals(trimmed.next(), untrimmed.next());
        assertEquals(trimmed.log(), untrimmed.log());
        assertEquals(ErrorKind.NO_TRANSITION, trimmed.error().kind());
        assertEquals(trimmed.error().kind(), untrimmed.error().kind());
        assertEquals(trimmed.error().getMessage(), untrimmed.error().getMessage());
    }

    @Test
    void next_TrimmedAndUntrimmedInputs_IdenticalOutcomeOnGuardBlockedPath() throws FsmException {
        // Given
        List<GuardContext> contexts = new ArrayList<>();
        machine.register(Transition.of("PENDING", "SUBMIT", "SUBMITTED").guardedBy(context -> {
            contexts.add(context);
            return GuardDecision.deny("limit_exceeded");
        }));

        // When
        TransitionResult trimmed = machine.next("tx-1", State.of("PENDING"), Event.of("SUBMIT"), AT,
            Map.of("k", "v"), "in");
        TransitionResult untrimmed = machine.next("tx-1", State.of("PENDING  "), Event.of("\u00A0SUBMIT"), AT,
            Map.of("k", "v"), "in");

        // Then
        assertEquals(trimmed.next(), untrimmed.next());
        assertEquals(trimmed.log(), untrimmed.log());
        assertEquals(ReasonCode.GUARD_BLOCKED, untrimmed.log().reason());
        assertEquals(trimmed.error().kind(), untrimmed.error().kind());
        assertEquals(trimmed.error().denialReason(), untrimmed.error().denialReason());
        assertEquals(2, contexts.size());
        assertEquals(contexts.get(0), contexts.get(1), "Guard should see the same context for both inputs");
    }

    @Test
    void next_CallerMutatesMetaAfterward_LogUnchanged() throws FsmException {
        // Given
        machine.register(Transition.of("PENDING", "SUBMIT", "SUBMITTED"));
        Map<String, String> meta = new HashMap<>();
        meta.put("source", "api");

        // When
        TransitionResult result = machine.next("tx-1", State.of("PENDING"), Event.of("SUBMIT"), AT, meta, null);
        String canonicalBefore = result.log().canonicalString();
        meta.put("source", "mutated");
        meta.put("extra", "x");
        meta.remove("source");

        // Then
        assertEquals(Map.of("source", "api"), result.log().meta());
        assertEquals(canonicalBefore, result.log().canonicalString());
        assertTrue(canonicalBefore.endsWith("|m=source=api"));
    }

    @Test
    void next_NoRule_NoTransition() throws FsmException {
        // Given
        machine.register(Transition.of("PENDING", "SUBMIT", "SUBMITTED"));

        // When
        TransitionResult result = machine.next("tx-1", State.of("PENDING"), Event.of("CANCEL"), AT, null, null);

        // Then
        assertFalse(result.isSuccess());
        assertEquals(ErrorKind.NO_TRANSITION, result.error().kind());
        assertTrue(result.next().isEmpty());
        assertTrue(result.log().to().isEmpty());
        assertFalse(result.log().allowed());
        assertEquals(ReasonCode.NO_TRANSITION, result.log().reason());
    }

    @Test
    void next_InvalidState_InvalidInputLogged() {
        // When
        TransitionResult result = machine.next("tx-1", State.of("BAD STATE"), Event.of("SUBMIT"), AT, null, null);

        // Then
        assertEquals(ErrorKind.INVALID_STATE, result.error().kind());
        assertEquals(ReasonCode.INVALID_INPUT, result.log().reason());
        assertEquals(State.of("BAD STATE"), result.log().from());
        assertTrue(result.log().to().isEmpty());
    }

    @Test
    void next_InvalidEvent_InvalidInputLogged() {
        // When
        TransitionResult result = machine.next("tx-1", State.of("PENDING"), Event.of("BAD@EVENT"), AT, null, null);

        // Then
        assertEquals(ErrorKind.INVALID_EVENT, result.error().kind());
        assertEquals(ReasonCode.INVALID_INPUT, result.log().reason());
    }

    @Test
    void next_NullArguments_ThrowIllegalArgument() {
        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> machine.next(null, State.of("A"), Event.of("E"), AT, null, null));
        assertThrows(IllegalArgumentException.class,
            () -> machine.next("tx", null, Event.of("E"), AT, null, null));
        assertThrows(IllegalArgumentException.class,
            () -> machine.next("tx", State.of("A"), Event.of("E"), null, null, null));
    }

    @Test
    void next_DoesNotMutateMachine() throws FsmException {
        // Given
        machine.register(Transition.of("PENDING", "SUBMIT", "SUBMITTED"));
        List<Transition> before = machine.transitions();

        // When
        machine.next("tx-1", State.of("PENDING"), Event.of("SUBMIT"), AT, null, null);
        machine.next("tx-1", State.of("PENDING"), Event.of("CANCEL"), AT, null, null);

        // Then
        assertEquals(before, machine.transitions());
    }

    @Test
    void next_MetaInsertionOrder_IdenticalCanonicalLog() throws FsmException {
        // Given
        machine.register(Transition.of("PENDING", "SUBMIT", "SUBMITTED").guardedBy(Guards.allowAll()));
        Map<String, String> forward = new LinkedHashMap<>();
        forward.put("a", "1");
        forward.put("b", "2");
        forward.put("c", "3");
        Map<String, String> reverse = new LinkedHashMap<>();
        reverse.put("c", "3");
        reverse.put("b", "2");
        reverse.put("a", "1");

        // When
        TransitionResult a = machine.next("tx-1", State.of("PENDING"), Event.of("SUBMIT"), AT, forward, null);
        TransitionResult b = machine.next("tx-1", State.of("PENDING"), Event.of("SUBMIT"), AT, reverse, null);

        // Then
        assertEquals(a.log().canonicalString(), b.log().canonicalString());
        assertTrue(a.log().canonicalString().endsWith("|m=a=1|m=b=2|m=c=3"));
    }
}
