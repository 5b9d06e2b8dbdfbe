package com.ryuqq.fsmkit.core.machine;

import com.ryuqq.fsmkit.core.exception.ErrorKind;
import com.ryuqq.fsmkit.core.exception.FsmException;
import com.ryuqq.fsmkit.core.guard.Guard;
import com.ryuqq.fsmkit.core.guard.GuardContext;
import com.ryuqq.fsmkit.core.guard.GuardDecision;
import com.ryuqq.fsmkit.core.log.ReasonCode;
import com.ryuqq.fsmkit.core.log.TransitionLog;
import com.ryuqq.fsmkit.core.model.Event;
import com.ryuqq.fsmkit.core.model.State;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 재사용 가능한 유한 상태 머신 정의.
 *
 * <p>Machine은 (from, on) 키로 전이 규칙을 보관하고, 하나의 상태에 하나의 이벤트를 평가합니다.
 * 평가({@link #next})는 순수 계산이며 I/O를 수행하지 않습니다.</p>
 *
 * <p><strong>평가 순서:</strong></p>
 * <pre>
 * 1. from, on 정규화 (공백 제거), meta null → 빈 Map
 * 2. from 유효하지 않음 → invalid_input, INVALID_STATE
 * 3. on 유효하지 않음   → invalid_input, INVALID_EVENT
 * 4. 규칙 없음          → no_transition, NO_TRANSITION
 * 5. 가드 평가
 *    - Allow       → 6단계
 *    - Deny        → guard_blocked, ILLEGAL_TRANSITION
 *    - Fail/예외   → internal_error, ILLEGAL_TRANSITION (원인 포함)
 * 6. ok, next = to
 * </pre>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>(from, on) 키는 머신 인스턴스 내에서 유일</li>
 *   <li>모든 평가는 성공/실패와 관계없이 정확히 하나의 TransitionLog를 생성</li>
 *   <li>등록은 추가만 가능 (삭제/교체 불가)</li>
 * </ul>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>{@link #next}는 여러 스레드에서 동시에 호출 가능</li>
 *   <li>동일 키에 대한 동시 등록 시 정확히 하나만 성공</li>
 *   <li>등록은 머신을 공유하기 전에 완료하는 것을 권장</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Machine machine = Machine.create("transfer-intent");
 * machine.register(Transition.of("PENDING", "SUBMIT", "SUBMITTED").named("submit"));
 *
 * TransitionResult result = machine.next(
 *     "tx-1", State.of("PENDING"), Event.of("SUBMIT"), Instant.now(), Map.of("source", "api"), null);
 * </pre>
 *
 * @author FsmKit Team
 * @since 1.0.0
 */
public final class Machine {

    private static final Logger log = LoggerFactory.getLogger(Machine.class);

    /**
     * 머신 이름 최대 길이.
     */
    public static final int MAX_NAME_LENGTH = 128;

    private static final Comparator<Transition> SNAPSHOT_ORDER = Comparator
        .comparing(Transition::from)
        .thenComparing(Transition::on)
        .thenComparing(Transition::to);

    private final String name;
    private final ConcurrentHashMap<TransitionKey, Transition> transitions;
    private volatile State initial;

    private Machine(String name) {
        this.name = name;
        this.transitions = new ConcurrentHashMap<>();
    }

    /**
     * 이름으로 머신 생성.
     *
     * @param name 머신 이름 (공백 제거 후 1~128자)
     * @return Machine 인스턴스
     * @throws FsmException INVALID_MACHINE_NAME - 이름이 비어 있거나 너무 긴 경우
     */
    public static Machine create(String name) throws FsmException {
        String trimmed = name == null ? "" : name.strip();
        if (trimmed.isEmpty() || trimmed.length() > MAX_NAME_LENGTH) {
            throw new FsmException(ErrorKind.INVALID_MACHINE_NAME,
                "invalid machine name: length must be 1~" + MAX_NAME_LENGTH + " (current: " + trimmed.length() + ")");
        }
        return new Machine(trimmed);
    }

    /**
     * 머신 이름 조회.
     *
     * @return 정규화된 이름
     */
    public String name() {
        return name;
    }

    /**
     * 초기 상태 선언.
     *
     * @param state 초기 상태
     * @throws FsmException INVALID_STATE - 정규화 후 유효하지 않은 경우
     * @throws IllegalArgumentException state가 null인 경우
     */
    public void setInitial(State state) throws FsmException {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        State normalized = state.normalize();
        if (!normalized.isValid()) {
            throw new FsmException(ErrorKind.INVALID_STATE, "invalid state: '" + normalized + "'");
        }
        this.initial = normalized;
    }

    /**
     * 선언된 초기 상태 조회.
     *
     * @return 초기 상태 (선언되지 않았으면 empty)
     */
    public Optional<State> initial() {
        return Optional.ofNullable(initial);
    }

    /**
     * 전이 규칙 등록.
     *
     * <p>정규화된 사본이 저장되며, 호출자가 전달한 원본 값은 보관하지 않습니다.</p>
     *
     * @param transition 전이 규칙
     * @throws FsmException INVALID_TRANSITION - from/on/to 중 하나라도 유효하지 않은 경우
     * @throws FsmException DUPLICATE_TRANSITION - 같은 (from, on)이 이미 등록된 경우 (to와 무관)
     * @throws IllegalArgumentException transition이 null인 경우
     */
    public void register(Transition transition) throws FsmException {
        if (transition == null) {
            throw new IllegalArgumentException("transition cannot be null");
        }
        Transition normalized = transition.normalize();
        if (!normalized.isValid()) {
            throw new FsmException(ErrorKind.INVALID_TRANSITION, "invalid transition: " + normalized);
        }

        TransitionKey key = TransitionKey.of(normalized.from(), normalized.on());
        Transition existing = transitions.putIfAbsent(key, normalized);
        if (existing != null) {
            throw new FsmException(ErrorKind.DUPLICATE_TRANSITION,
                "duplicate transition for state+event: " + key + " already registered as " + existing);
        }
        log.debug("Machine {} registered {}", name, normalized);
    }

    /**
     * 전이 규칙 조회 (상태 변경 없음).
     *
     * @param from 시작 상태 (정규화됨)
     * @param on 이벤트 (정규화됨)
     * @return 등록된 전이 (없으면 empty)
     * @throws IllegalArgumentException from 또는 on이 null인 경우
     */
    public Optional<Transition> lookup(State from, Event on) {
        if (from == null || on == null) {
            throw new IllegalArgumentException("from and on cannot be null");
        }
        return Optional.ofNullable(transitions.get(TransitionKey.of(from.normalize(), on.normalize())));
    }

    /**
     * 등록된 전이 목록의 결정적 스냅샷.
     *
     * <p>정렬 기준: from, on, to (사전순).</p>
     *
     * @return 정렬된 전이 목록 (수정 불가)
     */
    public List<Transition> transitions() {
        List<Transition> snapshot = new ArrayList<>(transitions.values());
        snapshot.sort(SNAPSHOT_ORDER);
        return List.copyOf(snapshot);
    }

    /**
     * 하나의 이벤트를 하나의 상태에 대해 평가.
     *
     * <p>어떤 경로에서도 완전하게 채워진 {@link TransitionLog}를 반환합니다.</p>
     *
     * @param machineId 머신 인스턴스 식별자 (예: tx-1)
     * @param from 현재 상태
     * @param on 이벤트
     * @param at 평가 시각 (호출자 제공, UTC)
     * @param meta 메타데이터 (null 허용, 복사됨)
     * @param input 가드에 전달할 도메인 입력 (null 허용)
     * @return 평가 결과
     * @throws IllegalArgumentException machineId, from, on, at이 null이거나 meta에 null key/value가 있는 경우
     */
    public TransitionResult next(
        String machineId,
        State from,
        Event on,
        Instant at,
        Map<String, String> meta,
        Object input
    ) {
        if (machineId == null) {
            throw new IllegalArgumentException("machineId cannot be null");
        }
        if (from == null || on == null) {
            throw new IllegalArgumentException("from and on cannot be null");
        }
        if (at == null) {
            throw new IllegalArgumentException("at cannot be null");
        }

        State normalizedFrom = from.normalize();
        Event normalizedOn = on.normalize();
        Map<String, String> metaCopy = TransitionLog.copyMeta(meta);

        if (!normalizedFrom.isValid()) {
            TransitionLog rejected = new TransitionLog(machineId, normalizedFrom, normalizedOn, State.EMPTY,
                at, metaCopy, false, ReasonCode.INVALID_INPUT);
            return TransitionResult.failure(rejected,
                new FsmException(ErrorKind.INVALID_STATE, "invalid state: '" + normalizedFrom + "'"));
        }
        if (!normalizedOn.isValid()) {
            TransitionLog rejected = new TransitionLog(machineId, normalizedFrom, normalizedOn, State.EMPTY,
                at, metaCopy, false, ReasonCode.INVALID_INPUT);
            return TransitionResult.failure(rejected,
                new FsmException(ErrorKind.INVALID_EVENT, "invalid event: '" + normalizedOn + "'"));
        }

        Transition transition = transitions.get(TransitionKey.of(normalizedFrom, normalizedOn));
        if (transition == null) {
            TransitionLog missing = new TransitionLog(machineId, normalizedFrom, normalizedOn, State.EMPTY,
                at, metaCopy, false, ReasonCode.NO_TRANSITION);
            return TransitionResult.failure(missing,
                new FsmException(ErrorKind.NO_TRANSITION,
                    "no transition for state+event: " + TransitionKey.of(normalizedFrom, normalizedOn)));
        }

        if (transition.guard() != null) {
            GuardContext context = new GuardContext(name, machineId,
                transition.from(), transition.on(), transition.to(), at, metaCopy, input);
            GuardDecision decision = evaluate(transition.guard(), context);

            if (decision instanceof GuardDecision.Deny deny) {
                log.debug("Machine {} [{}] guard blocked {}: {}", name, machineId, transition, deny.reason());
                TransitionLog blocked = new TransitionLog(machineId, transition.from(), transition.on(),
                    transition.to(), at, metaCopy, false, ReasonCode.GUARD_BLOCKED);
                return TransitionResult.failure(blocked, FsmException.guardBlocked(deny.reason()));
            }
            if (decision instanceof GuardDecision.Fail fail) {
                log.warn("Machine {} [{}] guard failed on {}", name, machineId, transition, fail.cause());
                TransitionLog failed = new TransitionLog(machineId, transition.from(), transition.on(),
                    transition.to(), at, metaCopy, false, ReasonCode.INTERNAL_ERROR);
                return TransitionResult.failure(failed, FsmException.guardFailed(fail.cause()));
            }
        }

        TransitionLog allowed = new TransitionLog(machineId, transition.from(), transition.on(),
            transition.to(), at, metaCopy, true, ReasonCode.OK);
        return TransitionResult.success(transition.to(), allowed);
    }

    /**
     * 가드 실행. 예외와 null 반환은 Fail로 변환.
     */
    private static GuardDecision evaluate(Guard guard, GuardContext context) {
        try {
            GuardDecision decision = guard.check(context);
            if (decision == null) {
                return GuardDecision.fail(new IllegalStateException("guard returned null decision"));
            }
            return decision;
        } catch (RuntimeException e) {
            return GuardDecision.fail(e);
        }
    }

    @Override
    public String toString() {
        return "Machine{" + name + ", transitions=" + transitions.size() + '}';
    }
}
