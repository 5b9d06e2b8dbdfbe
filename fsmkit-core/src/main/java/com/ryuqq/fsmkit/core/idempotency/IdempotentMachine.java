package com.ryuqq.fsmkit.core.idempotency;

import com.ryuqq.fsmkit.core.exception.ErrorKind;
import com.ryuqq.fsmkit.core.exception.FsmException;
import com.ryuqq.fsmkit.core.exception.TransitionLogStoreException;
import com.ryuqq.fsmkit.core.log.TransitionLog;
import com.ryuqq.fsmkit.core.machine.Machine;
import com.ryuqq.fsmkit.core.machine.TransitionResult;
import com.ryuqq.fsmkit.core.model.Event;
import com.ryuqq.fsmkit.core.model.State;
import com.ryuqq.fsmkit.core.spi.TransitionLogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * 재시도에 안전한 Machine 래퍼.
 *
 * <p>같은 멱등성 키로 들어온 재시도 요청은 다시 평가하지 않고, 최초 평가에서 저장된
 * {@link TransitionLog}를 그대로 반환합니다. 가드도 다시 실행되지 않습니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. key = keyFunction.deriveKey(...)      (null·공백 키 → MISSING_IDEMPOTENCY_KEY)
 * 2. store.get(key)
 *    - hit, allowed  → (log.to, log, 오류 없음)
 *    - hit, denied   → (EMPTY, log, ILLEGAL_TRANSITION)
 * 3. miss → machine.next(...)
 * 4. store.put(key, log)   (허용/거부 모두 저장)
 *    - 실패 → 계산된 next, log 유지 + STORAGE 오류
 * 5. machine 결과 그대로 반환
 * </pre>
 *
 * <p><strong>동시성:</strong></p>
 * <p>get → put 사이는 원자적이지 않습니다. 같은 키로 동시에 호출되면 두 호출 모두 평가하고
 * 둘 다 put할 수 있습니다. 첫 번째 쓰기가 완료된 이후의 재시도만 안정된 결과를 보장하며,
 * 동시 재시도까지 고정하려면 put-if-absent 방식의 {@link TransitionLogStore}를 사용해야 합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * IdempotentMachine im = IdempotentMachine.create(machine, store, IdempotencyKeys.byMetaField("eventId"));
 *
 * TransitionResult first = im.apply("tx-1", State.of("PENDING"), Event.of("SUBMIT"), at, meta, null);
 * TransitionResult retry = im.apply("tx-1", State.of("PENDING"), Event.of("SUBMIT"), at.plusSeconds(60), meta, null);
 * // retry.log().equals(first.log())
 * </pre>
 *
 * @author FsmKit Team
 * @since 1.0.0
 */
public final class IdempotentMachine {

    private static final Logger log = LoggerFactory.getLogger(IdempotentMachine.class);

    private final Machine machine;
    private final TransitionLogStore store;
    private final IdempotencyKeyFunction keyFunction;

    private IdempotentMachine(Machine machine, TransitionLogStore store, IdempotencyKeyFunction keyFunction) {
        this.machine = machine;
        this.store = store;
        this.keyFunction = keyFunction;
    }

    /**
     * 멱등성 래퍼 생성.
     *
     * @param machine 대상 머신
     * @param store 멱등성 저장소
     * @param keyFunction 키 파생 함수
     * @return IdempotentMachine 인스턴스
     * @throws FsmException NIL_MACHINE, NIL_STORE, NIL_KEY_FUNCTION - 의존성이 null인 경우
     */
    public static IdempotentMachine create(
        Machine machine,
        TransitionLogStore store,
        IdempotencyKeyFunction keyFunction
    ) throws FsmException {
        if (machine == null) {
            throw new FsmException(ErrorKind.NIL_MACHINE);
        }
        if (store == null) {
            throw new FsmException(ErrorKind.NIL_STORE);
        }
        if (keyFunction == null) {
            throw new FsmException(ErrorKind.NIL_KEY_FUNCTION);
        }
        return new IdempotentMachine(machine, store, keyFunction);
    }

    /**
     * 감싸고 있는 머신.
     *
     * @return Machine
     */
    public Machine machine() {
        return machine;
    }

    /**
     * 멱등성 키 기준으로 최대 한 번 전이를 적용.
     *
     * <p>키 파생 실패, null·공백 키, 저장소 조회 실패는 평가 전에 발생하므로 로그 없이 throw됩니다.
     * 그 외 모든 결과는 {@link TransitionResult}로 반환됩니다.</p>
     *
     * @param machineId 머신 인스턴스 식별자
     * @param from 현재 상태
     * @param on 이벤트
     * @param at 평가 시각
     * @param meta 메타데이터 (null 허용)
     * @param input 도메인 입력 (null 허용)
     * @return 평가 결과 (재시도인 경우 저장된 결과)
     * @throws FsmException 키 함수 오류, MISSING_IDEMPOTENCY_KEY, 저장소 조회 오류(STORAGE)
     */
    public TransitionResult apply(
        String machineId,
        State from,
        Event on,
        Instant at,
        Map<String, String> meta,
        Object input
    ) throws FsmException {
        String key = keyFunction.deriveKey(machine.name(), machineId, from, on, at, meta, input);
        if (key == null || key.isBlank()) {
            throw new FsmException(ErrorKind.MISSING_IDEMPOTENCY_KEY);
        }

        // 1. 저장소 먼저 확인
        Optional<TransitionLog> prior = store.get(key);
        if (prior.isPresent()) {
            TransitionLog stored = prior.get();
            log.debug("Idempotent replay for key {}: allowed={}, reason={}", key, stored.allowed(), stored.reason());
            if (stored.allowed()) {
                return TransitionResult.success(stored.to(), stored);
            }
            return TransitionResult.failure(stored, new FsmException(ErrorKind.ILLEGAL_TRANSITION,
                "illegal transition: previously denied attempt (reason=" + stored.reason().code() + ")"));
        }

        // 2. 새로 평가
        TransitionResult result = machine.next(machineId, from, on, at, meta, input);

        // 3. 허용/거부와 관계없이 저장 (시도 자체를 기억)
        try {
            store.put(key, result.log());
        } catch (TransitionLogStoreException e) {
            log.warn("Failed to persist transition log for key {} (outcome known but not recorded)", key, e);
            if (result.error() != null) {
                e.addSuppressed(result.error());
            }
            return new TransitionResult(result.next(), result.log(), e);
        }

        return result;
    }

    @Override
    public String toString() {
        return "IdempotentMachine{" + machine.name() + '}';
    }
}
