package com.ryuqq.fsmkit.core.idempotency;

import com.ryuqq.fsmkit.core.exception.FsmException;
import com.ryuqq.fsmkit.core.model.Event;
import com.ryuqq.fsmkit.core.model.State;

import java.time.Instant;
import java.util.Map;

/**
 * 멱등성 키 파생 함수.
 *
 * <p>재시도가 같은 키로 수렴하려면 입력에 대한 순수하고 결정적인 함수여야 합니다.
 * 재시도마다 달라지는 값(예: at)을 키에 포함하면 멱등성이 깨집니다.</p>
 *
 * <p><strong>좋은 키 예시:</strong></p>
 * <ul>
 *   <li>machineId + 외부 이벤트 ID</li>
 *   <li>machineName + machineId + 외부 이벤트 ID</li>
 *   <li>machineId + 이벤트 payload fingerprint</li>
 * </ul>
 *
 * @author FsmKit Team
 * @since 1.0.0
 * @see IdempotencyKeys
 */
@FunctionalInterface
public interface IdempotencyKeyFunction {

    /**
     * 멱등성 키 파생.
     *
     * @param machineName 머신 이름
     * @param machineId 머신 인스턴스 식별자
     * @param from 호출자가 전달한 시작 상태 (정규화 전)
     * @param on 호출자가 전달한 이벤트 (정규화 전)
     * @param at 평가 시각
     * @param meta 메타데이터 (null 가능)
     * @param input 도메인 입력 (null 가능)
     * @return 멱등성 키 (null 또는 빈 문자열이면 MISSING_IDEMPOTENCY_KEY)
     * @throws FsmException 키를 파생할 수 없는 경우
     */
    String deriveKey(
        String machineName,
        String machineId,
        State from,
        Event on,
        Instant at,
        Map<String, String> meta,
        Object input
    ) throws FsmException;
}
