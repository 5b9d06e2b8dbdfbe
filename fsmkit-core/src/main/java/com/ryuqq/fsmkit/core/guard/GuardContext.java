package com.ryuqq.fsmkit.core.guard;

import com.ryuqq.fsmkit.core.log.TransitionLog;
import com.ryuqq.fsmkit.core.model.Event;
import com.ryuqq.fsmkit.core.model.State;

import java.time.Instant;
import java.util.Map;

/**
 * 가드 평가 시점의 불변 스냅샷.
 *
 * <p>GuardContext는 머신에 대한 참조를 갖지 않으므로, 가드는 자신의 허용/거부 결정 외에
 * 어떤 것에도 영향을 줄 수 없습니다. 시각({@code at})은 호출자가 제공하며,
 * 가드는 현재 시각을 직접 읽어서는 안 됩니다.</p>
 *
 * @param machineName 머신 이름 (예: transfer-intent)
 * @param machineId 머신 인스턴스 식별자 (예: tx-1)
 * @param from 등록된 전이의 정규화된 시작 상태
 * @param on 등록된 전이의 정규화된 이벤트
 * @param to 등록된 전이의 정규화된 목표 상태
 * @param at 평가 시각 (UTC)
 * @param meta 메타데이터 (수정 불가 복사본)
 * @param input 도메인 입력 (불투명, null 가능)
 *
 * @author FsmKit Team
 * @since 1.0.0
 */
public record GuardContext(
    String machineName,
    String machineId,
    State from,
    Event on,
    State to,
    Instant at,
    Map<String, String> meta,
    Object input
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException input을 제외한 필드가 null인 경우
     */
    public GuardContext {
        if (machineName == null || machineId == null) {
            throw new IllegalArgumentException("machineName and machineId cannot be null");
        }
        if (from == null || on == null || to == null) {
            throw new IllegalArgumentException("from, on and to cannot be null");
        }
        if (at == null) {
            throw new IllegalArgumentException("at cannot be null");
        }
        meta = TransitionLog.copyMeta(meta);
        // input은 null 허용
    }
}
