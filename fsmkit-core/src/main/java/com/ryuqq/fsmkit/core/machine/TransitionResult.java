package com.ryuqq.fsmkit.core.machine;

import com.ryuqq.fsmkit.core.exception.FsmException;
import com.ryuqq.fsmkit.core.log.TransitionLog;
import com.ryuqq.fsmkit.core.model.State;

import java.util.Optional;

/**
 * 전이 평가 결과 (next, log, error).
 *
 * <p>평가 시점의 오류는 예외로 던지지 않고 값으로 반환됩니다.
 * 실패한 경우에도 {@link #log()}는 항상 완전하게 채워져 있으므로 감사 기록으로 저장할 수 있습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * TransitionResult result = machine.next("tx-1", State.of("PENDING"), Event.of("SUBMIT"), at, meta, null);
 * auditLog.append(result.log().canonicalString());
 *
 * if (result.isSuccess()) {
 *     repository.updateState(result.next());
 * }
 *
 * // 예외 흐름을 선호하는 경우
 * State next = result.orThrow();
 * </pre>
 *
 * @param next 다음 상태 (허용되지 않으면 {@link State#EMPTY})
 * @param log 평가 기록 (항상 존재)
 * @param error 평가 오류 (성공 시 null)
 *
 * @author FsmKit Team
 * @since 1.0.0
 */
public record TransitionResult(
    State next,
    TransitionLog log,
    FsmException error
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException next 또는 log가 null인 경우
     */
    public TransitionResult {
        if (next == null) {
            throw new IllegalArgumentException("next cannot be null");
        }
        if (log == null) {
            throw new IllegalArgumentException("log cannot be null");
        }
        // error는 null 허용
    }

    /**
     * 성공 결과 생성.
     *
     * @param next 다음 상태
     * @param log 평가 기록
     * @return TransitionResult
     */
    public static TransitionResult success(State next, TransitionLog log) {
        return new TransitionResult(next, log, null);
    }

    /**
     * 실패 결과 생성 (다음 상태 없음).
     *
     * @param log 평가 기록
     * @param error 평가 오류
     * @return TransitionResult
     */
    public static TransitionResult failure(TransitionLog log, FsmException error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        return new TransitionResult(State.EMPTY, log, error);
    }

    /**
     * 오류 없이 완료되었는지 확인.
     *
     * @return error가 없으면 true
     */
    public boolean isSuccess() {
        return error == null;
    }

    /**
     * 오류 조회.
     *
     * @return 오류 (없으면 empty)
     */
    public Optional<FsmException> errorOptional() {
        return Optional.ofNullable(error);
    }

    /**
     * 다음 상태 반환, 오류가 있으면 throw.
     *
     * @return 다음 상태
     * @throws FsmException 평가 또는 저장 오류가 있는 경우
     */
    public State orThrow() throws FsmException {
        if (error != null) {
            throw error;
        }
        return next;
    }
}
