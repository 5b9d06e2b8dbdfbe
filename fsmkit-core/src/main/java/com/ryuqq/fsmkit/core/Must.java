package com.ryuqq.fsmkit.core;

import com.ryuqq.fsmkit.core.exception.FsmException;
import com.ryuqq.fsmkit.core.idempotency.IdempotencyKeyFunction;
import com.ryuqq.fsmkit.core.idempotency.IdempotentMachine;
import com.ryuqq.fsmkit.core.machine.Machine;
import com.ryuqq.fsmkit.core.machine.Transition;
import com.ryuqq.fsmkit.core.spi.TransitionLogStore;

/**
 * 정적 구성용 편의 API.
 *
 * <p>고정된 머신 정의(상수 이름, 하드코딩된 전이 표)처럼 실패가 곧 프로그래밍 오류인 경우에만 사용합니다.
 * 실패 시 {@link FsmException}을 {@link IllegalStateException}으로 감싸 던집니다.
 * 런타임/도메인 입력 검증에는 {@link Machine#create(String)} 등 fallible API를 사용하세요.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * private static final Machine TRANSFER = Must.machine("transfer-intent");
 *
 * static {
 *     Must.register(TRANSFER, Transition.of("PENDING", "SUBMIT", "SUBMITTED"));
 * }
 * </pre>
 *
 * @author FsmKit Team
 * @since 1.0.0
 */
public final class Must {

    // Utility class - prevent instantiation
    private Must() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 머신 생성, 실패 시 IllegalStateException.
     *
     * @param name 머신 이름
     * @return Machine
     * @throws IllegalStateException 이름이 유효하지 않은 경우
     */
    public static Machine machine(String name) {
        try {
            return Machine.create(name);
        } catch (FsmException e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
    }

    /**
     * 전이 등록, 실패 시 IllegalStateException.
     *
     * @param machine 대상 머신
     * @param transitions 등록할 전이 목록 (순서대로 등록)
     * @return 같은 머신 (체이닝용)
     * @throws IllegalStateException 유효하지 않거나 중복된 전이인 경우
     */
    public static Machine register(Machine machine, Transition... transitions) {
        if (machine == null) {
            throw new IllegalArgumentException("machine cannot be null");
        }
        try {
            for (Transition transition : transitions) {
                machine.register(transition);
            }
            return machine;
        } catch (FsmException e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
    }

    /**
     * 멱등성 래퍼 생성, 실패 시 IllegalStateException.
     *
     * @param machine 대상 머신
     * @param store 저장소
     * @param keyFunction 키 함수
     * @return IdempotentMachine
     * @throws IllegalStateException 의존성이 null인 경우
     */
    public static IdempotentMachine idempotent(
        Machine machine,
        TransitionLogStore store,
        IdempotencyKeyFunction keyFunction
    ) {
        try {
            return IdempotentMachine.create(machine, store, keyFunction);
        } catch (FsmException e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
    }
}
