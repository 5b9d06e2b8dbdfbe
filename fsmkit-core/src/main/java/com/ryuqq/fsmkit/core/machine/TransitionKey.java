package com.ryuqq.fsmkit.core.machine;

import com.ryuqq.fsmkit.core.model.Event;
import com.ryuqq.fsmkit.core.model.State;

/**
 * 전이 레지스트리 키 (from, on). 항상 정규화된 값으로 생성해야 합니다.
 */
record TransitionKey(State from, Event on) {

    static TransitionKey of(State from, Event on) {
        return new TransitionKey(from, on);
    }

    @Override
    public String toString() {
        return "(" + from + ", " + on + ")";
    }
}
