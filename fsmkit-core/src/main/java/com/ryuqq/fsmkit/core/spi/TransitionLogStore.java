package com.ryuqq.fsmkit.core.spi;

import com.ryuqq.fsmkit.core.exception.TransitionLogStoreException;
import com.ryuqq.fsmkit.core.log.TransitionLog;

import java.util.Optional;

/**
 * 멱등성 저장소 SPI (Service Provider Interface).
 *
 * <p>FsmKit은 DB, Redis 등 특정 저장소에 의존하지 않으며, 호출자가 이 인터페이스의 구현체를 제공합니다.
 * 엔진은 저장소 주변에 어떤 잠금도 걸지 않습니다.</p>
 *
 * <p><strong>구현 책임:</strong></p>
 * <ul>
 *   <li>멱등성 키 → {@link TransitionLog} 매핑 보관</li>
 *   <li>같은 (key, log)로 {@link #put}을 여러 번 호출해도 안전해야 함</li>
 *   <li>저장소 자체 오류는 {@link TransitionLogStoreException}으로 보고</li>
 * </ul>
 *
 * <p><strong>동시성 주의:</strong></p>
 * <p>{@code IdempotentMachine.apply}는 get → put 순서로 동작하며 원자적이지 않습니다.
 * 같은 키로 동시에 재시도하면 두 호출 모두 miss를 관찰하고 둘 다 put할 수 있습니다.
 * 동시 재시도에서도 최초 결과를 고정하려면 구현체가 첫 번째 쓰기만 반영(put-if-absent)해야 합니다.</p>
 *
 * <p><strong>권장 구현 방안:</strong></p>
 * <ul>
 *   <li>Database: 키를 Unique Key로 두고 INSERT ... ON CONFLICT DO NOTHING</li>
 *   <li>Redis: SET key value NX</li>
 *   <li>InMemory: ConcurrentHashMap#putIfAbsent</li>
 * </ul>
 *
 * @author FsmKit Team
 * @since 1.0.0
 */
public interface TransitionLogStore {

    /**
     * 키로 저장된 로그 조회.
     *
     * @param key 멱등성 키
     * @return 저장된 로그 (없으면 empty)
     * @throws TransitionLogStoreException 저장소 오류
     */
    Optional<TransitionLog> get(String key) throws TransitionLogStoreException;

    /**
     * 키에 로그 저장.
     *
     * <p>허용/거부와 관계없이 모든 평가 결과가 저장됩니다.</p>
     *
     * @param key 멱등성 키
     * @param log 평가 기록
     * @throws TransitionLogStoreException 저장소 오류
     */
    void put(String key, TransitionLog log) throws TransitionLogStoreException;
}
