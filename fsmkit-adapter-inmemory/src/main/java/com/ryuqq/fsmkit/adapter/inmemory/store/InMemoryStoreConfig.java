package com.ryuqq.fsmkit.adapter.inmemory.store;

/**
 * InMemoryTransitionLogStore 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>writePolicy: 같은 키 재저장 시 동작 (기본 FIRST_WRITE_WINS)</li>
 *   <li>maxEntries: 최대 보관 키 수 (기본 무제한)</li>
 * </ul>
 *
 * @author FsmKit Team
 * @since 1.0.0
 * @param writePolicy 쓰기 정책
 * @param maxEntries 최대 키 수 (1 이상)
 */
public record InMemoryStoreConfig(WritePolicy writePolicy, int maxEntries) {

    /**
     * 키 수 제한 없음.
     */
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: writePolicy=FIRST_WRITE_WINS, maxEntries=UNBOUNDED</p>
     */
    public InMemoryStoreConfig() {
        this(WritePolicy.FIRST_WRITE_WINS, UNBOUNDED);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public InMemoryStoreConfig {
        if (writePolicy == null) {
            throw new IllegalArgumentException("writePolicy cannot be null");
        }
        if (maxEntries <= 0) {
            throw new IllegalArgumentException(
                "maxEntries must be positive (current: " + maxEntries + ")"
            );
        }
    }

    /**
     * writePolicy만 변경한 새 인스턴스 생성.
     *
     * @param writePolicy 새로운 쓰기 정책
     * @return 새 InMemoryStoreConfig 인스턴스
     */
    public InMemoryStoreConfig withWritePolicy(WritePolicy writePolicy) {
        return new InMemoryStoreConfig(writePolicy, this.maxEntries);
    }

    /**
     * maxEntries만 변경한 새 인스턴스 생성.
     *
     * @param maxEntries 새로운 최대 키 수
     * @return 새 InMemoryStoreConfig 인스턴스
     */
    public InMemoryStoreConfig withMaxEntries(int maxEntries) {
        return new InMemoryStoreConfig(this.writePolicy, maxEntries);
    }

    /**
     * 같은 키에 대한 반복 쓰기 정책.
     */
    public enum WritePolicy {

        /**
         * 최초 쓰기만 반영 (put-if-absent). 동시 재시도에서도 최초 결과가 고정됩니다.
         */
        FIRST_WRITE_WINS,

        /**
         * 마지막 쓰기로 덮어쓰기.
         */
        LAST_WRITE_WINS
    }
}
