package com.ryuqq.fsmkit.adapter.inmemory.store;

import com.ryuqq.fsmkit.core.exception.ErrorKind;
import com.ryuqq.fsmkit.core.exception.TransitionLogStoreException;
import com.ryuqq.fsmkit.core.log.ReasonCode;
import com.ryuqq.fsmkit.core.log.TransitionLog;
import com.ryuqq.fsmkit.core.model.Event;
import com.ryuqq.fsmkit.core.model.State;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryTransitionLogStore 유닛 테스트.
 *
 * @author FsmKit Team
 * @since 1.0.0
 */
@DisplayName("InMemoryTransitionLogStore 테스트")
class InMemoryTransitionLogStoreTest {

    private static final Instant AT = Instant.parse("2026-02-15T00:00:00Z");

    private static TransitionLog log(boolean allowed, String source) {
        return new TransitionLog("tx-1", State.of("PENDING"), Event.of("SUBMIT"),
            allowed ? State.of("SUBMITTED") : State.EMPTY, AT, Map.of("source", source), allowed,
            allowed ? ReasonCode.OK : ReasonCode.NO_TRANSITION);
    }

    @Test
    @DisplayName("기본 설정은 FIRST_WRITE_WINS, 무제한이다")
    void 기본_설정() {
        // when
        InMemoryTransitionLogStore store = new InMemoryTransitionLogStore();

        // then
        assertThat(store.config().writePolicy()).isEqualTo(InMemoryStoreConfig.WritePolicy.FIRST_WRITE_WINS);
        assertThat(store.config().maxEntries()).isEqualTo(InMemoryStoreConfig.UNBOUNDED);
        assertThat(store.size()).isZero();
    }

    @Test
    @DisplayName("FIRST_WRITE_WINS는 최초 기록을 유지한다")
    void 최초_쓰기_유지() throws TransitionLogStoreException {
        // given
        InMemoryTransitionLogStore store = new InMemoryTransitionLogStore();
        TransitionLog first = log(true, "first");

        // when
        store.put("k", first);
        store.put("k", log(false, "second"));

        // then
        assertThat(store.get("k")).contains(first);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("LAST_WRITE_WINS는 마지막 기록으로 덮어쓴다")
    void 마지막_쓰기_반영() throws TransitionLogStoreException {
        // given
        InMemoryTransitionLogStore store = new InMemoryTransitionLogStore(
            new InMemoryStoreConfig().withWritePolicy(InMemoryStoreConfig.WritePolicy.LAST_WRITE_WINS));
        TransitionLog second = log(false, "second");

        // when
        store.put("k", log(true, "first"));
        store.put("k", second);

        // then
        assertThat(store.get("k")).contains(second);
    }

    @Test
    @DisplayName("용량을 넘는 새 키는 STORAGE 오류로 거부된다")
    void 용량_초과_거부() throws TransitionLogStoreException {
        // given
        InMemoryTransitionLogStore store = new InMemoryTransitionLogStore(new InMemoryStoreConfig().withMaxEntries(2));
        store.put("a", log(true, "a"));
        store.put("b", log(true, "b"));

        // when & then
        assertThatThrownBy(() -> store.put("c", log(true, "c")))
            .isInstanceOf(TransitionLogStoreException.class)
            .hasMessageContaining("maxEntries: 2")
            .satisfies(e -> assertThat(((TransitionLogStoreException) e).kind()).isEqualTo(ErrorKind.STORAGE));
        assertThat(store.get("c")).isEmpty();
        assertThat(store.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("가득 찬 상태에서도 기존 키 재기록은 허용된다")
    void 용량_가득_기존_키_재기록() throws TransitionLogStoreException {
        // given
        InMemoryTransitionLogStore store = new InMemoryTransitionLogStore(
            new InMemoryStoreConfig(InMemoryStoreConfig.WritePolicy.LAST_WRITE_WINS, 1));
        store.put("a", log(true, "first"));
        TransitionLog replacement = log(true, "second");

        // when
        store.put("a", replacement);

        // then
        assertThat(store.get("a")).contains(replacement);
    }

    @Test
    @DisplayName("null 키와 로그는 거부된다")
    void null_인자_거부() {
        // given
        InMemoryTransitionLogStore store = new InMemoryTransitionLogStore();

        // when & then
        assertThatThrownBy(() -> store.get(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.put(null, log(true, "x"))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.put("k", null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new InMemoryTransitionLogStore(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("clear는 모든 기록을 제거한다")
    void clear_전체_제거() throws TransitionLogStoreException {
        // given
        InMemoryTransitionLogStore store = new InMemoryTransitionLogStore();
        store.put("a", log(true, "a"));

        // when
        store.clear();

        // then
        assertThat(store.size()).isZero();
        assertThat(store.get("a")).isEmpty();
    }

    @Test
    @DisplayName("동시 쓰기에서도 하나의 기록만 남고 모든 조회가 같은 값을 본다")
    void 동시_쓰기_최초_기록_고정() throws Exception {
        // given
        InMemoryTransitionLogStore store = new InMemoryTransitionLogStore();
        int threadCount = 10;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<TransitionLog>> futures = new ArrayList<>();

        List<TransitionLog> observed = new ArrayList<>();

        // when
        try {
            for (int i = 0; i < threadCount; i++) {
                String source = "writer-" + i;
                futures.add(executor.submit(() -> {
                    start.await();
                    store.put("k", log(true, source));
                    return store.get("k").orElseThrow();
                }));
            }
            start.countDown();

            for (Future<TransitionLog> future : futures) {
                observed.add(future.get(5, TimeUnit.SECONDS));
            }
        } finally {
            start.countDown();
            executor.shutdownNow();
        }

        // then
        assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        assertThat(observed).allMatch(observedLog -> observedLog.equals(observed.get(0)));
        assertThat(store.size()).isEqualTo(1);
    }
}
