package com.github.dimitryivaniuta.edgeguard.protection.cache;

import com.github.dimitryivaniuta.edgeguard.infra.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResponseCacheTest {

    private final MutableClock clock = new MutableClock(10_000);

    @Test
    void entryIsVisibleUpToTtlAndAbsentAfter() {
        ResponseCache cache = new ResponseCache(clock, Duration.ofMinutes(5), 10, Runnable::run);
        cache.set("k", "v");

        clock.advance(Duration.ofMinutes(5));
        assertThat(cache.get("k")).contains("v");

        clock.advanceMillis(1);
        assertThat(cache.get("k")).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    void overwriteRestartsTtl() {
        ResponseCache cache = new ResponseCache(clock, Duration.ofSeconds(10), 10, Runnable::run);
        cache.set("k", "old");
        clock.advance(Duration.ofSeconds(8));
        cache.set("k", "new");
        clock.advance(Duration.ofSeconds(8));

        assertThat(cache.get("k")).contains("new");
    }

    @Test
    void sizeStaysWithinCapacity() {
        ResponseCache cache = new ResponseCache(clock, Duration.ofMinutes(5), 3, Runnable::run);
        for (int i = 0; i < 20; i++) {
            cache.set("k" + i, "v" + i);
            clock.advanceMillis(1);
        }

        assertThat(cache.size()).isEqualTo(3);
        assertThat(cache.get("k17")).contains("v17");
        assertThat(cache.get("k19")).contains("v19");
        assertThat(cache.get("k16")).isEmpty();
    }

    @Test
    void fullCacheEvictsOldestWriteEvenWhenItIsReadOften() {
        ResponseCache cache = new ResponseCache(clock, Duration.ofMinutes(5), 3, Runnable::run);
        for (String k : new String[]{"a", "b", "c"}) {
            cache.set(k, k.toUpperCase());
            clock.advanceMillis(1);
        }
        for (int i = 0; i < 5; i++) {
            cache.get("a");
            cache.get("b");
            cache.get("c");
        }

        cache.set("d", "D");

        assertThat(cache.get("a")).isEmpty();
        assertThat(cache.get("b")).contains("B");
        assertThat(cache.get("c")).contains("C");
        assertThat(cache.get("d")).contains("D");
        assertThat(cache.size()).isEqualTo(3);
    }

    @Test
    void overwriteMovesKeyToNewestAndDoesNotEvict() {
        ResponseCache cache = new ResponseCache(clock, Duration.ofMinutes(5), 2, Runnable::run);
        cache.set("a", "1");
        clock.advanceMillis(1);
        cache.set("b", "2");
        clock.advanceMillis(1);

        cache.set("a", "1b");
        assertThat(cache.size()).isEqualTo(2);

        clock.advanceMillis(1);
        cache.set("c", "3");

        assertThat(cache.get("b")).isEmpty();
        assertThat(cache.get("a")).contains("1b");
        assertThat(cache.get("c")).contains("3");
    }

    @Test
    void expiredEntriesAreDroppedBeforeLiveOnes() {
        ResponseCache cache = new ResponseCache(clock, Duration.ofSeconds(10), 2, Runnable::run);
        cache.set("old", "x");
        clock.advance(Duration.ofSeconds(8));
        cache.set("live", "y");
        clock.advance(Duration.ofSeconds(3));

        cache.set("new", "z");

        assertThat(cache.get("live")).contains("y");
        assertThat(cache.get("new")).contains("z");
        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    void missingKeyIsAbsent() {
        ResponseCache cache = new ResponseCache(clock, Duration.ofMinutes(5), 3);

        assertThat(cache.get("nope")).isEmpty();
        assertThat(cache.get(null)).isEmpty();
    }

    @Test
    void rejectsNonPositiveTtlAndCapacity() {
        assertThatThrownBy(() -> new ResponseCache(clock, Duration.ZERO, 3)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ResponseCache(clock, Duration.ofSeconds(1), 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fingerprintIsStableHexAndSeparatesFields() {
        String a = ResponseCache.fingerprint("gemini-2.5-flash", "prompt", "sys");

        assertThat(a).hasSize(64).matches("[0-9a-f]+");
        assertThat(ResponseCache.fingerprint("gemini-2.5-flash", "prompt", "sys")).isEqualTo(a);
        assertThat(ResponseCache.fingerprint("gemini-2.5-flash", "promp", "tsys")).isNotEqualTo(a);
        assertThat(ResponseCache.fingerprint("other-model", "prompt", "sys")).isNotEqualTo(a);
    }
}
