package com.github.dimitryivaniuta.edgeguard.config;

import com.github.dimitryivaniuta.edgeguard.protection.EdgeProtectionProperties;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BoundedExecutorsTest {

    @Test
    void poolHasFixedCeilingAndConfiguredQueue() {
        ThreadPoolExecutor handOff = BoundedExecutors.newPool("t-", new EdgeProtectionProperties.Pool(4, 0));
        ThreadPoolExecutor queued = BoundedExecutors.newPool("t-", new EdgeProtectionProperties.Pool(2, 8));
        try {
            assertThat(handOff.getMaximumPoolSize()).isEqualTo(4);
            assertThat(handOff.getQueue()).isInstanceOf(SynchronousQueue.class);
            assertThat(queued.getQueue()).isInstanceOf(ArrayBlockingQueue.class);
            assertThat(queued.getQueue().remainingCapacity()).isEqualTo(8);
        } finally {
            handOff.shutdownNow();
            queued.shutdownNow();
        }
    }

    @Test
    void fullPoolRejectsInsteadOfGrowing() {
        ThreadPoolExecutor pool = BoundedExecutors.newPool("t-", new EdgeProtectionProperties.Pool(1, 0));
        CountDownLatch release = new CountDownLatch(1);
        try {
            pool.execute(() -> {
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });

            assertThatThrownBy(() -> pool.execute(() -> { }))
                    .isInstanceOf(RejectedExecutionException.class);
            assertThat(pool.getPoolSize()).isEqualTo(1);
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
    }
}
