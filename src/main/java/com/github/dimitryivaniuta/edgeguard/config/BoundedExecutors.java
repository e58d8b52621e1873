package com.github.dimitryivaniuta.edgeguard.config;

import com.github.dimitryivaniuta.edgeguard.protection.EdgeProtectionProperties;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-ceiling pools with fail-fast rejection. Callers turn
 * {@link java.util.concurrent.RejectedExecutionException} into 503.
 */
final class BoundedExecutors {

    private static final long KEEP_ALIVE_SECONDS = 60;

    private BoundedExecutors() {
    }

    static ThreadPoolExecutor newPool(String threadPrefix, EdgeProtectionProperties.Pool pool) {
        BlockingQueue<Runnable> queue = pool.getQueueCapacity() == 0
                ? new SynchronousQueue<>()
                : new ArrayBlockingQueue<>(pool.getQueueCapacity());

        CustomizableThreadFactory threads = new CustomizableThreadFactory(threadPrefix);
        threads.setDaemon(true);

        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                pool.getMaxThreads(),
                pool.getMaxThreads(),
                KEEP_ALIVE_SECONDS,
                TimeUnit.SECONDS,
                queue,
                threads,
                new ThreadPoolExecutor.AbortPolicy()) {
            @Override
            protected void beforeExecute(Thread t, Runnable r) {
                // a cancelled task may leave the worker interrupted
                Thread.interrupted();
                super.beforeExecute(t, r);
            }
        };
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }
}
