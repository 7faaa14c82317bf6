package com.ombudsman.connpool.util;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

public final class UtilityElf {

    private UtilityElf() {
        // non-constructable
    }

    /**
     * @return null if string is null or blank, otherwise the trimmed string
     */
    public static String getNullIfEmpty(String text) {
        return text == null ? null : text.trim().isEmpty() ? null : text.trim();
    }

    /**
     * Checks whether an object is an instance of given type without throwing exception when the class is not loaded.
     *
     * @param obj       the object to check
     * @param className String class
     * @return true if object is assignable from the type, false otherwise or when the class cannot be loaded
     */
    public static boolean safeIsAssignableFrom(@NotNull Object obj, String className) {
        try {
            Class<?> clazz = Class.forName(className);
            return clazz.isAssignableFrom(obj.getClass());
        } catch (ClassNotFoundException ignored) {
            return false;
        }
    }

    /**
     * Create the single-threaded scheduler that runs a pool's housekeeping task.
     * Pending delayed tasks are dropped on shutdown and cancelled tasks are removed
     * from the work queue immediately.
     *
     * @param threadName    the thread name
     * @param threadFactory an optional ThreadFactory
     * @return a ScheduledThreadPoolExecutor
     */
    public static @NotNull ScheduledThreadPoolExecutor createHousekeepingExecutor(String threadName,
                                                                                ThreadFactory threadFactory) {
        if (threadFactory == null) {
            threadFactory = new DefaultThreadFactory(threadName, true);
        }

        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1,
                threadFactory, new ThreadPoolExecutor.DiscardPolicy());

        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    public static final class DefaultThreadFactory implements ThreadFactory {

        private final AtomicInteger threadNumber = new AtomicInteger();
        private final String threadName;
        private final boolean daemon;

        public DefaultThreadFactory(String threadName, boolean daemon) {
            this.threadName = threadName;
            this.daemon = daemon;
        }

        @Override
        public @NotNull Thread newThread(@NotNull Runnable runnable) {
            int number = threadNumber.incrementAndGet();
            Thread thread = new Thread(runnable, number == 1 ? threadName : threadName + "-" + number);
            thread.setDaemon(daemon);
            return thread;
        }
    }
}
