package com.watchroom.service;

import java.time.Duration;

/**
 * One-shot delayed execution with a cancellable handle.
 * Lets tests drive room timers on virtual time.
 */
public interface TaskTimer {

    TimerHandle schedule(Runnable task, Duration delay);

    interface TimerHandle {

        /**
         * @return false if the task already ran or was cancelled before
         */
        boolean cancel();
    }
}
