package com.watchroom.service;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * {@link TaskTimer} on top of the application's Spring {@link TaskScheduler}.
 */
@Component
public class SchedulerTaskTimer implements TaskTimer {

    private final TaskScheduler taskScheduler;

    public SchedulerTaskTimer(TaskScheduler taskScheduler) {
        this.taskScheduler = taskScheduler;
    }

    @Override
    public TimerHandle schedule(Runnable task, Duration delay) {
        ScheduledFuture<?> future = taskScheduler.schedule(task, taskScheduler.getClock().instant().plus(delay));
        return () -> future.cancel(false);
    }
}
