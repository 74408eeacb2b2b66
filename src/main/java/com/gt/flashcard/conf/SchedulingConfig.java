package com.gt.flashcard.conf;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class SchedulingConfig {

    // One thread: due checks of a session never run concurrently with each other.
    @Bean
    public TaskScheduler getReviewSessionTaskScheduler() {
        ThreadPoolTaskScheduler taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.setPoolSize(1);
        taskScheduler.setThreadNamePrefix("review-session-");
        taskScheduler.setRemoveOnCancelPolicy(true);

        return taskScheduler;
    }
}
