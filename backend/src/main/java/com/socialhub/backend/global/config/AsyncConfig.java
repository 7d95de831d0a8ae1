package com.socialhub.backend.global.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * Enables {@code @Async} so password reset mail leaves the request thread.
 */
@Configuration
@EnableAsync
public class AsyncConfig {
}
