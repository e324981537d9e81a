package com.smurthy.ai.shopping.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.support.RetryTemplate;

@Configuration
public class RetryConfig {

    @Bean
    public RetryTemplate handlerRetryTemplate(RouterProperties properties) {
        return buildRetryTemplate(properties);
    }

    public static RetryTemplate buildRetryTemplate(RouterProperties properties) {
        RetryTemplate retryTemplate = new RetryTemplate();

        ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
        backOffPolicy.setInitialInterval(properties.initialBackoff().toMillis());
        backOffPolicy.setMultiplier(properties.backoffMultiplier());
        backOffPolicy.setMaxInterval(properties.maxBackoff().toMillis());
        retryTemplate.setBackOffPolicy(backOffPolicy);

        // first attempt + maxRetries
        retryTemplate.setRetryPolicy(new TransientFailureRetryPolicy(properties.maxRetries() + 1));
        retryTemplate.setThrowLastExceptionOnExhausted(true);

        return retryTemplate;
    }
}
