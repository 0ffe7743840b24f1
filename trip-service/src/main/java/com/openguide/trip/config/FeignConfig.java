package com.openguide.trip.config;

import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.context.annotation.Configuration;

/**
 * Directory and payment provider clients. Kept off the application class so JPA slice tests do not need them.
 */
@Configuration
@EnableFeignClients(basePackages = "com.openguide.trip.client")
public class FeignConfig {
}
