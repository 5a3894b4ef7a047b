package com.foodtruck.common.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * Enables {@code @CreatedDate}/{@code @LastModifiedDate}. Kept off the application
 * class so {@code @WebMvcTest} slices do not need a JPA context.
 */
@Configuration
@EnableJpaAuditing
public class JpaConfig {
}
