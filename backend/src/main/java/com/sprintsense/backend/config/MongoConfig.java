package com.sprintsense.backend.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.EnableMongoAuditing;

/**
 * Fills {@code @CreatedDate} on goals and work items, which the goal ordering
 * relies on.
 */
@Configuration
@EnableMongoAuditing
public class MongoConfig {
}
