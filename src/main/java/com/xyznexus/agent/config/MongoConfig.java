package com.xyznexus.agent.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.EnableMongoAuditing;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

/**
 * Enables auditing so @CreatedDate is populated on run traces.
 */
@Configuration
@EnableMongoAuditing
@EnableMongoRepositories(basePackages = "com.xyznexus.agent.observability")
public class MongoConfig {
}
