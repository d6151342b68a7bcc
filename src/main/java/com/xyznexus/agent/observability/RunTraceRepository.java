package com.xyznexus.agent.observability;

import org.springframework.data.mongodb.repository.Aggregation;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface RunTraceRepository extends MongoRepository<RunTrace, String> {

    List<RunTrace> findByUserIdOrderByCreatedAtDesc(String userId);

    List<RunTrace> findBySessionIdOrderByCreatedAtDesc(String sessionId);

    @Aggregation(pipeline = {
        "{ $match: { 'userId': ?0 } }",
        "{ $group: { _id: null, avg: { $avg: '$totalLatencyMs' } } }"
    })
    Double avgLatencyForUser(String userId);

    @Aggregation(pipeline = {
        "{ $match: { 'userId': ?0, 'createdAt': { $gte: ?1 } } }",
        "{ $group: { _id: null, total: { $sum: '$totalTokens' } } }"
    })
    Long totalTokensUsedSince(String userId, Instant since);

    @Aggregation(pipeline = {
        "{ $match: { 'userId': ?0 } }",
        "{ $group: { _id: '$status', count: { $sum: 1 } } }"
    })
    List<StatusCount> statusBreakdownForUser(String userId);

    @Aggregation(pipeline = {
        "{ $match: { 'userId': ?0 } }",
        "{ $group: { _id: '$routingDecision', count: { $sum: 1 } } }"
    })
    List<StatusCount> routingBreakdownForUser(String userId);

    record StatusCount(String id, long count) {}
}
