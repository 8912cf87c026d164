package com.poweragent.agent.persistence;

import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface LearningRecordRepository extends ReactiveCrudRepository<LearningRecordEntity, Long> {

    /**
     * Newest {@code limit} records of one kind, newest first.
     */
    @Query("SELECT * FROM learning_record WHERE kind = :kind ORDER BY id DESC LIMIT :limit")
    Flux<LearningRecordEntity> findLatest(String kind, int limit);

    /**
     * Drops everything of {@code kind} except the newest {@code keep} rows.
     */
    @Modifying
    @Query("""
        DELETE FROM learning_record
        WHERE kind = :kind
          AND id < (SELECT COALESCE(MIN(id), 0) FROM
                      (SELECT id FROM learning_record WHERE kind = :kind ORDER BY id DESC LIMIT :keep) newest)
        """)
    Mono<Integer> pruneOlderThanNewest(String kind, int keep);
}
