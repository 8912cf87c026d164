package com.poweragent.agent.persistence;

import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface ModelStateRepository extends ReactiveCrudRepository<ModelStateEntity, Long> {

    @Query("SELECT * FROM model_state ORDER BY version DESC, id DESC LIMIT 1")
    Mono<ModelStateEntity> findLatest();

    /**
     * Drops every model row except the newest {@code keep}.
     */
    @Modifying
    @Query("""
        DELETE FROM model_state
        WHERE id < (SELECT COALESCE(MIN(id), 0) FROM
                      (SELECT id FROM model_state ORDER BY id DESC LIMIT :keep) newest)
        """)
    Mono<Integer> pruneOlderThanNewest(int keep);
}
