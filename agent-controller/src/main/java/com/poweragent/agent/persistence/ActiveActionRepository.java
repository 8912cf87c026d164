package com.poweragent.agent.persistence;

import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface ActiveActionRepository extends ReactiveCrudRepository<ActiveActionEntity, Long> {

    Mono<ActiveActionEntity> findByActionId(String actionId);

    @Modifying
    @Query("DELETE FROM active_action WHERE action_id = :actionId")
    Mono<Integer> deleteByActionId(String actionId);
}
