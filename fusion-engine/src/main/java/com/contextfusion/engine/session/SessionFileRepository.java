package com.contextfusion.engine.session;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface SessionFileRepository extends ReactiveCrudRepository<SessionFile, Long> {

    Flux<SessionFile> findBySessionIdOrderByAddedAtAsc(String sessionId);
}
