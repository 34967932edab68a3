package com.contextfusion.engine.session;

import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface DownloadSessionRepository extends ReactiveCrudRepository<DownloadSession, String> {

    Flux<DownloadSession> findByActiveTrueOrderByStartTimeDesc();

    @Query("""
        SELECT * FROM download_sessions
        ORDER BY start_time DESC
        LIMIT :limit
        """)
    Flux<DownloadSession> findRecent(int limit);

    @Query("""
        SELECT * FROM download_sessions
        WHERE active = FALSE
        ORDER BY start_time DESC
        LIMIT :limit
        """)
    Flux<DownloadSession> findRecentClosed(int limit);
}
