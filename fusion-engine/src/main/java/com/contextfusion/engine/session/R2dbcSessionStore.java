package com.contextfusion.engine.session;

import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * {@link SessionStore} backed by Spring Data R2DBC.
 *
 * <p>Session ids are assigned before insertion, so inserts and updates go through
 * {@link R2dbcEntityTemplate} explicitly; reads use the derived repositories.
 */
@Component
public class R2dbcSessionStore implements SessionStore {

    private final R2dbcEntityTemplate template;
    private final DownloadSessionRepository sessionRepository;
    private final SessionFileRepository fileRepository;

    public R2dbcSessionStore(R2dbcEntityTemplate template,
                             DownloadSessionRepository sessionRepository,
                             SessionFileRepository fileRepository) {
        this.template          = template;
        this.sessionRepository = sessionRepository;
        this.fileRepository    = fileRepository;
    }

    @Override
    public Mono<DownloadSession> insert(DownloadSession session) {
        return template.insert(session);
    }

    @Override
    public Mono<DownloadSession> update(DownloadSession session) {
        return template.update(session);
    }

    @Override
    public Flux<DownloadSession> findActive() {
        return sessionRepository.findByActiveTrueOrderByStartTimeDesc();
    }

    @Override
    public Mono<DownloadSession> findById(String id) {
        return sessionRepository.findById(id);
    }

    @Override
    public Flux<DownloadSession> findRecent(int limit, boolean includeActive) {
        return includeActive
            ? sessionRepository.findRecent(limit)
            : sessionRepository.findRecentClosed(limit);
    }

    @Override
    public Mono<SessionFile> addFile(SessionFile file) {
        return fileRepository.save(file);
    }

    @Override
    public Flux<SessionFile> findFiles(String sessionId) {
        return fileRepository.findBySessionIdOrderByAddedAtAsc(sessionId);
    }

    @Override
    public Mono<Long> countAll() {
        return sessionRepository.count();
    }

    @Override
    public Mono<Double> averageFileCount() {
        return template.getDatabaseClient()
            .sql("SELECT COALESCE(AVG(CAST(file_count AS DOUBLE)), 0) AS avg_files FROM download_sessions")
            .map((row, meta) -> row.get("avg_files", Double.class))
            .one()
            .defaultIfEmpty(0.0);
    }

    @Override
    public Mono<GroupActivity> mostActiveGroup() {
        return template.getDatabaseClient()
            .sql("""
                SELECT group_name, COUNT(*) AS session_count
                FROM download_sessions
                GROUP BY group_name
                ORDER BY session_count DESC, MAX(start_time) DESC
                LIMIT 1
                """)
            .map((row, meta) -> new GroupActivity(
                row.get("group_name", String.class),
                row.get("session_count", Long.class)))
            .one();
    }
}
