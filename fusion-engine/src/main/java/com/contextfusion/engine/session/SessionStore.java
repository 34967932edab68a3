package com.contextfusion.engine.session;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Persistence port for sessions and their files.
 */
public interface SessionStore {

    Mono<DownloadSession> insert(DownloadSession session);

    Mono<DownloadSession> update(DownloadSession session);

    /** Active rows, most recently started first. */
    Flux<DownloadSession> findActive();

    Mono<DownloadSession> findById(String id);

    /** Most recently started sessions first. */
    Flux<DownloadSession> findRecent(int limit, boolean includeActive);

    Mono<SessionFile> addFile(SessionFile file);

    Flux<SessionFile> findFiles(String sessionId);

    Mono<Long> countAll();

    /** 0.0 when no session exists. */
    Mono<Double> averageFileCount();

    /** Empty when no session exists. */
    Mono<GroupActivity> mostActiveGroup();
}
