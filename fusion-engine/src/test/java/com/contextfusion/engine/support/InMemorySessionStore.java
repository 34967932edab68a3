package com.contextfusion.engine.support;

import com.contextfusion.engine.session.DownloadSession;
import com.contextfusion.engine.session.GroupActivity;
import com.contextfusion.engine.session.SessionFile;
import com.contextfusion.engine.session.SessionStore;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.stream.Collectors;

/** {@link SessionStore} over plain collections, with a switch to make writes fail. */
public class InMemorySessionStore implements SessionStore {

    private final Map<String, DownloadSession> sessions = new LinkedHashMap<>();
    private final List<SessionFile> files = new ArrayList<>();
    private final AtomicLong fileIds = new AtomicLong();

    private volatile boolean failWrites;
    private volatile boolean failReads;

    public void failWrites(boolean fail) {
        this.failWrites = fail;
    }

    public void failReads(boolean fail) {
        this.failReads = fail;
    }

    public synchronized void put(DownloadSession session) {
        sessions.put(session.getId(), session.copy());
    }

    public synchronized DownloadSession stored(String id) {
        DownloadSession s = sessions.get(id);
        return s == null ? null : s.copy();
    }

    public synchronized List<SessionFile> storedFiles() {
        return List.copyOf(files);
    }

    @Override
    public Mono<DownloadSession> insert(DownloadSession session) {
        return write(() -> {
            synchronized (this) {
                sessions.put(session.getId(), session.copy());
            }
            return session;
        });
    }

    @Override
    public Mono<DownloadSession> update(DownloadSession session) {
        return write(() -> {
            synchronized (this) {
                sessions.put(session.getId(), session.copy());
            }
            return session;
        });
    }

    @Override
    public Flux<DownloadSession> findActive() {
        return read(all -> all.stream().filter(DownloadSession::isActive).toList());
    }

    @Override
    public Mono<DownloadSession> findById(String id) {
        return read(all -> all.stream().filter(s -> s.getId().equals(id)).toList()).next();
    }

    @Override
    public Flux<DownloadSession> findRecent(int limit, boolean includeActive) {
        return read(all -> all.stream()
            .filter(s -> includeActive || !s.isActive())
            .limit(limit)
            .toList());
    }

    @Override
    public Mono<SessionFile> addFile(SessionFile file) {
        return write(() -> {
            synchronized (this) {
                file.setId(fileIds.incrementAndGet());
                files.add(file);
            }
            return file;
        });
    }

    @Override
    public Flux<SessionFile> findFiles(String sessionId) {
        return Flux.defer(() -> {
            synchronized (this) {
                return Flux.fromIterable(files.stream().filter(f -> f.getSessionId().equals(sessionId)).toList());
            }
        });
    }

    @Override
    public Mono<Long> countAll() {
        return read(List::copyOf).count();
    }

    @Override
    public Mono<Double> averageFileCount() {
        return read(List::copyOf).collectList()
            .map(all -> all.stream().mapToInt(DownloadSession::getFileCount).average().orElse(0.0));
    }

    @Override
    public Mono<GroupActivity> mostActiveGroup() {
        return read(List::copyOf).collectList()
            .flatMap(all -> Mono.justOrEmpty(all.stream()
                .collect(Collectors.groupingBy(DownloadSession::getGroupName, LinkedHashMap::new, Collectors.counting()))
                .entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .map(e -> new GroupActivity(e.getKey(), e.getValue()))));
    }

    private <T> Mono<T> write(java.util.function.Supplier<T> action) {
        return Mono.defer(() -> failWrites
            ? Mono.error(new IllegalStateException("store unavailable"))
            : Mono.just(action.get()));
    }

    private Flux<DownloadSession> read(Function<List<DownloadSession>, List<DownloadSession>> query) {
        return Flux.defer(() -> {
            if (failReads) {
                return Flux.error(new IllegalStateException("store unavailable"));
            }
            List<DownloadSession> snapshot;
            synchronized (this) {
                snapshot = sessions.values().stream()
                    .sorted(Comparator.comparing(DownloadSession::getStartTime).reversed())
                    .map(DownloadSession::copy)
                    .toList();
            }
            return Flux.fromIterable(query.apply(snapshot));
        });
    }
}
