package com.contextfusion.engine.pattern;

import com.contextfusion.common.model.FilePattern;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

/**
 * Persistence port for learned {@link FilePattern}s.
 */
public interface PatternStore {

    /**
     * Highest-confidence pattern matching the file (ties: most observations); empty when none match.
     */
    Mono<FilePattern> bestPattern(String fileName, String extension, LocalDateTime observedAt);

    /** Inserts a pattern without id, updates one with an id. */
    Mono<FilePattern> savePattern(FilePattern pattern);

    Flux<FilePattern> patternsForGroup(String groupName);
}
