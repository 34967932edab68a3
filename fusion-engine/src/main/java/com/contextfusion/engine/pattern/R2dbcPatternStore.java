package com.contextfusion.engine.pattern;

import com.contextfusion.common.model.FilePattern;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Comparator;

/**
 * {@link PatternStore} backed by Spring Data R2DBC. Candidate rows are narrowed by extension
 * in SQL; the remaining criteria are evaluated with {@link FilePattern#matches}.
 */
@Component
public class R2dbcPatternStore implements PatternStore {

    private static final Comparator<FilePattern> BEST_FIRST =
        Comparator.comparingDouble(FilePattern::confidenceScore)
                  .thenComparingInt(FilePattern::timesSeen);

    private final FilePatternRepository repository;

    public R2dbcPatternStore(FilePatternRepository repository) {
        this.repository = repository;
    }

    @Override
    public Mono<FilePattern> bestPattern(String fileName, String extension, LocalDateTime observedAt) {
        return repository.findCandidates(extension == null ? "" : extension)
            .map(FilePatternEntity::toModel)
            .filter(p -> p.matches(fileName, extension, observedAt))
            .reduce((a, b) -> BEST_FIRST.compare(b, a) > 0 ? b : a);
    }

    @Override
    public Mono<FilePattern> savePattern(FilePattern pattern) {
        return repository.save(FilePatternEntity.from(pattern))
            .map(FilePatternEntity::toModel);
    }

    @Override
    public Flux<FilePattern> patternsForGroup(String groupName) {
        return repository.findByGroupNameOrderByConfidenceScoreDesc(groupName)
            .map(FilePatternEntity::toModel);
    }
}
