package com.contextfusion.engine.pattern;

import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface FilePatternRepository extends ReactiveCrudRepository<FilePatternEntity, Long> {

    /**
     * Patterns that could match a file with {@code extension}: those without an extension
     * criterion plus those with the same extension (case-insensitive).
     */
    @Query("""
        SELECT * FROM file_patterns
        WHERE extension IS NULL
           OR extension = ''
           OR LOWER(extension) = LOWER(:extension)
        """)
    Flux<FilePatternEntity> findCandidates(String extension);

    Flux<FilePatternEntity> findByGroupNameOrderByConfidenceScoreDesc(String groupName);
}
