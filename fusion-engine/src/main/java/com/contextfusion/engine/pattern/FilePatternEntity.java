package com.contextfusion.engine.pattern;

import com.contextfusion.common.model.FilePattern;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@Table("file_patterns")
public class FilePatternEntity {

    @Id
    private Long id;

    private String extension;

    private String namePattern;

    private Integer hourOfDay;

    private Integer dayOfWeek;

    private String groupName;

    private double confidenceScore;

    private int timesSeen;

    private int timesCorrect;

    private LocalDateTime lastSeen;

    public static FilePatternEntity from(FilePattern pattern) {
        FilePatternEntity entity = new FilePatternEntity();
        entity.setId(pattern.id());
        entity.setExtension(pattern.extension());
        entity.setNamePattern(pattern.namePattern());
        entity.setHourOfDay(pattern.hourOfDay());
        entity.setDayOfWeek(pattern.dayOfWeek());
        entity.setGroupName(pattern.groupName());
        entity.setConfidenceScore(pattern.confidenceScore());
        entity.setTimesSeen(pattern.timesSeen());
        entity.setTimesCorrect(pattern.timesCorrect());
        entity.setLastSeen(pattern.lastSeen());
        return entity;
    }

    public FilePattern toModel() {
        return new FilePattern(id, extension, namePattern, hourOfDay, dayOfWeek, groupName,
                               confidenceScore, timesSeen, timesCorrect, lastSeen);
    }
}
