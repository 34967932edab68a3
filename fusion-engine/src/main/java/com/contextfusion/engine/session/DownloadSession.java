package com.contextfusion.engine.session;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * A batch of downloads attributed to one group. At most one session is active at a time;
 * {@link DownloadSessionManager} owns that invariant.
 *
 * <p>The id is assigned by the manager (UUID) before the row is inserted.
 */
@Data
@NoArgsConstructor
@Table("download_sessions")
public class DownloadSession {

    @Id
    private String id;

    private String groupName;

    private LocalDateTime startTime;

    private LocalDateTime endTime;

    private LocalDateTime lastActivity;

    private int timeoutSeconds;

    private double confidenceScore;

    private int fileCount;

    private boolean active;

    private String windowTitle;

    private String processName;

    public boolean hasTimedOut(LocalDateTime now) {
        return active && Duration.between(lastActivity, now).toMillis() > timeoutSeconds * 1000L;
    }

    public DownloadSession copy() {
        DownloadSession copy = new DownloadSession();
        copy.setId(id);
        copy.setGroupName(groupName);
        copy.setStartTime(startTime);
        copy.setEndTime(endTime);
        copy.setLastActivity(lastActivity);
        copy.setTimeoutSeconds(timeoutSeconds);
        copy.setConfidenceScore(confidenceScore);
        copy.setFileCount(fileCount);
        copy.setActive(active);
        copy.setWindowTitle(windowTitle);
        copy.setProcessName(processName);
        return copy;
    }
}
