package com.contextfusion.engine.session;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * One file recorded against a {@link DownloadSession}.
 */
@Data
@NoArgsConstructor
@Table("session_files")
public class SessionFile {

    @Id
    private Long id;

    private String sessionId;

    private String fileName;

    private String filePath;

    private long fileSize;

    private LocalDateTime addedAt;

    public static SessionFile of(String sessionId, String fileName, String filePath, long fileSize, LocalDateTime addedAt) {
        SessionFile file = new SessionFile();
        file.setSessionId(sessionId);
        file.setFileName(fileName);
        file.setFilePath(filePath);
        file.setFileSize(fileSize);
        file.setAddedAt(addedAt);
        return file;
    }
}
