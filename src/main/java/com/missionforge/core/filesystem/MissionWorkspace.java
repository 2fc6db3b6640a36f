package com.missionforge.core.filesystem;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Workspace on disk: one directory per verification session.
 *
 *   <workspace>/<sessionId>/mission_*.pml   model-checker inputs and trails
 *   <workspace>/<sessionId>/mission.xml     the verified mission
 *
 * All paths are resolved under the workspace root; anything escaping it is rejected.
 */
@Component
public class MissionWorkspace {

    private static final Logger log = LoggerFactory.getLogger(MissionWorkspace.class);

    public static final String MISSION_FILE = "mission.xml";

    private final Path workspaceRoot;

    public MissionWorkspace(
            @Value("${mission.workspace.path:./workspace}") String workspacePath
    ) {
        this.workspaceRoot = Paths.get(workspacePath).toAbsolutePath().normalize();
        try {
            if (!Files.exists(workspaceRoot)) {
                Files.createDirectories(workspaceRoot);
                log.info("[Workspace] Created workspace: {}", workspaceRoot);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialize workspace: " + workspacePath, e);
        }
        log.info("[Workspace] Workspace initialized: {}", workspaceRoot);
    }

    public Path createSessionDirectory(String sessionId) throws WorkspaceException {
        Path sessionDir = resolveSafePath(sessionId);
        try {
            Files.createDirectories(sessionDir);
        } catch (IOException e) {
            throw new WorkspaceException("Failed to create session directory: " + sessionId, e);
        }
        log.info("[Workspace] Session directory: {}", sessionDir);
        return sessionDir;
    }

    /** Write the verified mission into the session directory. */
    public Path writeMission(String sessionId, String missionXml) throws WorkspaceException {
        String relative = sessionId + "/" + MISSION_FILE;
        writeFile(relative, missionXml);
        return resolveSafePath(relative);
    }

    private void writeFile(String relativePath, String content) throws WorkspaceException {
        Path targetPath = resolveSafePath(relativePath);
        log.info("[Workspace] Writing file: {}", relativePath);
        try {
            Path parent = targetPath.getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.writeString(targetPath, content, StandardCharsets.UTF_8);
            log.info("[Workspace] Wrote {} bytes to {}", content.length(), relativePath);
        } catch (IOException e) {
            throw new WorkspaceException("Failed to write file: " + relativePath, e);
        }
    }

    private Path resolveSafePath(String relativePath) throws WorkspaceException {
        if (relativePath == null || relativePath.trim().isEmpty())
            throw new WorkspaceException("Path cannot be empty");
        Path resolved = workspaceRoot.resolve(relativePath).normalize();
        if (!resolved.startsWith(workspaceRoot) || resolved.equals(workspaceRoot))
            throw new WorkspaceException("Path escapes the workspace: " + relativePath);
        return resolved;
    }

    public static class WorkspaceException extends Exception {
        public WorkspaceException(String message)                  { super(message); }
        public WorkspaceException(String message, Throwable cause) { super(message, cause); }
    }
}
