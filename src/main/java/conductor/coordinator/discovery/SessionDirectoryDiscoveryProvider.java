package conductor.coordinator.discovery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import conductor.coordinator.model.WorkerDescriptor;
import conductor.coordinator.util.ResourceContexts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Discovers agent sessions from a projects directory laid out as
 *
 * <pre>
 * root/
 *   C--work-repoA/          encoded repository path (C:\work\repoA)
 *     5f1c0e2a-....jsonl    one session log per agent
 *   -home-dev-repoB/        encoded repository path (/home/dev/repoB)
 *     ...
 * </pre>
 *
 * Each session file becomes one worker. The worker counts as recently active
 * when one of the last lines of its log is an assistant message.
 */
public class SessionDirectoryDiscoveryProvider implements DiscoveryProvider {

    private static final Logger log = LoggerFactory.getLogger(SessionDirectoryDiscoveryProvider.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String KIND = "session-agent";
    static final String SESSION_SUFFIX = ".jsonl";
    static final int TAIL_LINES = 5;

    private final Path root;
    private final boolean requireExistingPath;

    public SessionDirectoryDiscoveryProvider(Path root) {
        this(root, true);
    }

    /**
     * @param requireExistingPath skip projects whose decoded repository path
     *                            does not exist on this machine
     */
    public SessionDirectoryDiscoveryProvider(Path root, boolean requireExistingPath) {
        this.root = root;
        this.requireExistingPath = requireExistingPath;
    }

    @Override
    public List<WorkerDescriptor> discoverAll() {
        List<WorkerDescriptor> result = new ArrayList<>();
        if (root == null || !Files.isDirectory(root)) {
            log.debug("Sessions root {} does not exist", root);
            return result;
        }

        try (DirectoryStream<Path> projects = Files.newDirectoryStream(root, Files::isDirectory)) {
            for (Path projectDir : projects) {
                scanProject(projectDir, result);
            }
        } catch (IOException e) {
            log.warn("Failed to list sessions root {}: {}", root, e.getMessage());
        }

        log.debug("Discovered {} sessions under {}", result.size(), root);
        return result;
    }

    private void scanProject(Path projectDir, List<WorkerDescriptor> sink) {
        String repositoryPath = decodeProjectPath(projectDir.getFileName().toString());
        if (repositoryPath.isEmpty()) {
            return;
        }
        if (requireExistingPath && !Files.isDirectory(Path.of(repositoryPath))) {
            log.debug("Skipping project {}: {} not found", projectDir.getFileName(), repositoryPath);
            return;
        }

        String repoName = ResourceContexts.lastSegment(repositoryPath);
        try (DirectoryStream<Path> sessions = Files.newDirectoryStream(projectDir, "*" + SESSION_SUFFIX)) {
            for (Path sessionFile : sessions) {
                try {
                    sink.add(describe(sessionFile, repositoryPath, repoName));
                } catch (IOException e) {
                    log.warn("Skipping unreadable session {}: {}", sessionFile, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.warn("Failed to list sessions in {}: {}", projectDir, e.getMessage());
        }
    }

    private WorkerDescriptor describe(Path sessionFile, String repositoryPath, String repoName) throws IOException {
        String fileName = sessionFile.getFileName().toString();
        String sessionId = fileName.substring(0, fileName.length() - SESSION_SUFFIX.length());
        Instant lastWrite = Files.getLastModifiedTime(sessionFile).toInstant();
        String shortId = sessionId.length() > 8 ? sessionId.substring(0, 8) : sessionId;

        return new WorkerDescriptor(
                repoName + "_" + sessionId,
                KIND + " - " + repoName + " (" + shortId + ")",
                KIND,
                repositoryPath,
                sessionId,
                lastWrite,
                hasRecentAssistantOutput(sessionFile));
    }

    /**
     * True if one of the last {@value #TAIL_LINES} log lines is an assistant message.
     * Lines that are not valid JSON are ignored.
     */
    static boolean hasRecentAssistantOutput(Path sessionFile) {
        List<String> lines;
        try {
            lines = Files.readAllLines(sessionFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.debug("Cannot read session log {}: {}", sessionFile, e.getMessage());
            return false;
        }

        for (String line : lines.subList(Math.max(0, lines.size() - TAIL_LINES), lines.size())) {
            if (line.isBlank()) {
                continue;
            }
            try {
                JsonNode node = MAPPER.readTree(line);
                if ("assistant".equals(node.path("type").asText())) {
                    return true;
                }
            } catch (JsonProcessingException e) {
                log.trace("Ignoring malformed line in {}", sessionFile);
            }
        }
        return false;
    }

    /**
     * Decode a project directory name into the repository path it stands for.
     * {@code C--work-repoA} becomes {@code C:\work\repoA}; a leading dash marks
     * an absolute POSIX path, so {@code -home-dev-repoB} becomes {@code /home/dev/repoB}.
     */
    static String decodeProjectPath(String encoded) {
        if (encoded == null || encoded.isEmpty()) {
            return "";
        }
        if (encoded.length() >= 3 && Character.isLetter(encoded.charAt(0))
                && encoded.charAt(1) == '-' && encoded.charAt(2) == '-') {
            String drive = encoded.substring(0, 1).toUpperCase(Locale.ROOT) + ":\\";
            String rest = encoded.substring(3).replace("--", "-").replace('-', '\\');
            return drive + rest;
        }
        // leading dash -> absolute path, otherwise relative
        return encoded.replace('-', '/');
    }
}
