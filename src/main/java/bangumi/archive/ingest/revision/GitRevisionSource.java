package bangumi.archive.ingest.revision;

import bangumi.archive.ingest.config.IngestProperties;
import bangumi.archive.ingest.exception.RevisionControlException;
import bangumi.archive.ingest.model.Revision;
import bangumi.archive.ingest.service.SnapshotDateResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * {@link RevisionSource} backed by the git command line, run against the archive
 * checkout directory.
 *
 * checkout uses "git checkout -f": uncommitted changes in the archive checkout are lost.
 */
@Component
public class GitRevisionSource implements RevisionSource {

    private static final Logger logger = LoggerFactory.getLogger(GitRevisionSource.class);

    private final IngestProperties properties;
    private final SnapshotDateResolver dateResolver;

    public GitRevisionSource(IngestProperties properties, SnapshotDateResolver dateResolver) {
        this.properties = properties;
        this.dateResolver = dateResolver;
    }

    @Override
    public List<Revision> listRevisionsSince(LocalDate startDate) {
        String branch = properties.getIteration().getBranch();
        String output = runGit("log", "--reverse", "--pretty=%H %s", branch);
        List<Revision> revisions = parseRevisionLog(output, startDate, dateResolver);
        logger.info("Found {} revisions on {} from {}", revisions.size(), branch, startDate);
        return revisions;
    }

    @Override
    public void checkout(Revision revision) {
        runGit("checkout", "-f", revision.getId());
        logger.info("Checked out {} {}", revision.getShortId(), revision.getSubject());
    }

    @Override
    public String readMessage(Revision revision) {
        return runGit("log", "-1", "--pretty=%B", revision.getId()).strip();
    }

    /**
     * Parse "git log --reverse --pretty=%H %s" output and keep the tail starting at the
     * first commit dated on or after startDate. Commits after that point are kept even
     * when undated, so the caller can report them.
     */
    static List<Revision> parseRevisionLog(String output, LocalDate startDate, SnapshotDateResolver resolver) {
        List<Revision> all = new ArrayList<>();
        for (String line : output.split("\\R")) {
            if (line.isBlank()) {
                continue;
            }
            String trimmed = line.strip();
            int space = trimmed.indexOf(' ');
            String hash = space > 0 ? trimmed.substring(0, space) : trimmed;
            String subject = space > 0 ? trimmed.substring(space + 1) : "";
            all.add(new Revision(hash, subject));
        }

        for (int i = 0; i < all.size(); i++) {
            Optional<LocalDate> date = resolver.tryResolve(all.get(i).getSubject());
            if (date.isPresent() && !date.get().isBefore(startDate)) {
                return new ArrayList<>(all.subList(i, all.size()));
            }
        }
        return Collections.emptyList();
    }

    private String runGit(String... args) {
        List<String> command = new ArrayList<>();
        command.add(properties.getGit().getExecutable());
        command.add("-C");
        command.add(properties.getArchivePath().toString());
        Collections.addAll(command, args);

        logger.debug("Running: {}", String.join(" ", command));

        ProcessBuilder builder = new ProcessBuilder(command);
        builder.redirectErrorStream(true);

        try {
            Process process = builder.start();
            String output;
            try (InputStream in = process.getInputStream()) {
                output = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                throw new RevisionControlException(String.format("git %s exited with %d: %s",
                        String.join(" ", args), exitCode, output.strip()));
            }
            return output;
        } catch (IOException e) {
            throw new RevisionControlException("Failed to run git " + String.join(" ", args), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RevisionControlException("Interrupted while running git " + String.join(" ", args), e);
        }
    }
}
