package com.repo.quality.git;

import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.LogCommand;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.diff.DiffEntry;
import org.eclipse.jgit.diff.DiffEntry.ChangeType;
import org.eclipse.jgit.diff.DiffFormatter;
import org.eclipse.jgit.diff.Edit;
import org.eclipse.jgit.diff.RawTextComparator;
import org.eclipse.jgit.diff.RenameDetector;
import org.eclipse.jgit.errors.RepositoryNotFoundException;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.util.io.DisabledOutputStream;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads commit records from a local Git repository with JGit.
 * Every commit is diffed against its first parent only; merge commits are never compared with their other
 * parents. Root commits carry no changed files. A renamed file is listed once, under its new path, while
 * its line counts come from the plain delete and add.
 */
public class JGitCommitSource implements CommitSource, AutoCloseable {

    private static final int SHORT_HASH_LENGTH = 7;

    private record LineDelta(int added, int deleted) {
        static final LineDelta NONE = new LineDelta(0, 0);
    }

    private final Path repoRoot;
    private final Git git;

    private JGitCommitSource(Path repoRoot, Git git) {
        this.repoRoot = repoRoot;
        this.git = git;
    }

    /**
     * Open the repository at the given working tree (or bare repository) path.
     *
     * @throws IllegalArgumentException if the path does not exist or is not a Git repository
     */
    public static JGitCommitSource open(Path repoRoot) throws IOException {
        if (!Files.isDirectory(repoRoot)) {
            throw new IllegalArgumentException("Project path does not exist: " + repoRoot);
        }
        try {
            return new JGitCommitSource(repoRoot, Git.open(repoRoot.toFile()));
        } catch (RepositoryNotFoundException e) {
            throw new IllegalArgumentException("Not a valid Git repository: " + repoRoot, e);
        }
    }

    @Override
    public List<CommitRecord> fetch(CommitRange range, int maxCommits) throws IOException {
        Repository repository = git.getRepository();
        ObjectId newer = repository.resolve(range.newerOrHead());
        if (newer == null) {
            if (range.newerRevision() == null) {
                System.out.println("No HEAD commit found in " + repoRoot);
                return List.of();
            }
            throw new IllegalArgumentException("Unknown revision: " + range.newerRevision());
        }

        LogCommand log = git.log().setMaxCount(maxCommits);
        if (range.hasOlder()) {
            ObjectId older = repository.resolve(range.olderRevision());
            if (older == null) {
                throw new IllegalArgumentException("Unknown revision: " + range.olderRevision());
            }
            log.addRange(older, newer);
        } else {
            log.add(newer);
        }

        List<CommitRecord> records = new ArrayList<>();
        try (DiffFormatter formatter = new DiffFormatter(DisabledOutputStream.INSTANCE);
                RevWalk walk = new RevWalk(repository)) {
            formatter.setRepository(repository);
            formatter.setDiffComparator(RawTextComparator.DEFAULT);
            formatter.setDetectRenames(false);

            for (RevCommit commit : log.call()) {
                records.add(toRecord(commit, formatter, walk));
            }
        } catch (GitAPIException e) {
            throw new IOException("Can't read history for " + range.describe(), e);
        }
        return records;
    }

    /**
     * The latest commits reachable from HEAD, newest first. Nothing is diffed, so the records carry no changed
     * files and no line counts.
     */
    public List<CommitRecord> recentCommits(int limit) throws IOException {
        ObjectId head = git.getRepository().resolve(CommitRange.HEAD);
        if (head == null)
            return List.of();

        List<CommitRecord> records = new ArrayList<>();
        try {
            for (RevCommit commit : git.log().add(head).setMaxCount(limit).call()) {
                records.add(new CommitRecord(
                        commit.getName().substring(0, SHORT_HASH_LENGTH),
                        authorOf(commit),
                        commit.getCommitTime(),
                        offsetOf(commit.getCommitterIdent()),
                        commit.getFullMessage(),
                        commit.getParentCount(),
                        List.of(),
                        0,
                        0));
            }
        } catch (GitAPIException e) {
            throw new IOException("Can't read recent commits", e);
        }
        return records;
    }

    private CommitRecord toRecord(RevCommit commit, DiffFormatter formatter, RevWalk walk) throws IOException {
        List<String> files = new ArrayList<>();
        LineDelta delta = LineDelta.NONE;

        if (commit.getParentCount() > 0) {
            RevCommit parent = walk.parseCommit(commit.getParent(0));
            List<DiffEntry> entries = formatter.scan(parent.getTree(), commit.getTree());
            for (DiffEntry entry : detectRenames(entries, commit)) {
                files.add(pathOf(entry));
            }
            delta = countLines(formatter, entries, commit);
        }

        return new CommitRecord(
                commit.getName().substring(0, SHORT_HASH_LENGTH),
                authorOf(commit),
                commit.getCommitTime(),
                offsetOf(commit.getCommitterIdent()),
                commit.getFullMessage(),
                commit.getParentCount(),
                files,
                delta.added(),
                delta.deleted());
    }

    private LineDelta countLines(DiffFormatter formatter, List<DiffEntry> entries, RevCommit commit) {
        int added = 0;
        int deleted = 0;
        try {
            for (DiffEntry entry : entries) {
                for (Edit edit : formatter.toFileHeader(entry).toEditList()) {
                    added += edit.getLengthB();
                    deleted += edit.getLengthA();
                }
            }
            return new LineDelta(added, deleted);
        } catch (IOException e) {
            System.err.println("Warning: diff stat unavailable for commit " + commit.getName() + ": " + e.getMessage());
            return LineDelta.NONE;
        }
    }

    private List<DiffEntry> detectRenames(List<DiffEntry> entries, RevCommit commit) {
        RenameDetector detector = new RenameDetector(git.getRepository());
        detector.addAll(entries);
        try {
            return detector.compute();
        } catch (IOException e) {
            System.err.println("Warning: rename detection failed for commit " + commit.getName() + ": " + e.getMessage());
            return entries;
        }
    }

    private static String pathOf(DiffEntry entry) {
        return entry.getChangeType() == ChangeType.DELETE ? entry.getOldPath() : entry.getNewPath();
    }

    private static String authorOf(RevCommit commit) {
        PersonIdent author = commit.getAuthorIdent();
        if (author != null && author.getName() != null) {
            return author.getName();
        }
        return "unknown";
    }

    private static ZoneOffset offsetOf(PersonIdent ident) {
        if (ident == null)
            return ZoneOffset.UTC;
        return ZoneOffset.ofTotalSeconds(ident.getTimeZoneOffset() * 60);
    }

    @Override
    public void close() {
        git.close();
    }
}
