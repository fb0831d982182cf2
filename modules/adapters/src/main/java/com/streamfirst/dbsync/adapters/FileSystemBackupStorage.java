package com.streamfirst.dbsync.adapters;

import com.streamfirst.dbsync.domain.BackupArtifact;
import com.streamfirst.dbsync.ports.BackupStoragePort;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Keeps backups as files in a local directory, named {@code <name>_<yyyyMMdd_HHmmss_SSS>.db}
 * with a UTC timestamp so that lexical order is chronological. Archived backups move to the
 * {@code archive} subdirectory under the same name.
 */
@Slf4j
public class FileSystemBackupStorage implements BackupStoragePort {

    static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");
    private static final String EXTENSION = ".db";

    private final Path backupDirectory;
    private final Path archiveDirectory;
    private final String namePrefix;

    public FileSystemBackupStorage(Path backupDirectory, String databaseName) {
        this.backupDirectory = Objects.requireNonNull(backupDirectory);
        this.archiveDirectory = backupDirectory.resolve("archive");
        this.namePrefix = Objects.requireNonNull(databaseName) + "_";
    }

    public Path getBackupDirectory() {
        return backupDirectory;
    }

    public Path getArchiveDirectory() {
        return archiveDirectory;
    }

    @Override
    public synchronized Path allocate(Instant createdAt) {
        createDirectories(backupDirectory);
        Instant candidate = createdAt;
        Path path = backupDirectory.resolve(fileName(candidate));
        // two snapshots in the same millisecond get consecutive names
        while (Files.exists(path) || Files.exists(archiveDirectory.resolve(path.getFileName()))) {
            candidate = candidate.plusMillis(1);
            path = backupDirectory.resolve(fileName(candidate));
        }
        log.debug("Allocated backup path {}", path);
        return path;
    }

    @Override
    public BackupArtifact describe(Path path) {
        try {
            long size = Files.size(path);
            Instant createdAt = parseTimestamp(path.getFileName().toString())
                .orElse(Files.getLastModifiedTime(path).toInstant());
            return new BackupArtifact(path, createdAt, size);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to describe backup " + path, e);
        }
    }

    @Override
    public List<BackupArtifact> listActive() {
        return list(backupDirectory);
    }

    @Override
    public List<BackupArtifact> listArchived() {
        return list(archiveDirectory);
    }

    @Override
    public BackupArtifact archive(BackupArtifact artifact) {
        createDirectories(archiveDirectory);
        Path target = archiveDirectory.resolve(artifact.fileName());
        try {
            Files.move(artifact.path(), target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to archive backup " + artifact.path(), e);
        }
        log.info("Archived backup {}", artifact.fileName());
        return new BackupArtifact(target, artifact.createdAt(), artifact.sizeBytes());
    }

    @Override
    public void delete(BackupArtifact artifact) {
        try {
            if (Files.deleteIfExists(artifact.path())) {
                log.info("Removed backup {}", artifact.fileName());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete backup " + artifact.path(), e);
        }
    }

    @Override
    public void discard(Path path) {
        try {
            if (Files.deleteIfExists(path)) {
                log.debug("Discarded partial backup {}", path);
            }
        } catch (IOException e) {
            log.warn("Could not discard partial backup {}", path, e);
        }
    }

    private List<BackupArtifact> list(Path directory) {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files
                .filter(Files::isRegularFile)
                .filter(this::isBackupFile)
                .map(this::describe)
                .sorted(Comparator.comparing(BackupArtifact::createdAt)
                    .thenComparing(BackupArtifact::fileName))
                .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list backups in " + directory, e);
        }
    }

    private boolean isBackupFile(Path path) {
        String name = path.getFileName().toString();
        return name.startsWith(namePrefix) && name.endsWith(EXTENSION);
    }

    private String fileName(Instant createdAt) {
        return namePrefix + TIMESTAMP.format(LocalDateTime.ofInstant(createdAt, ZoneOffset.UTC)) + EXTENSION;
    }

    private Optional<Instant> parseTimestamp(String fileName) {
        if (!fileName.startsWith(namePrefix) || !fileName.endsWith(EXTENSION)) {
            return Optional.empty();
        }
        String stamp = fileName.substring(namePrefix.length(), fileName.length() - EXTENSION.length());
        try {
            return Optional.of(LocalDateTime.parse(stamp, TIMESTAMP).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            log.debug("Backup {} has no parsable timestamp, using modification time", fileName);
            return Optional.empty();
        }
    }

    private static void createDirectories(Path directory) {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create directory " + directory, e);
        }
    }
}
