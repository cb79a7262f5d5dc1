package com.questrail.chamber.checkpoint;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.Optional;

/**
 * FileCheckpointStore
 * -----------------------------------------------------------------------------
 * {@link CheckpointStore} backed by a single JSON file.
 *
 * <h2>Atomicity</h2>
 * {@link #save(Checkpoint)} writes a sibling temporary file, forces it to the
 * device and renames it over the target. On file systems without atomic
 * rename the move falls back to a plain replace, which is still a single
 * rename on every platform this runs on.
 */
public final class FileCheckpointStore implements CheckpointStore
{
    private final Path file;
    private final Path tempFile;
    private final CheckpointCodec codec;

    public FileCheckpointStore(Path file, CheckpointCodec codec) {
        this.file = Objects.requireNonNull(file, "file").toAbsolutePath();
        this.codec = Objects.requireNonNull(codec, "codec");
        this.tempFile = this.file.resolveSibling(this.file.getFileName() + ".tmp");
    }

    public Path file() {
        return file;
    }

    @Override
    public void save(Checkpoint checkpoint) throws IOException {
        Objects.requireNonNull(checkpoint, "checkpoint");
        byte[] content = codec.encode(checkpoint);

        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        try (FileChannel channel = FileChannel.open(tempFile,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE)) {
            ByteBuffer buffer = ByteBuffer.wrap(content);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }

        try {
            Files.move(tempFile, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tempFile, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public Optional<Checkpoint> load() throws IOException {
        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
        return Optional.of(codec.decode(content));
    }

    @Override
    public void delete() throws IOException {
        Files.deleteIfExists(file);
        Files.deleteIfExists(tempFile);
    }
}
