package ph.extremelogic.common.tracer.handler;

import ph.extremelogic.common.tracer.LogEvent;
import ph.extremelogic.common.tracer.ResourceException;
import ph.extremelogic.common.tracer.layout.Layout;
import ph.extremelogic.common.tracer.layout.TracerLayout;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Keeps one file open for its whole lifetime and appends every plain event message to it.
 * Optionally holds an exclusive OS lock on the file until disposed.
 */
public final class SingleFileHandler implements Handler {
    private final Path file;
    private final Layout<String> layout = new TracerLayout(false);
    private final AtomicBoolean disposed = new AtomicBoolean(false);

    private final FileChannel fileChannel;
    private final FileLock fileLock;

    public SingleFileHandler(Path file) {
        this(file, true, false);
    }

    /**
     * @param append keep existing content; otherwise the file is truncated when opened
     * @param lock   take an exclusive lock on the file, failing if another holder has it
     */
    public SingleFileHandler(Path file, boolean append, boolean lock) {
        this.file = file;
        FileChannel channel = null;
        try {
            Path parentDir = file.toAbsolutePath().getParent();
            if (parentDir != null && !Files.exists(parentDir)) {
                Files.createDirectories(parentDir);
            }
            channel = FileChannel.open(file,
                    StandardOpenOption.CREATE,
                    append ? StandardOpenOption.APPEND : StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE);
            this.fileLock = lock ? acquireLock(channel) : null;
            this.fileChannel = channel;
        } catch (IOException | RuntimeException e) {
            closeAfterFailure(channel, e);
            if (e instanceof ResourceException) {
                throw (ResourceException) e;
            }
            throw new ResourceException("Failed to open log file " + file, e);
        }
    }

    private FileLock acquireLock(FileChannel channel) throws IOException {
        FileLock acquired;
        try {
            acquired = channel.tryLock();
        } catch (OverlappingFileLockException e) {
            acquired = null;
        }
        if (acquired == null) {
            throw new ResourceException("Log file " + file + " is locked by another handler");
        }
        return acquired;
    }

    private static void closeAfterFailure(FileChannel channel, Exception failure) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    @Override
    public synchronized void handle(LogEvent event) {
        if (disposed.get()) {
            throw new IllegalStateException("SingleFileHandler for " + file + " is disposed");
        }
        ByteBuffer buffer = ByteBuffer.wrap((layout.toSerializable(event) + "\n").getBytes(StandardCharsets.UTF_8));
        try {
            while (buffer.hasRemaining()) {
                fileChannel.write(buffer);
            }
        } catch (IOException e) {
            throw new ResourceException("Failed to write log file " + file, e);
        }
    }

    @Override
    public synchronized void dispose() {
        if (!disposed.compareAndSet(false, true)) {
            return;
        }
        try {
            if (fileLock != null && fileLock.isValid()) {
                fileLock.release();
            }
        } catch (IOException e) {
            System.err.printf("Error releasing lock for %s: %s%n", file, e.getMessage());
        }
        try {
            if (fileChannel.isOpen()) {
                try {
                    fileChannel.force(true);
                } finally {
                    fileChannel.close();
                }
            }
        } catch (IOException e) {
            System.err.printf("Error closing file channel for %s: %s%n", file, e.getMessage());
        }
    }

    public boolean isLocked() {
        return fileLock != null && fileLock.isValid();
    }

    public boolean isDisposed() {
        return disposed.get();
    }

    public Path getFile() {
        return file;
    }

    @Override
    public String getName() {
        return "SingleFileHandler:" + file;
    }
}
