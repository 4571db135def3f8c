package org.stianloader.refresolve.internal;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.refresolve.CancellationToken;
import org.stianloader.refresolve.logging.LoggingAdapter;

/**
 * A binary semaphore that excludes other threads of this JVM as well as other processes.
 *
 * <p>Within the JVM, holders are queued in FIFO order without blocking any thread. Once a caller
 * is at the head of the queue, an exclusive {@link FileLock} is taken on the lock file, polling
 * every {@value #POLL_INTERVAL} milliseconds while another process holds it. There is no upper
 * bound on the waiting time; the wait only ends early through the {@link CancellationToken}.
 *
 * <p>{@link FileLock FileLocks} are held on behalf of the whole JVM, so only one instance per lock
 * file may exist. Instances are therefore obtained through {@link #forPath(Path)}.
 */
public final class FileSystemSemaphore {

    /**
     * The handle of an acquired {@link FileSystemSemaphore}. Closing it releases the file lock and
     * passes ownership to the next queued caller. Closing is idempotent.
     */
    public final class Releaser implements AutoCloseable {
        @NotNull
        private final FileChannel channel;
        @NotNull
        private final FileLock lock;
        @NotNull
        private final AtomicBoolean released = new AtomicBoolean();

        private Releaser(@NotNull FileChannel channel, @NotNull FileLock lock) {
            this.channel = channel;
            this.lock = lock;
        }

        @Override
        public void close() {
            if (!this.released.compareAndSet(false, true)) {
                return;
            }
            try {
                this.lock.release();
            } catch (IOException e) {
                LoggingAdapter.getDefaultLogger().warn(FileSystemSemaphore.class, "Unable to release lock on {}", FileSystemSemaphore.this.lockFile, e);
            } finally {
                FileSystemSemaphore.closeQuietly(this.channel);
                FileSystemSemaphore.this.handOff();
            }
        }

        @Contract(pure = true)
        public boolean isReleased() {
            return this.released.get();
        }
    }

    @NotNull
    private static final ConcurrentMap<Path, FileSystemSemaphore> INSTANCES = new ConcurrentHashMap<>();

    private static final long POLL_INTERVAL = 10L;

    private static void closeQuietly(@NotNull FileChannel channel) {
        try {
            channel.close();
        } catch (IOException e) {
            LoggingAdapter.getDefaultLogger().debug(FileSystemSemaphore.class, "Unable to close lock channel", e);
        }
    }

    /**
     * Obtains the semaphore guarding the given lock file. The same instance is returned for
     * all paths that point to the same file after normalization.
     *
     * @param lockFile The lock file, which will be created if needed
     * @return The semaphore for the lock file
     */
    @NotNull
    public static FileSystemSemaphore forPath(@NotNull Path lockFile) {
        Path normalized = Objects.requireNonNull(lockFile, "lockFile may not be null").toAbsolutePath().normalize();
        return FileSystemSemaphore.INSTANCES.computeIfAbsent(normalized, FileSystemSemaphore::new);
    }

    private boolean held;
    @NotNull
    private final Path lockFile;
    @NotNull
    private final Deque<CompletableFuture<Void>> waiters = new ArrayDeque<>();

    private FileSystemSemaphore(@NotNull Path lockFile) {
        this.lockFile = lockFile;
    }

    /**
     * Acquires the semaphore asynchronously. The returned future completes once this JVM and the
     * lock file are both owned by the caller. If the token is cancelled while waiting, the future
     * completes with a {@link CancellationException} and nothing remains held.
     *
     * @param executor The executor on which the file lock is polled
     * @param token The cancellation signal
     * @return A future completing with the {@link Releaser} to close once done
     */
    @NotNull
    public CompletableFuture<Releaser> acquire(@NotNull Executor executor, @NotNull CancellationToken token) {
        if (token.isCancellationRequested()) {
            return CompletableFuture.failedFuture(new CancellationException("The operation was cancelled"));
        }

        CompletableFuture<Void> turn;
        synchronized (this) {
            if (!this.held) {
                this.held = true;
                turn = CompletableFuture.completedFuture(null);
            } else {
                CompletableFuture<Void> queued = new CompletableFuture<>();
                this.waiters.addLast(queued);
                Runnable unregister = token.onCancel(() -> {
                    boolean removed;
                    synchronized (this) {
                        removed = this.waiters.remove(queued);
                    }
                    if (removed) {
                        queued.completeExceptionally(new CancellationException("The operation was cancelled"));
                    }
                });
                queued.whenComplete((ignored, ex) -> unregister.run());
                turn = queued;
            }
        }

        return turn.thenCompose((ignored) -> {
            return this.lockFile(executor, token).whenComplete((releaser, ex) -> {
                if (ex != null) {
                    // We own the in-process turn but never got the file lock
                    this.handOff();
                }
            });
        });
    }

    @NotNull
    @Contract(pure = true)
    public Path getLockFile() {
        return this.lockFile;
    }

    private void handOff() {
        CompletableFuture<Void> next;
        synchronized (this) {
            next = this.waiters.pollFirst();
            if (next == null) {
                this.held = false;
                return;
            }
        }
        next.complete(null);
    }

    @Contract(pure = true)
    public synchronized boolean isHeld() {
        return this.held;
    }

    @NotNull
    private CompletableFuture<Releaser> lockFile(@NotNull Executor executor, @NotNull CancellationToken token) {
        CompletableFuture<Releaser> future = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                Releaser releaser = null;
                try {
                    releaser = this.pollLock(token);
                    if (!future.complete(releaser)) {
                        releaser.close();
                    }
                } catch (Throwable t) {
                    if (releaser != null) {
                        releaser.close();
                    }
                    future.completeExceptionally(t);
                }
            });
        } catch (RuntimeException e) {
            future.completeExceptionally(e);
        }
        return future;
    }

    @NotNull
    private Releaser pollLock(@NotNull CancellationToken token) throws IOException {
        Path parent = this.lockFile.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        FileChannel channel = FileChannel.open(this.lockFile, StandardOpenOption.WRITE, StandardOpenOption.CREATE);
        try {
            boolean reported = false;
            while (true) {
                token.throwIfCancellationRequested();
                FileLock lock = this.tryLock(channel);
                if (lock != null) {
                    return new Releaser(channel, lock);
                }
                if (!reported) {
                    LoggingAdapter.getDefaultLogger().info(FileSystemSemaphore.class, "Waiting for another process to release {}", this.lockFile);
                    reported = true;
                }
                try {
                    Thread.sleep(FileSystemSemaphore.POLL_INTERVAL);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    CancellationException cancel = new CancellationException("Interrupted while waiting for " + this.lockFile);
                    cancel.initCause(e);
                    throw cancel;
                }
            }
        } catch (RuntimeException e) {
            FileSystemSemaphore.closeQuietly(channel);
            throw e;
        }
    }

    @Nullable
    private FileLock tryLock(@NotNull FileChannel channel) {
        try {
            return channel.tryLock();
        } catch (OverlappingFileLockException e) {
            // Held by this JVM through a channel we do not own
            return null;
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to lock " + this.lockFile, e);
        }
    }
}
