package com.terminaldesigner.designer.file;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Hands file contents read in the background over to the UI tick.
 *
 * A request runs its reader on the executor and stores the outcome in a single slot, which the
 * tick drains with {@link #poll()}. A newer result overwrites one that was never polled.
 */
public class FileRequestChannel {

    public enum Reason {
        LOAD_POOL,
        LOAD_PROJECT
    }

    /** Outcome of one request: either content or the failure that prevented reading it. */
    public record FileResult(Reason reason, byte[] content, Throwable error) {
        public boolean failed() {
            return error != null;
        }
    }

    private final AtomicReference<FileResult> slot = new AtomicReference<>();
    private final Executor executor;

    public FileRequestChannel() {
        this(ForkJoinPool.commonPool());
    }

    public FileRequestChannel(Executor executor) {
        this.executor = executor;
    }

    /**
     * Starts reading in the background. A reader returning null (the user picked no file)
     * delivers nothing.
     */
    public CompletableFuture<Void> submit(Reason reason, Supplier<byte[]> reader) {
        return CompletableFuture.supplyAsync(reader, executor)
                .handle((content, error) -> {
                    if (error != null) {
                        Throwable cause = error.getCause() != null ? error.getCause() : error;
                        slot.set(new FileResult(reason, null, cause));
                    } else if (content != null) {
                        slot.set(new FileResult(reason, content, null));
                    }
                    return null;
                });
    }

    /** Takes the pending result, if any. */
    public Optional<FileResult> poll() {
        return Optional.ofNullable(slot.getAndSet(null));
    }
}
