package com.terminaldesigner.designer;

import com.terminaldesigner.designer.file.FileRequestChannel;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.io.IOException;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FileRequestChannelTest {

    private final FileRequestChannel channel = new FileRequestChannel(Runnable::run);

    @Test
    void pollIsEmptyWithoutRequest() {
        assertTrue(channel.poll().isEmpty());
    }

    @Test
    void deliversContentOnce() {
        channel.submit(FileRequestChannel.Reason.LOAD_PROJECT, () -> new byte[]{1, 2, 3}).join();

        Optional<FileRequestChannel.FileResult> result = channel.poll();
        assertTrue(result.isPresent());
        assertEquals(FileRequestChannel.Reason.LOAD_PROJECT, result.get().reason());
        assertArrayEquals(new byte[]{1, 2, 3}, result.get().content());
        assertFalse(result.get().failed());
        assertTrue(channel.poll().isEmpty());
    }

    @Test
    void cancelledPickDeliversNothing() {
        channel.submit(FileRequestChannel.Reason.LOAD_POOL, () -> null).join();
        assertTrue(channel.poll().isEmpty());
    }

    @Test
    void failureIsDeliveredUnwrapped() {
        channel.submit(FileRequestChannel.Reason.LOAD_POOL, () -> {
            throw new UncheckedIOException(new IOException("disk gone"));
        }).join();

        FileRequestChannel.FileResult result = channel.poll().orElseThrow();
        assertTrue(result.failed());
        assertInstanceOf(UncheckedIOException.class, result.error());
        assertNull(result.content());
    }

    @Test
    void newerResultReplacesUnpolledOne() {
        channel.submit(FileRequestChannel.Reason.LOAD_POOL, () -> new byte[]{1}).join();
        channel.submit(FileRequestChannel.Reason.LOAD_PROJECT, () -> new byte[]{2}).join();

        FileRequestChannel.FileResult result = channel.poll().orElseThrow();
        assertEquals(FileRequestChannel.Reason.LOAD_PROJECT, result.reason());
        assertTrue(channel.poll().isEmpty());
    }
}
