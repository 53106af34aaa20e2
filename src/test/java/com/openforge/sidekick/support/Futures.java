package com.openforge.sidekick.support;

import com.openforge.sidekick.error.SidekickException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

public final class Futures {

    private Futures() {}

    /** Waits for {@code future} to fail and returns the SidekickException behind it. */
    public static SidekickException failureOf(CompletableFuture<?> future) {
        Throwable thrown = catchThrowable(() -> future.get(10, TimeUnit.SECONDS));
        Throwable cause = SidekickException.unwrap(thrown);
        assertThat(cause).isInstanceOf(SidekickException.class);
        return (SidekickException) cause;
    }

    public static <T> T await(CompletableFuture<T> future) throws Exception {
        return future.get(10, TimeUnit.SECONDS);
    }
}
