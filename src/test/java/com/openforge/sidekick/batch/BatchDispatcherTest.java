package com.openforge.sidekick.batch;

import com.openforge.sidekick.error.ErrorKind;
import com.openforge.sidekick.error.SidekickException;
import com.openforge.sidekick.llm.CompletionGateway;
import com.openforge.sidekick.llm.CompletionRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static com.openforge.sidekick.support.Futures.await;
import static com.openforge.sidekick.support.Futures.failureOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BatchDispatcherTest {

    private final CompletionGateway gateway  = mock(CompletionGateway.class);
    private final List<String>      timeline = new CopyOnWriteArrayList<>();
    private final List<String>      prompts  = new CopyOnWriteArrayList<>();

    /** Records a "pause" every time a paced continuation is handed to the pool. */
    private final ExecutorService executor = new ThreadPoolExecutor(
            1, 1, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>()) {
        @Override
        protected void beforeExecute(Thread t, Runnable r) {
            timeline.add("pause");
        }
    };

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private BatchDispatcher dispatcher(long pacingMillis) {
        return new BatchDispatcher(gateway, new BatchProperties(5, pacingMillis), executor);
    }

    private void answerWithChunkNumber() {
        when(gateway.complete(any(), any())).thenAnswer(inv -> {
            CompletionRequest request = inv.getArgument(1);
            prompts.add(request.prompt());
            timeline.add("call:" + prompts.size());
            return CompletableFuture.completedFuture("out" + prompts.size());
        });
    }

    private static List<String> items(int n) {
        return IntStream.rangeClosed(1, n).mapToObj(i -> "item" + i).collect(Collectors.toList());
    }

    @Test
    void sevenItemsInChunksOfThree() throws Exception {
        answerWithChunkNumber();

        BatchResult result = await(dispatcher(0).process("A", items(7), "upper", 3));

        assertEquals(List.of("call:1", "pause", "call:2", "pause", "call:3"), timeline);
        assertEquals(7, result.totalItems());
        assertEquals(7, result.processedItems());
        assertFalse(result.rateLimited());
        assertEquals(List.of("**Batch 1/3:**\nout1", "**Batch 2/3:**\nout2", "**Batch 3/3:**\nout3"),
                result.results());
        assertEquals("Process these 1 items with operation: upper\n\n1. item7\n", prompts.get(2));
    }

    @Test
    void chunkRequestsUseTheBatchSystemPrompt() throws Exception {
        answerWithChunkNumber();

        await(dispatcher(0).process("A", items(2), "upper", 5));

        ArgumentCaptor<CompletionRequest> sent = ArgumentCaptor.forClass(CompletionRequest.class);
        verify(gateway).complete(any(), sent.capture());
        assertEquals(BatchDispatcher.SYSTEM_PROMPT, sent.getValue().systemPrompt());
        assertEquals(0.3, sent.getValue().temperature(), 1e-9);
        assertEquals(1024, sent.getValue().maxTokens());
    }

    @Test
    void rateLimitStopsTheRunWithPartialResults() throws Exception {
        when(gateway.complete(any(), any()))
                .thenReturn(CompletableFuture.completedFuture("first"))
                .thenReturn(CompletableFuture.failedFuture(SidekickException.rateLimited("A")));

        BatchResult result = await(dispatcher(0).process("A", items(7), "upper", 3));

        verify(gateway, times(2)).complete(any(), any());
        assertTrue(result.rateLimited());
        assertEquals(7, result.totalItems());
        assertEquals(3, result.processedItems());
        assertEquals(List.of("**Batch 1/3:**\nfirst", "⚠️ Rate limit hit at batch 2. Processed 3 items."),
                result.results());
        assertEquals("**Batch 1/3:**\nfirst\n\n---\n\n⚠️ Rate limit hit at batch 2. Processed 3 items.",
                result.combined());
    }

    @Test
    void rateLimitOnFirstChunkProcessesNothing() throws Exception {
        when(gateway.complete(any(), any()))
                .thenReturn(CompletableFuture.failedFuture(SidekickException.rateLimited("A")));

        BatchResult result = await(dispatcher(0).process("A", items(4), "upper", 2));

        assertEquals(0, result.processedItems());
        assertEquals(List.of("⚠️ Rate limit hit at batch 1. Processed 0 items."), result.results());
    }

    @Test
    void failedChunkIsReportedAndEarlierOutputsSurvive() throws Exception {
        when(gateway.complete(any(), any()))
                .thenReturn(CompletableFuture.completedFuture("chunk1-ok"))
                .thenReturn(CompletableFuture.completedFuture("chunk2-ok"))
                .thenReturn(CompletableFuture.failedFuture(SidekickException.badStatus(500, "HTTP 500")));

        BatchResult result = await(dispatcher(0).process("A", items(7), "upper", 3));

        verify(gateway, times(3)).complete(any(), any());
        assertFalse(result.rateLimited());
        assertEquals(6, result.processedItems());
        assertEquals(List.of("**Batch 1/3:**\nchunk1-ok", "**Batch 2/3:**\nchunk2-ok",
                "**Batch 3/3:**\n❌ Error: HTTP 500"), result.results());
    }

    @Test
    void failedChunkInTheMiddleDoesNotStopTheRun() throws Exception {
        when(gateway.complete(any(), any()))
                .thenReturn(CompletableFuture.completedFuture("first"))
                .thenReturn(CompletableFuture.failedFuture(
                        new SidekickException(ErrorKind.BACKEND_UNREACHABLE, "connection refused")))
                .thenReturn(CompletableFuture.completedFuture("third"));

        BatchResult result = await(dispatcher(0).process("A", items(7), "upper", 3));

        assertEquals(4, result.processedItems());
        assertEquals("**Batch 2/3:**\n❌ Error: connection refused", result.results().get(1));
        assertEquals("**Batch 3/3:**\nthird", result.results().get(2));
    }

    @Test
    void nullItemsAreNumberedLikeAnyOther() throws Exception {
        answerWithChunkNumber();

        BatchResult result = await(dispatcher(0).process("A", Arrays.asList("a", null), "upper", 5));

        assertEquals(2, result.processedItems());
        assertEquals("Process these 2 items with operation: upper\n\n1. a\n2. null\n", prompts.get(0));
    }

    @Test
    void emptyInputIsRejectedWithoutBackendCalls() {
        assertEquals(ErrorKind.EMPTY_INPUT, failureOf(dispatcher(0).process("A", List.of(), "upper", 3)).kind());
        assertEquals(ErrorKind.EMPTY_INPUT, failureOf(dispatcher(0).process("A", null, "upper", 3)).kind());
        assertEquals(ErrorKind.INVALID_ARGUMENT, failureOf(dispatcher(0).process("A", items(3), "upper", 0)).kind());
        verify(gateway, never()).complete(any(), any());
    }

    @Test
    void pacingDoesNotBlockTheCaller() throws Exception {
        answerWithChunkNumber();

        long started = System.nanoTime();
        CompletableFuture<BatchResult> pending = dispatcher(200).process("A", items(2), "upper", 1);
        assertFalse(pending.isDone());

        BatchResult result = await(pending);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        assertEquals(2, result.processedItems());
        assertTrue(elapsedMillis >= 200, "elapsed " + elapsedMillis);
    }

    @Test
    void partitionKeepsOrderAndOnlyTheLastChunkIsShort() {
        for (int n = 1; n <= 30; n++) {
            for (int k = 1; k <= 7; k++) {
                List<String> items = items(n);
                List<List<String>> chunks = BatchDispatcher.partition(items, k);

                assertEquals((n + k - 1) / k, chunks.size());
                List<String> flattened = new ArrayList<>();
                for (int i = 0; i < chunks.size(); i++) {
                    if (i < chunks.size() - 1) assertEquals(k, chunks.get(i).size());
                    else assertTrue(chunks.get(i).size() >= 1 && chunks.get(i).size() <= k);
                    flattened.addAll(chunks.get(i));
                }
                assertEquals(items, flattened);
            }
        }
    }

    @Test
    void chunkPromptNumbersItems() {
        assertEquals("Process these 2 items with operation: upper\n\n1. a\n2. b\n",
                BatchDispatcher.chunkPrompt(List.of("a", "b"), "upper"));
    }
}
