package com.llmcouncil.council.service;

import com.llmcouncil.config.CouncilConfig;
import com.llmcouncil.council.TurnCancelledException;
import com.llmcouncil.council.api.ModelInvocationService;
import com.llmcouncil.council.model.ModelReply;
import com.llmcouncil.council.model.TurnPrompt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Issues one bounded invocation per model on the worker pool and hands the settled replies to
 * the calling thread one at a time. The caller's thread is the only writer of the result map,
 * so arrival callbacks run sequentially and all of them happen before {@link #collect} returns.
 */
@Component
@Slf4j
public class FanOutCollector {

    private static final long POLL_INTERVAL_MS = 200;

    private final ModelInvocationService invocationService;
    private final ExecutorService workerExecutor;
    private final CouncilMetricsService metricsService;

    public FanOutCollector(ModelInvocationService invocationService,
                           @Qualifier("workerExecutor") ExecutorService workerExecutor,
                           CouncilMetricsService metricsService) {
        this.invocationService = invocationService;
        this.workerExecutor = workerExecutor;
        this.metricsService = metricsService;
    }

    /**
     * Invokes every model concurrently and waits until all have settled.
     *
     * @param purpose   request purpose, for logging
     * @param models    models to dispatch to, without duplicates
     * @param promptFor prompt to send to each model
     * @param config    the turn's configuration snapshot
     * @param timeout   per-call bound; a call exceeding it settles as a failure
     * @param onArrival invoked on the calling thread once per model, in settle order
     * @param cancelled polled while waiting; when it turns true outstanding calls are cancelled
     * @return replies keyed by model, in settle order
     * @throws TurnCancelledException when {@code cancelled} reports true or the thread is interrupted
     */
    public Map<String, ModelReply> collect(String purpose,
                                           List<String> models,
                                           Function<String, TurnPrompt> promptFor,
                                           CouncilConfig config,
                                           Duration timeout,
                                           Consumer<ModelReply> onArrival,
                                           BooleanSupplier cancelled,
                                           @Nullable String runId) {
        BlockingQueue<ModelReply> settled = new LinkedBlockingQueue<>();
        List<CompletableFuture<ModelReply>> calls = new ArrayList<>(models.size());
        for (String model : models) {
            TurnPrompt prompt = promptFor.apply(model);
            CompletableFuture<ModelReply> call = dispatch(purpose, model, prompt, config, timeout);
            call.thenAccept(settled::add);
            calls.add(call);
        }
        Map<String, ModelReply> results = new LinkedHashMap<>();
        try {
            while (results.size() < models.size()) {
                if (cancelled.getAsBoolean()) {
                    throw new TurnCancelledException(runId);
                }
                ModelReply reply = settled.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (reply == null || results.containsKey(reply.model())) {
                    continue;
                }
                results.put(reply.model(), reply);
                if (reply.failed()) {
                    metricsService.recordModelFailure(purpose, reply.model(), reply.failureReason());
                }
                onArrival.accept(reply);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            calls.forEach(call -> call.cancel(true));
            throw new TurnCancelledException(runId);
        } catch (TurnCancelledException ex) {
            calls.forEach(call -> call.cancel(true));
            throw ex;
        }
        return results;
    }

    /**
     * Starts a single bounded invocation. The timeout counts from the moment a worker picks the
     * call up, so calls queued behind other turns are not charged for the wait. When the returned
     * future settles by timeout or cancellation the worker running the call is interrupted and
     * returned to the pool.
     * <p>
     * The returned future never completes exceptionally except through cancellation.
     */
    public CompletableFuture<ModelReply> dispatch(String purpose,
                                                  String model,
                                                  TurnPrompt prompt,
                                                  CouncilConfig config,
                                                  Duration timeout) {
        metricsService.recordModelRequest(purpose, model);
        CompletableFuture<ModelReply> call = new CompletableFuture<>();
        Future<?> task = workerExecutor.submit(() -> {
            call.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
            try {
                call.complete(invocationService.invoke(model, prompt, config));
            } catch (RuntimeException ex) {
                call.completeExceptionally(ex);
            }
        });
        CompletableFuture<ModelReply> bounded = call.exceptionally(ex -> ModelReply.failure(model, describe(ex, timeout)));
        // no-op once the task has finished
        bounded.whenComplete((reply, ex) -> task.cancel(true));
        return bounded;
    }

    /**
     * Waits for a call started with {@link #dispatch}, giving up when the run is cancelled.
     */
    public ModelReply await(CompletableFuture<ModelReply> call, BooleanSupplier cancelled, @Nullable String runId) {
        try {
            while (true) {
                if (cancelled.getAsBoolean()) {
                    call.cancel(true);
                    throw new TurnCancelledException(runId);
                }
                if (call.isDone()) {
                    return call.get();
                }
                Thread.sleep(POLL_INTERVAL_MS);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            throw new TurnCancelledException(runId);
        } catch (ExecutionException | CancellationException ex) {
            throw new TurnCancelledException(runId);
        }
    }

    private String describe(Throwable ex, Duration timeout) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof TimeoutException) {
            return "timed out after " + timeout.toMillis() + "ms";
        }
        return cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }
}
