package io.newsdigest.pipeline.api.service;

import dev.langchain4j.model.chat.ChatModel;
import io.newsdigest.pipeline.api.exception.GenerationException;
import io.newsdigest.pipeline.config.ExecutorConfig;
import io.newsdigest.pipeline.config.LlmProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Single entry point to the chat model. Calls run on the bounded LLM pool and are cut off at the given timeout.
 */
@Service
public class LlmGateway {

    private static final Logger logger = LoggerFactory.getLogger(LlmGateway.class);

    private final ChatModel chatModel;
    private final ExecutorService llmExecutor;
    private final LlmProperties properties;

    public LlmGateway(ChatModel chatModel,
                      @Qualifier(ExecutorConfig.LLM_EXECUTOR) ExecutorService llmExecutor,
                      LlmProperties properties) {
        this.chatModel = chatModel;
        this.llmExecutor = llmExecutor;
        this.properties = properties;
    }

    public String generate(String prompt) {
        return generate(prompt, properties.timeout());
    }

    /**
     * Runs the call on the LLM pool. The timeout counts from the moment a worker starts the call; time spent
     * queued behind other calls does not count. A timed out call interrupts its worker.
     *
     * @throws GenerationException on provider error, timeout or an empty answer
     */
    public String generate(String prompt, Duration timeout) {
        CompletableFuture<String> answer = new CompletableFuture<>();
        Future<?> call = llmExecutor.submit(() -> {
            answer.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
            try {
                answer.complete(chatModel.chat(prompt));
            } catch (RuntimeException e) {
                answer.completeExceptionally(e);
            }
        });

        String text;
        try {
            text = answer.get();

        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof TimeoutException) {
                call.cancel(true);
                logger.warn("LLM call timed out after {}ms", timeout.toMillis());
                throw new GenerationException("LLM call timed out after " + timeout.toMillis() + "ms", cause);
            }
            logger.warn("LLM call failed: {}", cause.getMessage());
            throw new GenerationException("LLM call failed: " + cause.getMessage(), cause);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            throw new GenerationException("Interrupted while waiting for the LLM", e);
        }

        if (text == null || text.isBlank()) {
            throw new GenerationException("LLM returned an empty answer", null);
        }
        return text.trim();
    }

    public String modelName() {
        return properties.modelName();
    }
}
