package com.adlanda.dailytoon.client;

import com.adlanda.dailytoon.config.StoryboardProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Text generation backed by Spring AI's ChatModel.
 *
 * The blocking model call runs on the shared generation executor and is
 * abandoned (and interrupted) once the configured timeout elapses.
 */
@Component
public class ChatModelTextClient implements TextGenerationClient {

    private static final Logger log = LoggerFactory.getLogger(ChatModelTextClient.class);

    private final ChatModel chatModel;
    private final ExecutorService executor;
    private final StoryboardProperties properties;

    public ChatModelTextClient(ChatModel chatModel,
                               @Qualifier("generationExecutor") ExecutorService executor,
                               StoryboardProperties properties) {
        this.chatModel = chatModel;
        this.executor = executor;
        this.properties = properties;
    }

    @Override
    public String generate(String instruction) {
        Duration timeout = properties.getTimeout();
        long start = System.currentTimeMillis();

        Future<String> future = executor.submit(() -> chatModel.call(instruction));
        try {
            String text = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (text == null || text.isBlank()) {
                throw new TextGenerationException("Text model returned an empty response");
            }
            log.debug("Text model answered in {}ms ({} chars)", System.currentTimeMillis() - start, text.length());
            return text;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TextGenerationException("Text model did not answer within " + timeout, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new TextGenerationException("Text model call failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TextGenerationException("Interrupted while waiting for the text model", e);
        }
    }
}
