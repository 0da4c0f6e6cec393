package com.adlanda.dailytoon.service;

import com.adlanda.dailytoon.client.ImageGenerationClient;
import com.adlanda.dailytoon.client.ImageGenerationException;
import com.adlanda.dailytoon.client.ImageRequest;
import com.adlanda.dailytoon.config.ImageProperties;
import com.adlanda.dailytoon.exception.SynthesisException;
import com.adlanda.dailytoon.health.SynthesisHealthIndicator;
import com.adlanda.dailytoon.support.BackoffRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CancellationException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Renders one panel image from its descriptive fields.
 *
 * Transient upstream failures (5xx, network errors, unusable payloads) are
 * retried with exponential backoff, each attempt with a fresh seed. A 4xx
 * response fails immediately.
 */
@Service
public class PanelImageSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(PanelImageSynthesizer.class);

    static final int SEED_BOUND = 100_000;

    private final ImageGenerationClient imageClient;
    private final ImageProperties properties;
    private final SynthesisHealthIndicator healthIndicator;
    private final BackoffRetry retry;

    public PanelImageSynthesizer(ImageGenerationClient imageClient,
                                 ImageProperties properties,
                                 SynthesisHealthIndicator healthIndicator) {
        this.imageClient = imageClient;
        this.properties = properties;
        this.healthIndicator = healthIndicator;
        this.retry = new BackoffRetry("panel-image", properties.getMaxRetries(), properties.getBaseDelay(),
                PanelImageSynthesizer::isTransient);
    }

    /**
     * Generates an image for a panel.
     *
     * @return Non-empty image bytes
     * @throws SynthesisException if the upstream rejected the prompt, retries
     *                            were exhausted, or the thread was interrupted
     */
    public byte[] synthesize(String sceneDescription, String dialogue, String characterProfile, String background) {
        String prompt = buildPrompt(sceneDescription, dialogue, characterProfile, background);
        AtomicInteger attempts = new AtomicInteger();
        AtomicInteger lastStatus = new AtomicInteger(ImageGenerationException.NETWORK_ERROR);

        try {
            byte[] image = retry.call(() -> {
                int attempt = attempts.incrementAndGet();
                int seed = ThreadLocalRandom.current().nextInt(SEED_BOUND);
                log.debug("Image attempt {}/{} with seed {}", attempt, retry.getMaxAttempts(), seed);
                try {
                    return imageClient.generate(new ImageRequest(prompt, properties.getWidth(), properties.getHeight(), seed));
                } catch (ImageGenerationException e) {
                    lastStatus.set(e.getStatus());
                    throw e;
                }
            });
            healthIndicator.markHealthy(attempts.get());
            log.info("Generated panel image ({} bytes) in {} attempt(s)", image.length, attempts.get());
            return image;
        } catch (CancellationException e) {
            Thread.currentThread().interrupt();
            log.warn("Image generation cancelled after {} attempt(s)", attempts.get());
            throw SynthesisException.cancelled(lastStatus.get(), e);
        } catch (ImageGenerationException e) {
            if (!e.isTransient()) {
                log.error("Image service rejected the prompt with status {}", e.getStatus());
                throw SynthesisException.permanent(e.getStatus(), e);
            }
            log.error("Image generation failed after {} attempts, last status {}", attempts.get(), e.getStatus());
            healthIndicator.markUnhealthy(e.getStatus(), e.getMessage());
            throw SynthesisException.exhausted(attempts.get(), e.getStatus(), e);
        }
    }

    String buildPrompt(String sceneDescription, String dialogue, String characterProfile, String background) {
        return "%s, %s, character %s, setting %s, mood %s, high quality, detailed line art".formatted(
                properties.getStylePreamble(), sceneDescription, characterProfile, background, dialogue);
    }

    private static boolean isTransient(Throwable failure) {
        return failure instanceof ImageGenerationException e && e.isTransient();
    }
}
