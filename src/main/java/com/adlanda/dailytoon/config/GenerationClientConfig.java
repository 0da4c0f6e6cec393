package com.adlanda.dailytoon.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wiring for the outbound generative-service clients.
 *
 * The context owns these resources: the executor is shut down when the
 * application stops, and the pipeline components only receive them by injection.
 */
@Configuration
public class GenerationClientConfig {

    /**
     * Runs blocking text-model calls so callers can wait on them with a timeout.
     */
    @Bean(name = "generationExecutor", destroyMethod = "shutdownNow")
    public ExecutorService generationExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setName("text-generation-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean(name = "imageRestClient")
    public RestClient imageRestClient(RestClient.Builder builder, ImageProperties imageProperties) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(imageProperties.getConnectTimeout());
        factory.setReadTimeout(imageProperties.getReadTimeout());

        return builder
                .baseUrl(imageProperties.getBaseUrl())
                .requestFactory(factory)
                .build();
    }
}
