package com.adlanda.dailytoon;

import com.adlanda.dailytoon.config.StoryboardProperties;
import com.adlanda.dailytoon.exception.StoreException;
import com.adlanda.dailytoon.repository.EpisodeStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Component
public class StartupInfoLogger implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupInfoLogger.class);

    private final EpisodeStore episodeStore;
    private final StoryboardProperties storyboardProperties;

    @Value("${server.port:8080}")
    private int port;

    @Value("${info.app.version:0.0.1-SNAPSHOT}")
    private String version;

    public StartupInfoLogger(EpisodeStore episodeStore, StoryboardProperties storyboardProperties) {
        this.episodeStore = episodeStore;
        this.storyboardProperties = storyboardProperties;
    }

    @Override
    public void run(ApplicationArguments args) {
        String episodes;
        try {
            episodes = String.valueOf(episodeStore.countEpisodes());
        } catch (StoreException e) {
            log.warn("Could not count stored episodes: {}", e.getMessage());
            episodes = "unknown";
        }

        log.info("""

            DailyToon v{}
            Episodes stored: {}
            Storyboard failure policy: {}

            API Endpoints:
              GET    http://localhost:{}/api
              POST   http://localhost:{}/api/story/submit
              POST   http://localhost:{}/api/panels/generate
              GET    http://localhost:{}/api/episodes
              GET    http://localhost:{}/api/episodes/{id}
              DELETE http://localhost:{}/api/episodes/{id}

            Health:
              GET  http://localhost:{}/actuator/health
            """,
            version, episodes, storyboardProperties.getFailurePolicy(), port, port, port, port, port, port, port
        );
    }
}
