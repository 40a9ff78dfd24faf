package com.github.stormino.mediabot.config;

import com.github.stormino.mediabot.service.backend.HttpSourceBackend;
import com.github.stormino.mediabot.service.backend.SourceRegistry;
import com.github.stormino.mediabot.service.backend.YtDlpSourceBackend;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class BackendConfig {

    /**
     * Direct-file backend first, the yt-dlp catch-all last.
     */
    @Bean
    public SourceRegistry sourceRegistry(HttpSourceBackend httpBackend, YtDlpSourceBackend ytDlpBackend) {
        SourceRegistry registry = new SourceRegistry();
        registry.register(httpBackend);
        registry.register(ytDlpBackend);
        return registry;
    }
}
