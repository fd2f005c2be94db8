package com.williamcallahan.notewiki.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.williamcallahan.notewiki.domain.render.RenderedNote;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures the rendered-note cache.
 */
@Configuration
public class CacheConfig {

    /**
     * Registers the Caffeine cache of rendered notes, sized and expired from {@code app.render.*}.
     *
     * @param appProperties bound application properties
     * @return rendered-note cache with statistics enabled
     */
    @Bean
    public Cache<String, RenderedNote> renderCache(AppProperties appProperties) {
        RenderSettings render = appProperties.getRender();
        return Caffeine.newBuilder()
            .maximumSize(render.getCacheMaxSize())
            .expireAfterWrite(render.getCacheTtl())
            .recordStats()
            .build();
    }
}
