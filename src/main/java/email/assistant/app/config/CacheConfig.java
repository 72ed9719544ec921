package email.assistant.app.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import email.assistant.app.cache.CaffeineResponseCache;
import email.assistant.app.cache.ResponseCache;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CacheConfig {

    @Bean
    public ResponseCache responseCache(AssistantProperties properties) {
        AssistantProperties.Cache cache = properties.getCache();
        return new CaffeineResponseCache(cache.getResponseTtl(), cache.getResponseSoftCap(), Ticker.systemTicker());
    }

    /**
     * Decoded message bodies keyed by "userId:messageId"; bodies never change once fetched.
     */
    @Bean
    public Cache<String, String> messageBodyCache(AssistantProperties properties) {
        return Caffeine.newBuilder()
                .maximumSize(properties.getCache().getBodyCacheSize())
                .build();
    }

    @Bean
    public Cache<String, float[]> embeddingFrontCache(AssistantProperties properties) {
        return Caffeine.newBuilder()
                .maximumSize(properties.getCache().getEmbeddingFrontSize())
                .build();
    }
}
