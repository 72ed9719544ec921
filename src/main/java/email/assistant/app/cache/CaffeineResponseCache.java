package email.assistant.app.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;

/**
 * Process-local response cache. Expired entries are swept lazily once the cache grows
 * past a soft cap; until then they are only hidden from reads.
 */
@Slf4j
public class CaffeineResponseCache implements ResponseCache {
    private final Cache<String, String> cache;
    private final int softCap;

    public CaffeineResponseCache(Duration ttl, int softCap, Ticker ticker) {
        this.softCap = softCap;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(String key, String response) {
        if (response == null) {
            return;
        }
        if (cache.estimatedSize() > softCap) {
            cache.cleanUp();
            log.debug("Response cache swept, {} entries remain", cache.estimatedSize());
        }
        cache.put(key, response);
    }

    @Override
    public long size() {
        return cache.estimatedSize();
    }
}
