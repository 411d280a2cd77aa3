package com.talentscope.search.embed;

import com.talentscope.search.cache.CacheEntry;
import com.talentscope.search.cache.CacheKeyUtil;
import com.talentscope.search.cache.TtlCache;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import org.springframework.stereotype.Service;

/**
 * In-process cache of query vectors keyed by model, dimension count and query text. Texts that
 * are blank or longer than {@code embedding.cache.max-text-length} bypass the cache.
 */
@Service
public class EmbeddingCacheService {
    private final EmbeddingProperties.Cache settings;
    private final String keyPrefix;
    private final TtlCache<List<Double>> vectors;

    public EmbeddingCacheService(EmbeddingProperties properties) {
        this.settings = properties.getCache();
        this.keyPrefix = "embed:" + properties.getModel() + ":" + properties.getDimensions() + ":";
        this.vectors = new TtlCache<>(settings.getMaxEntries());
    }

    public List<Double> getOrLoad(String text, Function<String, List<Double>> loader) {
        Optional<String> key = keyFor(text);
        if (key.isEmpty()) {
            return loader.apply(text);
        }
        Optional<List<Double>> cached = vectors.get(key.get()).map(CacheEntry::value);
        if (cached.isPresent()) {
            return cached.get();
        }
        List<Double> loaded = loader.apply(text);
        if (loaded != null && !loaded.isEmpty()) {
            vectors.put(key.get(), List.copyOf(loaded), settings.getTtlMs());
        }
        return loaded;
    }

    int size() {
        return vectors.size();
    }

    Optional<String> keyFor(String text) {
        if (!settings.isEnabled() || text == null) {
            return Optional.empty();
        }
        String value = text.trim();
        if (value.isEmpty()) {
            return Optional.empty();
        }
        if (settings.getMaxTextLength() > 0 && value.length() > settings.getMaxTextLength()) {
            return Optional.empty();
        }
        if (settings.isNormalize()) {
            value = value.toLowerCase(Locale.ROOT);
        }
        return Optional.of(keyPrefix + CacheKeyUtil.sha256(value));
    }
}
