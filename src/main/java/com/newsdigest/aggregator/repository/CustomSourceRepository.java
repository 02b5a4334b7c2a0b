package com.newsdigest.aggregator.repository;

import com.newsdigest.aggregator.domain.enums.NewsCategory;
import com.newsdigest.aggregator.domain.model.CustomNewsSource;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory store of user-added feeds. Contents live for the lifetime of the
 * process.
 */
@Repository
public class CustomSourceRepository {

    private final Map<UUID, CustomNewsSource> sources = new ConcurrentHashMap<>();

    public List<CustomNewsSource> findAll() {
        return sources.values().stream()
                .sorted(Comparator.comparing(CustomNewsSource::getAddedAt))
                .toList();
    }

    public Optional<CustomNewsSource> findById(UUID id) {
        return Optional.ofNullable(sources.get(id));
    }

    public CustomNewsSource save(CustomNewsSource source) {
        sources.put(source.getId(), source);
        return source;
    }

    public boolean deleteById(UUID id) {
        return sources.remove(id) != null;
    }

    public List<CustomNewsSource> findAllEnabledByCategory(NewsCategory category) {
        return findAll().stream()
                .filter(CustomNewsSource::isEnabled)
                .filter(s -> s.getCategory() == category)
                .toList();
    }

    public void recordFetch(UUID id, int articleCount, Instant fetchedAt) {
        sources.computeIfPresent(id, (k, s) -> s.toBuilder()
                .lastFetchedAt(fetchedAt)
                .articleCount(articleCount)
                .build());
    }
}
