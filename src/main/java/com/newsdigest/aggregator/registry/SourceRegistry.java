package com.newsdigest.aggregator.registry;

import com.newsdigest.aggregator.domain.enums.NewsCategory;
import com.newsdigest.aggregator.domain.model.CustomNewsSource;
import com.newsdigest.aggregator.domain.model.NewsSource;
import com.newsdigest.aggregator.repository.CustomSourceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Resolves the feeds that make up a category: the built-in catalog, the local
 * source when a location is configured, and enabled custom sources.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SourceRegistry {

    private final CustomSourceRepository customSourceRepository;
    private final Clock clock;

    @Value("${feeds.local.city:}")
    private String localCity;

    @Value("${feeds.local.state:}")
    private String localState;

    public List<NewsSource> sourcesFor(NewsCategory category) {
        Objects.requireNonNull(category, "category");

        List<NewsSource> out = new ArrayList<>(BuiltInSources.forCategory(category));
        if (category == NewsCategory.LOCAL) {
            localSource().ifPresent(out::add);
        }
        customSourceRepository.findAllEnabledByCategory(category).stream()
                .map(CustomNewsSource::toNewsSource)
                .forEach(out::add);
        return out;
    }

    /** Every known source, custom ones included whether enabled or not. */
    public List<NewsSource> allSources() {
        List<NewsSource> out = new ArrayList<>(BuiltInSources.all());
        localSource().ifPresent(out::add);
        customSourceRepository.findAll().stream()
                .map(CustomNewsSource::toNewsSource)
                .forEach(out::add);
        return out;
    }

    public boolean isDuplicateUrl(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        String needle = url.trim().toLowerCase(Locale.ROOT);
        return Stream.concat(
                        BuiltInSources.all().stream().map(NewsSource::feedUrl),
                        customSourceRepository.findAll().stream().map(CustomNewsSource::getFeedUrl))
                .filter(Objects::nonNull)
                .anyMatch(u -> u.trim().toLowerCase(Locale.ROOT).equals(needle));
    }

    /** Updates fetch bookkeeping for custom sources; built-in and local sources keep none. */
    public void recordFetch(NewsSource source, int articleCount) {
        if (!source.id().startsWith(CustomNewsSource.ID_PREFIX)) {
            return;
        }
        try {
            UUID id = UUID.fromString(source.id().substring(CustomNewsSource.ID_PREFIX.length()));
            customSourceRepository.recordFetch(id, articleCount, clock.instant());
        } catch (IllegalArgumentException e) {
            log.warn("Registry: malformed custom source id sourceId={}", source.id());
        }
    }

    Optional<NewsSource> localSource() {
        if (localCity == null || localCity.isBlank() || localState == null || localState.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(BuiltInSources.localNewsSource(localCity.trim(), localState.trim()));
    }
}
