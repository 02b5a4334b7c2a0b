package com.newsdigest.aggregator.domain.model;

import com.newsdigest.aggregator.domain.enums.BiasSpectrum;

import java.util.Collection;
import java.util.DoubleSummaryStatistics;
import java.util.Optional;

/**
 * Min, max and mean bias projection over the members of a story group.
 */
public record BiasRange(double min, double max, double mean) {

    public static Optional<BiasRange> of(Collection<BiasSpectrum> assigned) {
        if (assigned == null || assigned.isEmpty()) {
            return Optional.empty();
        }
        DoubleSummaryStatistics stats = assigned.stream()
                .mapToDouble(BiasSpectrum::value)
                .summaryStatistics();
        return Optional.of(new BiasRange(stats.getMin(), stats.getMax(), stats.getAverage()));
    }

    public BiasSpectrum meanSpectrum() {
        return BiasSpectrum.fromValue(mean);
    }
}
