package com.newsdigest.aggregator.controller;

import com.newsdigest.aggregator.domain.enums.BiasSpectrum;
import com.newsdigest.aggregator.domain.enums.NewsCategory;
import com.newsdigest.aggregator.domain.model.CustomNewsSource;
import com.newsdigest.aggregator.domain.model.NewsSource;
import com.newsdigest.aggregator.registry.SourceRegistry;
import com.newsdigest.aggregator.service.CustomSourceService;
import com.newsdigest.aggregator.service.CustomSourceService.FeedValidationResult;
import com.newsdigest.aggregator.service.CustomSourceService.SourceDraft;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/admin/sources")
@RequiredArgsConstructor
public class SourceAdminController {

    private final SourceRegistry sourceRegistry;
    private final CustomSourceService customSourceService;

    @GetMapping
    public ResponseEntity<List<NewsSource>> listSources() {
        return ResponseEntity.ok(sourceRegistry.allSources());
    }

    @GetMapping("/custom")
    public ResponseEntity<List<CustomSourceResponse>> listCustomSources() {
        return ResponseEntity.ok(customSourceService.list().stream()
                .map(CustomSourceResponse::from)
                .toList());
    }

    @PostMapping("/custom")
    public ResponseEntity<CustomSourceResponse> createSource(@RequestBody @Valid SourceCreateRequest request) {
        CustomNewsSource saved = customSourceService.add(SourceDraft.builder()
                .name(request.name())
                .feedUrl(request.feedUrl())
                .category(request.category())
                .bias(request.bias())
                .credibility(request.credibility())
                .factuality(request.factuality())
                .build());
        return ResponseEntity.status(HttpStatus.CREATED).body(CustomSourceResponse.from(saved));
    }

    @PatchMapping("/custom/{id}")
    public ResponseEntity<CustomSourceResponse> updateSource(
            @PathVariable("id") UUID id,
            @RequestBody @Valid SourceUpdateRequest request
    ) {
        CustomNewsSource updated = customSourceService.update(id, SourceDraft.builder()
                .name(request.name())
                .feedUrl(request.feedUrl())
                .category(request.category())
                .bias(request.bias())
                .credibility(request.credibility())
                .factuality(request.factuality())
                .build());
        return ResponseEntity.ok(CustomSourceResponse.from(updated));
    }

    @DeleteMapping("/custom/{id}")
    public ResponseEntity<Void> deleteSource(@PathVariable("id") UUID id) {
        customSourceService.remove(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/custom/{id}/toggle")
    public ResponseEntity<CustomSourceResponse> toggleSource(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(CustomSourceResponse.from(customSourceService.toggle(id)));
    }

    @PostMapping("/validate")
    public ResponseEntity<FeedValidationResult> validateFeed(@RequestParam("url") String url) {
        return ResponseEntity.ok(customSourceService.validateFeed(url));
    }

    public record SourceCreateRequest(
            @NotBlank String name,
            @NotBlank String feedUrl,
            @NotNull NewsCategory category,
            BiasSpectrum bias,
            @Min(0) @Max(100) Integer credibility,
            @DecimalMin("0.0") @DecimalMax("1.0") Double factuality
    ) {}

    public record SourceUpdateRequest(
            String name,
            String feedUrl,
            NewsCategory category,
            BiasSpectrum bias,
            @Min(0) @Max(100) Integer credibility,
            @DecimalMin("0.0") @DecimalMax("1.0") Double factuality
    ) {}

    public record CustomSourceResponse(
            String id,
            String name,
            String feedUrl,
            NewsCategory category,
            BiasSpectrum bias,
            int credibility,
            double factuality,
            boolean enabled,
            Instant addedAt,
            Instant lastFetchedAt,
            int articleCount
    ) {
        public static CustomSourceResponse from(CustomNewsSource s) {
            return new CustomSourceResponse(
                    s.sourceId(),
                    s.getName(),
                    s.getFeedUrl(),
                    s.getCategory(),
                    s.getBias(),
                    s.getCredibility(),
                    s.getFactuality(),
                    s.isEnabled(),
                    s.getAddedAt(),
                    s.getLastFetchedAt(),
                    s.getArticleCount()
            );
        }
    }
}
