package com.openforge.gazetranslate.memory;

import com.openforge.gazetranslate.domain.FragmentStatus;
import com.openforge.gazetranslate.domain.FragmentType;
import com.openforge.gazetranslate.retention.RetentionForecast;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API over an owner's translation memory. The owner is named by the
 * {@code X-Owner-Id} header.
 *
 * ┌──────────────────────────────────────────────────────────────────────┐
 * │  Endpoint                                    Description             │
 * ├──────────────────────────────────────────────────────────────────────┤
 * │  POST   /api/memory/check                    needs a fresh translation?│
 * │  POST   /api/memory/items                    create or touch         │
 * │  GET    /api/memory/items                    filtered, paged list    │
 * │  GET    /api/memory/items/{id}               one fragment            │
 * │  PUT    /api/memory/items/{id}/tags          replace tags            │
 * │  DELETE /api/memory/items/{id}               delete                  │
 * │  GET    /api/memory/items/{id}/forecast      retention forecast      │
 * │  GET    /api/memory/review                   review queue            │
 * │  POST   /api/memory/review/{id}              record a review         │
 * │  POST   /api/memory/exclude                  bulk exclude            │
 * │  POST   /api/memory/master                   bulk mastered           │
 * │  GET    /api/memory/stats                    overview                │
 * │  GET    /api/memory/export                   all fragments           │
 * │  POST   /api/memory/import                   create or touch many    │
 * └──────────────────────────────────────────────────────────────────────┘
 */
@RestController
@RequestMapping("/api/memory")
@RequiredArgsConstructor
public class MemoryController {

    public static final String OWNER_HEADER = "X-Owner-Id";

    private final MemoryStore memoryStore;

    // ── Check / create ───────────────────────────────────────────────────────

    @PostMapping("/check")
    public ResponseEntity<MemoryCheck> check(@RequestHeader(OWNER_HEADER) String ownerId,
                                             @Valid @RequestBody CheckRequest req) {
        LanguagePair languages = LanguagePair.of(req.sourceLang(), req.targetLang());
        return ResponseEntity.ok(memoryStore.checkMemory(ownerId, req.sourceText(), languages));
    }

    @PostMapping("/items")
    public ResponseEntity<MemoryFragment> create(@RequestHeader(OWNER_HEADER) String ownerId,
                                                 @Valid @RequestBody FragmentRequest req) {
        MemoryFragment fragment = memoryStore.createOrTouch(ownerId, req.toDraft());
        return ResponseEntity.status(HttpStatus.CREATED).body(fragment);
    }

    // ── Browse ───────────────────────────────────────────────────────────────

    /**
     * Query params: status, type, source_lang, target_lang, tag, keyword,
     * sort (CREATED_AT | LAST_ACCESSED_AT | ACCESS_COUNT | RETENTION_STRENGTH),
     * direction (ASC | DESC), page (0-based), size (max 200).
     */
    @GetMapping("/items")
    public ResponseEntity<FragmentPage> list(
            @RequestHeader(OWNER_HEADER) String ownerId,
            @RequestParam(required = false) FragmentStatus status,
            @RequestParam(required = false) FragmentType type,
            @RequestParam(name = "source_lang", required = false) String sourceLang,
            @RequestParam(name = "target_lang", required = false) String targetLang,
            @RequestParam(required = false) String tag,
            @RequestParam(required = false) String keyword,
            @RequestParam(defaultValue = "CREATED_AT") FragmentQuery.SortField sort,
            @RequestParam(defaultValue = "DESC") Sort.Direction direction,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(FragmentQuery.MAX_PAGE_SIZE) int size) {

        FragmentQuery query = new FragmentQuery(status, type, sourceLang, targetLang, tag, keyword,
                sort, direction, page, size);
        return ResponseEntity.ok(memoryStore.queryFragments(ownerId, query));
    }

    @GetMapping("/items/{id}")
    public ResponseEntity<MemoryFragment> get(@RequestHeader(OWNER_HEADER) String ownerId,
                                              @PathVariable Long id) {
        return ResponseEntity.ok(memoryStore.getFragment(ownerId, id));
    }

    @PutMapping("/items/{id}/tags")
    public ResponseEntity<MemoryFragment> updateTags(@RequestHeader(OWNER_HEADER) String ownerId,
                                                     @PathVariable Long id,
                                                     @Valid @RequestBody TagsRequest req) {
        return ResponseEntity.ok(memoryStore.updateTags(ownerId, id, req.tags()));
    }

    @DeleteMapping("/items/{id}")
    public ResponseEntity<Void> delete(@RequestHeader(OWNER_HEADER) String ownerId,
                                       @PathVariable Long id) {
        memoryStore.deleteFragment(ownerId, id);
        return ResponseEntity.noContent().build();
    }

    /** Defaults to 1, 3, 7, 14 and 30 days ahead. */
    @GetMapping("/items/{id}/forecast")
    public ResponseEntity<List<RetentionForecast>> forecast(
            @RequestHeader(OWNER_HEADER) String ownerId,
            @PathVariable Long id,
            @RequestParam(defaultValue = "1,3,7,14,30") List<Integer> days) {
        return ResponseEntity.ok(memoryStore.forecast(ownerId, id, days));
    }

    // ── Review ───────────────────────────────────────────────────────────────

    @GetMapping("/review")
    public ResponseEntity<List<MemoryFragment>> reviewQueue(
            @RequestHeader(OWNER_HEADER) String ownerId,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int limit) {
        return ResponseEntity.ok(memoryStore.itemsDueForReview(ownerId, limit));
    }

    @PostMapping("/review/{id}")
    public ResponseEntity<MemoryFragment> review(@RequestHeader(OWNER_HEADER) String ownerId,
                                                 @PathVariable Long id,
                                                 @Valid @RequestBody ReviewRequest req) {
        return ResponseEntity.ok(memoryStore.recordReinforcement(
                ownerId, id, req.wasSuccessful(), req.responseTimeMs(), req.difficulty()));
    }

    // ── Bulk status ──────────────────────────────────────────────────────────

    @PostMapping("/exclude")
    public ResponseEntity<BulkResult> exclude(@RequestHeader(OWNER_HEADER) String ownerId,
                                              @Valid @RequestBody IdsRequest req) {
        return ResponseEntity.ok(new BulkResult(memoryStore.setExcluded(ownerId, req.ids())));
    }

    @PostMapping("/master")
    public ResponseEntity<BulkResult> master(@RequestHeader(OWNER_HEADER) String ownerId,
                                             @Valid @RequestBody IdsRequest req) {
        return ResponseEntity.ok(new BulkResult(memoryStore.setMastered(ownerId, req.ids())));
    }

    // ── Stats / export / import ──────────────────────────────────────────────

    @GetMapping("/stats")
    public ResponseEntity<MemoryStats> stats(@RequestHeader(OWNER_HEADER) String ownerId) {
        return ResponseEntity.ok(memoryStore.statistics(ownerId));
    }

    @GetMapping("/export")
    public ResponseEntity<List<MemoryFragment>> export(@RequestHeader(OWNER_HEADER) String ownerId) {
        return ResponseEntity.ok(memoryStore.exportFragments(ownerId));
    }

    @PostMapping("/import")
    public ResponseEntity<BulkResult> importItems(@RequestHeader(OWNER_HEADER) String ownerId,
                                                  @Valid @RequestBody ImportRequest req) {
        List<FragmentDraft> drafts = req.items().stream().map(FragmentRequest::toDraft).toList();
        return ResponseEntity.ok(new BulkResult(memoryStore.importFragments(ownerId, drafts).size()));
    }

    // ── Inner DTOs ────────────────────────────────────────────────────────────

    public record CheckRequest(
            @NotBlank @Size(max = 10_000) String sourceText,
            @NotBlank String sourceLang,
            @NotBlank String targetLang
    ) {}

    public record FragmentRequest(
            @NotBlank @Size(max = 10_000) String sourceText,
            @NotBlank @Size(max = 10_000) String translatedText,
            @NotBlank String sourceLang,
            @NotBlank String targetLang,
            FragmentType type,
            @DecimalMin("1.0") @DecimalMax("5.0") Double difficulty,
            List<String> tags
    ) {
        FragmentDraft toDraft() {
            return new FragmentDraft(sourceText, translatedText, LanguagePair.of(sourceLang, targetLang),
                    type, difficulty, tags, CaptureContext.manual());
        }
    }

    public record TagsRequest(@NotNull @Size(max = 32) List<String> tags) {}

    public record ReviewRequest(
            @NotNull Boolean wasSuccessful,
            @PositiveOrZero Long responseTimeMs,
            @DecimalMin("1.0") @DecimalMax("5.0") Double difficulty
    ) {}

    public record IdsRequest(@NotEmpty @Size(max = 500) List<Long> ids) {}

    public record ImportRequest(@NotNull @Size(max = 1000) List<@Valid FragmentRequest> items) {}

    public record BulkResult(int affected) {}
}
