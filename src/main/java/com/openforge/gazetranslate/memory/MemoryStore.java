package com.openforge.gazetranslate.memory;

import com.openforge.gazetranslate.domain.Fragment;
import com.openforge.gazetranslate.domain.FragmentStatus;
import com.openforge.gazetranslate.domain.FragmentType;
import com.openforge.gazetranslate.domain.RetentionState;
import com.openforge.gazetranslate.error.ConcurrencyConflictException;
import com.openforge.gazetranslate.error.FragmentNotFoundException;
import com.openforge.gazetranslate.error.ValidationException;
import com.openforge.gazetranslate.repository.FragmentRepository;
import com.openforge.gazetranslate.retention.RetentionForecast;
import com.openforge.gazetranslate.retention.RetentionModel;
import com.openforge.gazetranslate.retention.RetentionRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

/**
 * Per-owner collection of remembered fragments.
 *
 * Reads go straight to the repository. Writes are serialised per owner
 * through {@link OwnerLocks} and run in their own transaction; a version or
 * duplicate-identity conflict is retried once before it surfaces as
 * {@link ConcurrencyConflictException}.
 *
 * Every method returns {@link MemoryFragment} snapshots; the entity stays here.
 */
@Slf4j
@Service
@EnableConfigurationProperties(MemoryProperties.class)
public class MemoryStore {

    private static final int MAX_TAGS = 32;
    private static final int MAX_TAG_LENGTH = 64;
    private static final int MAX_OWNER_LENGTH = 64;
    private static final int STATS_LIST_SIZE = 10;

    private final FragmentRepository repository;
    private final RetentionModel retentionModel;
    private final MemoryProperties props;
    private final TransactionTemplate tx;
    private final Clock clock;
    private final OwnerLocks locks;

    public MemoryStore(FragmentRepository repository,
                       RetentionModel retentionModel,
                       MemoryProperties props,
                       PlatformTransactionManager transactionManager,
                       Clock clock) {
        this.repository = repository;
        this.retentionModel = retentionModel;
        this.props = props;
        this.tx = new TransactionTemplate(transactionManager);
        this.clock = clock;
        this.locks = new OwnerLocks(props.lockStripes());
    }

    // ── Writes ───────────────────────────────────────────────────────────────

    public MemoryFragment createOrTouch(String ownerId,
                                        String sourceText,
                                        String translatedText,
                                        LanguagePair languages,
                                        @Nullable CaptureContext context) {
        return createOrTouch(ownerId, FragmentDraft.of(sourceText, translatedText, languages, context));
    }

    /**
     * Returns the fragment with this identity, creating a FRESH one if none
     * exists. An existing fragment only has its access counters bumped.
     */
    public MemoryFragment createOrTouch(String ownerId, FragmentDraft draft) {
        return upsert(ownerId, draft, false, "createOrTouch");
    }

    /**
     * Stores a fresh translation in one write. A new text becomes a FRESH
     * fragment; a known one is counted as a re-exposure (see
     * {@link #recordReExposure}) instead of a plain touch.
     */
    public MemoryFragment recordTranslation(String ownerId,
                                            String sourceText,
                                            String translatedText,
                                            LanguagePair languages,
                                            @Nullable CaptureContext context) {
        return upsert(ownerId, FragmentDraft.of(sourceText, translatedText, languages, context), true,
                "recordTranslation");
    }

    private MemoryFragment upsert(String ownerId, FragmentDraft draft, boolean reExposeExisting, String operation) {
        requireOwner(ownerId);
        draft.validate();
        String text = draft.sourceText().strip();
        String key = FragmentTexts.sourceKey(text);
        LanguagePair languages = draft.languages();
        List<String> tags = normaliseTags(draft.tagsOrEmpty());

        return write(ownerId, operation, () -> {
            Instant now = clock.instant();
            Optional<Fragment> existing = repository.findByOwnerIdAndSourceKeyAndSourceLangAndTargetLang(
                    ownerId, key, languages.sourceLang(), languages.targetLang());
            if (existing.isPresent()) {
                Fragment fragment = existing.get();
                if (reExposeExisting && !fragment.getStatus().isTerminal()) {
                    reExpose(fragment, now);
                    return MemoryFragment.from(repository.save(fragment));
                }
                fragment.touch(now);
                log.debug("[Memory] Touched fragment {} for owner {} (accessCount={})",
                        fragment.getId(), ownerId, fragment.getAccessCount());
                return MemoryFragment.from(repository.save(fragment));
            }

            RetentionRecord initial = retentionModel.initialRecord(draft.difficulty(), now);
            CaptureContext ctx = draft.context();
            Fragment fragment = Fragment.builder()
                    .ownerId(ownerId)
                    .sourceKey(key)
                    .sourceText(text)
                    .translatedText(draft.translatedText().strip())
                    .sourceLang(languages.sourceLang())
                    .targetLang(languages.targetLang())
                    .type(draft.type() != null ? draft.type() : FragmentType.classify(text))
                    .status(FragmentStatus.FRESH)
                    .lastAccessedAt(now)
                    .accessCount(1)
                    .retention(RetentionState.from(initial))
                    .tags(new ArrayList<>(tags))
                    .captureSessionId(ctx != null ? ctx.sessionId() : null)
                    .gazeX(ctx != null ? ctx.gazeX() : null)
                    .gazeY(ctx != null ? ctx.gazeY() : null)
                    .captureTrigger(ctx != null ? ctx.trigger() : null)
                    .deviceType(ctx != null ? ctx.deviceType() : null)
                    .build();
            // Flush so a concurrent duplicate insert fails inside this transaction.
            Fragment saved = repository.saveAndFlush(fragment);
            log.info("[Memory] Created fragment {} for owner {} ({}, {})",
                    saved.getId(), ownerId, languages, saved.getType());
            return MemoryFragment.from(saved);
        });
    }

    /**
     * Applies one review outcome. Success with strength above the promote level
     * moves the fragment to LEARNING, failure below the demote level to
     * FORGOTTEN. MASTERED and EXCLUDED fragments are returned unchanged.
     */
    public MemoryFragment recordReinforcement(String ownerId,
                                              Long fragmentId,
                                              boolean wasSuccessful,
                                              @Nullable Long responseTimeMs,
                                              @Nullable Double difficulty) {
        requireOwner(ownerId);
        return write(ownerId, "recordReinforcement", () -> {
            Fragment fragment = load(ownerId, fragmentId);
            if (fragment.getStatus().isTerminal()) {
                log.debug("[Memory] Ignoring reinforcement of {} fragment {}", fragment.getStatus(), fragmentId);
                return MemoryFragment.from(fragment);
            }
            Instant now = clock.instant();
            RetentionRecord updated = retentionModel.reinforce(
                    fragment.getRetention().toRecord(), wasSuccessful, responseTimeMs, difficulty, now);

            FragmentStatus previous = fragment.getStatus();
            FragmentStatus next = previous;
            if (wasSuccessful && updated.currentStrength() > props.promoteStrength()) {
                next = FragmentStatus.LEARNING;
            } else if (!wasSuccessful && updated.currentStrength() < props.demoteStrength()) {
                next = FragmentStatus.FORGOTTEN;
            }
            if (wasSuccessful && next == FragmentStatus.LEARNING && retentionModel.qualifiesForMastery(updated)) {
                next = FragmentStatus.MASTERED;
                updated = updated.unscheduled();
            }

            apply(fragment, updated, next, now);
            if (next != previous) {
                log.info("[Memory] Fragment {} {} -> {}", fragmentId, previous, next);
            }
            return MemoryFragment.from(repository.save(fragment));
        });
    }

    /**
     * A known fragment needed a fresh translation: the user saw it again, so
     * treat it as a successful exposure and move it back into LEARNING.
     */
    public MemoryFragment recordReExposure(String ownerId, Long fragmentId) {
        requireOwner(ownerId);
        return write(ownerId, "recordReExposure", () -> {
            Fragment fragment = load(ownerId, fragmentId);
            if (fragment.getStatus().isTerminal()) {
                return MemoryFragment.from(fragment);
            }
            reExpose(fragment, clock.instant());
            return MemoryFragment.from(repository.save(fragment));
        });
    }

    /** Marks the owner's fragments EXCLUDED. Unknown ids are skipped; returns how many changed. */
    public int setExcluded(String ownerId, Collection<Long> fragmentIds) {
        return overrideStatus(ownerId, fragmentIds, FragmentStatus.EXCLUDED);
    }

    /** Marks the owner's fragments MASTERED and clears their schedule. Returns how many changed. */
    public int setMastered(String ownerId, Collection<Long> fragmentIds) {
        return overrideStatus(ownerId, fragmentIds, FragmentStatus.MASTERED);
    }

    public void deleteFragment(String ownerId, Long fragmentId) {
        requireOwner(ownerId);
        write(ownerId, "deleteFragment", () -> {
            repository.delete(load(ownerId, fragmentId));
            log.info("[Memory] Deleted fragment {} for owner {}", fragmentId, ownerId);
            return null;
        });
    }

    public MemoryFragment updateTags(String ownerId, Long fragmentId, List<String> tags) {
        requireOwner(ownerId);
        List<String> normalised = normaliseTags(tags == null ? List.of() : tags);
        return write(ownerId, "updateTags", () -> {
            Fragment fragment = load(ownerId, fragmentId);
            fragment.getTags().clear();
            fragment.getTags().addAll(normalised);
            return MemoryFragment.from(repository.save(fragment));
        });
    }

    /** Imports through {@link #createOrTouch}; returns the stored fragments in input order. */
    public List<MemoryFragment> importFragments(String ownerId, List<FragmentDraft> drafts) {
        requireOwner(ownerId);
        List<MemoryFragment> imported = drafts.stream()
                .map(draft -> createOrTouch(ownerId, draft))
                .toList();
        log.info("[Memory] Imported {} fragments for owner {}", imported.size(), ownerId);
        return imported;
    }

    // ── Reads ────────────────────────────────────────────────────────────────

    /**
     * Decides whether {@code sourceText} needs a fresh translation. Never writes.
     */
    public MemoryCheck checkMemory(String ownerId, String sourceText, LanguagePair languages) {
        requireOwner(ownerId);
        if (sourceText == null || sourceText.isBlank()) {
            throw new ValidationException("sourceText is required");
        }
        String text = sourceText.strip();
        Instant now = clock.instant();

        Optional<Fragment> exact = repository.findByOwnerIdAndSourceKeyAndSourceLangAndTargetLang(
                        ownerId, FragmentTexts.sourceKey(text), languages.sourceLang(), languages.targetLang())
                .filter(f -> f.getSourceText().equals(text));
        if (exact.isPresent()) {
            MemoryFragment fragment = MemoryFragment.from(exact.get());
            boolean shouldTranslate = needsTranslation(fragment, now);
            log.debug("[Memory] Check hit fragment {} status={} shouldTranslate={}",
                    fragment.id(), fragment.status(), shouldTranslate);
            return MemoryCheck.found(fragment, shouldTranslate);
        }

        List<FragmentSuggestion> suggestions = suggest(ownerId, text, languages);
        log.debug("[Memory] Check miss for owner {} ({} suggestions)", ownerId, suggestions.size());
        return MemoryCheck.notFound(suggestions);
    }

    public MemoryFragment getFragment(String ownerId, Long fragmentId) {
        requireOwner(ownerId);
        return MemoryFragment.from(load(ownerId, fragmentId));
    }

    public FragmentPage queryFragments(String ownerId, FragmentQuery query) {
        requireOwner(ownerId);
        Page<Fragment> page = repository.findAll(FragmentSpecifications.matching(ownerId, query), query.pageable());
        return new FragmentPage(
                page.getContent().stream().map(MemoryFragment::from).toList(),
                page.getTotalElements(),
                page.getNumber(),
                page.getSize());
    }

    /**
     * Fragments that are forgotten or past their due time, most overdue first.
     * Ties on due time go to the lower retention.
     */
    public List<MemoryFragment> itemsDueForReview(String ownerId, int limit) {
        requireOwner(ownerId);
        if (limit < 1) {
            throw new ValidationException("limit must be positive");
        }
        Instant now = clock.instant();
        return repository.findByOwnerIdAndStatusIn(ownerId, FragmentStatus.reviewable()).stream()
                .map(MemoryFragment::from)
                .map(f -> new Scored(f, retentionModel.retentionAt(f.retention(), now)))
                .filter(s -> isDue(s, now))
                .sorted(Comparator
                        .comparing((Scored s) -> s.fragment().retention().nextDueAt(),
                                Comparator.nullsLast(Comparator.naturalOrder()))
                        .thenComparingDouble(Scored::retention))
                .limit(limit)
                .map(Scored::fragment)
                .toList();
    }

    public List<RetentionForecast> forecast(String ownerId, Long fragmentId, List<Integer> days) {
        MemoryFragment fragment = getFragment(ownerId, fragmentId);
        return retentionModel.predictRetention(fragment.retention(), days, clock.instant());
    }

    public List<MemoryFragment> exportFragments(String ownerId) {
        requireOwner(ownerId);
        return repository.findByOwnerId(ownerId).stream()
                .map(MemoryFragment::from)
                .sorted(Comparator.comparing(MemoryFragment::id))
                .toList();
    }

    public MemoryStats statistics(String ownerId) {
        requireOwner(ownerId);
        Instant now = clock.instant();
        List<Scored> all = repository.findByOwnerId(ownerId).stream()
                .map(MemoryFragment::from)
                .map(f -> new Scored(f, retentionModel.retentionAt(f.retention(), now)))
                .toList();

        Map<FragmentStatus, Long> byStatus = new EnumMap<>(FragmentStatus.class);
        for (FragmentStatus status : FragmentStatus.values()) {
            byStatus.put(status, 0L);
        }
        all.forEach(s -> byStatus.merge(s.fragment().status(), 1L, Long::sum));

        long remembered = all.stream().filter(s -> retentionModel.isRemembered(s.retention())).count();
        long due = all.stream()
                .filter(s -> FragmentStatus.reviewable().contains(s.fragment().status()))
                .filter(s -> isDue(s, now))
                .count();

        return new MemoryStats(
                ownerId,
                all.size(),
                byStatus,
                all.stream().mapToDouble(Scored::retention).average().orElse(0.0),
                remembered,
                all.size() - remembered,
                due,
                all.stream().mapToDouble(s -> s.fragment().retention().difficultyLevel()).average().orElse(0.0),
                all.stream()
                        .map(Scored::fragment)
                        .sorted(Comparator.comparingInt(MemoryFragment::accessCount).reversed())
                        .limit(STATS_LIST_SIZE)
                        .toList(),
                all.stream()
                        .map(Scored::fragment)
                        .sorted(Comparator.comparing(MemoryFragment::createdAt).reversed())
                        .limit(STATS_LIST_SIZE)
                        .toList(),
                all.stream()
                        .map(Scored::fragment)
                        .filter(f -> f.retention().nextDueAt() != null && f.retention().nextDueAt().isAfter(now))
                        .filter(f -> FragmentStatus.reviewable().contains(f.status()))
                        .sorted(Comparator.comparing(f -> f.retention().nextDueAt()))
                        .limit(STATS_LIST_SIZE)
                        .toList());
    }

    // ── Maintenance ──────────────────────────────────────────────────────────

    /**
     * Deletes FRESH and FORGOTTEN fragments older than the stale horizon whose
     * retention is below the remembered threshold. Walks the table in keyset
     * pages, each deleted in its own transaction, without owner locks. A batch
     * that hits a concurrent update is skipped; the next sweep picks it up.
     *
     * @return number of deleted fragments
     */
    public int purgeStale() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(props.staleHorizon());
        int batchSize = Math.max(1, props.purgeBatchSize());
        long afterId = 0L;
        int deleted = 0;

        while (true) {
            List<Fragment> page = repository.findByStatusInAndCreateTimeBeforeAndIdGreaterThanOrderByIdAsc(
                    FragmentStatus.purgeable(), cutoff, afterId, PageRequest.of(0, batchSize));
            if (page.isEmpty()) {
                break;
            }
            afterId = page.get(page.size() - 1).getId();

            List<Fragment> stale = page.stream()
                    .filter(f -> !retentionModel.isRemembered(
                            retentionModel.retentionAt(f.getRetention().toRecord(), now)))
                    .toList();
            if (!stale.isEmpty()) {
                try {
                    tx.executeWithoutResult(status -> repository.deleteAll(stale));
                    deleted += stale.size();
                } catch (DataAccessException e) {
                    log.warn("[Memory] Purge batch ending at id {} skipped: {}", afterId, e.getMessage());
                }
            }
            if (page.size() < batchSize) {
                break;
            }
        }
        log.info("[Memory] Purged {} stale fragments (created before {})", deleted, cutoff);
        return deleted;
    }

    // ── Internals ────────────────────────────────────────────────────────────

    private <T> T write(String ownerId, String operation, Supplier<T> work) {
        Lock lock = locks.forOwner(ownerId);
        lock.lock();
        try {
            try {
                return tx.execute(status -> work.get());
            } catch (OptimisticLockingFailureException | DataIntegrityViolationException first) {
                log.warn("[Memory] {} conflicted for owner {}, retrying once: {}",
                        operation, ownerId, first.getMessage());
                try {
                    return tx.execute(status -> work.get());
                } catch (OptimisticLockingFailureException | DataIntegrityViolationException second) {
                    throw new ConcurrencyConflictException(
                            "%s conflicted twice for owner %s".formatted(operation, ownerId), second);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    private int overrideStatus(String ownerId, Collection<Long> fragmentIds, FragmentStatus target) {
        requireOwner(ownerId);
        if (fragmentIds == null || fragmentIds.isEmpty()) {
            return 0;
        }
        Set<Long> ids = new LinkedHashSet<>(fragmentIds);
        Integer changed = write(ownerId, "set" + target, () -> {
            List<Fragment> fragments = repository.findByOwnerIdAndIdIn(ownerId, ids);
            for (Fragment fragment : fragments) {
                RetentionRecord record = fragment.getRetention().toRecord().unscheduled();
                if (target == FragmentStatus.MASTERED) {
                    record = record.withCurrentStrength(1.0);
                }
                fragment.setRetention(RetentionState.from(record));
                fragment.setStatus(target);
            }
            repository.saveAll(fragments);
            return fragments.size();
        });
        log.info("[Memory] Set {} fragments {} for owner {} ({} requested)", changed, target, ownerId, ids.size());
        return changed;
    }

    private void reExpose(Fragment fragment, Instant now) {
        RetentionRecord updated = retentionModel.reinforce(
                fragment.getRetention().toRecord(), true, null, null, now);
        FragmentStatus previous = fragment.getStatus();
        apply(fragment, updated, FragmentStatus.LEARNING, now);
        if (previous != FragmentStatus.LEARNING) {
            log.info("[Memory] Fragment {} {} -> LEARNING on re-exposure", fragment.getId(), previous);
        }
    }

    private void apply(Fragment fragment, RetentionRecord record, FragmentStatus status, Instant now) {
        fragment.setRetention(RetentionState.from(record));
        fragment.setStatus(status);
        fragment.touch(now);
    }

    private Fragment load(String ownerId, Long fragmentId) {
        if (fragmentId == null) {
            throw new ValidationException("fragmentId is required");
        }
        return repository.findByIdAndOwnerId(fragmentId, ownerId)
                .orElseThrow(() -> new FragmentNotFoundException(ownerId, fragmentId));
    }

    private boolean needsTranslation(MemoryFragment fragment, Instant now) {
        if (fragment.status().isTerminal()) {
            return false;
        }
        return !retentionModel.isRemembered(retentionModel.retentionAt(fragment.retention(), now));
    }

    private boolean isDue(Scored scored, Instant now) {
        Instant dueAt = scored.fragment().retention().nextDueAt();
        return !retentionModel.isRemembered(scored.retention()) || (dueAt != null && !dueAt.isAfter(now));
    }

    private List<FragmentSuggestion> suggest(String ownerId, String text, LanguagePair languages) {
        Set<String> tokens = FragmentTexts.tokens(text);
        if (tokens.isEmpty()) {
            return List.of();
        }
        return repository.findByOwnerIdAndSourceLangAndTargetLang(
                        ownerId, languages.sourceLang(), languages.targetLang()).stream()
                .map(f -> new FragmentSuggestion(MemoryFragment.from(f),
                        FragmentTexts.jaccard(tokens, FragmentTexts.tokens(f.getSourceText()))))
                .filter(s -> s.similarity() >= props.fuzzyThreshold())
                .sorted(Comparator.comparingDouble(FragmentSuggestion::similarity).reversed())
                .limit(props.maxSuggestions())
                .toList();
    }

    private static void requireOwner(String ownerId) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new ValidationException("ownerId is required");
        }
        if (ownerId.length() > MAX_OWNER_LENGTH) {
            throw new ValidationException("ownerId is longer than " + MAX_OWNER_LENGTH + " characters");
        }
    }

    private static List<String> normaliseTags(List<String> tags) {
        List<String> normalised = tags.stream()
                .filter(t -> t != null && !t.isBlank())
                .map(String::strip)
                .distinct()
                .toList();
        if (normalised.size() > MAX_TAGS) {
            throw new ValidationException("At most " + MAX_TAGS + " tags are allowed");
        }
        normalised.stream()
                .filter(t -> t.length() > MAX_TAG_LENGTH)
                .findFirst()
                .ifPresent(t -> {
                    throw new ValidationException("Tag longer than " + MAX_TAG_LENGTH + " characters: " + t);
                });
        return normalised;
    }

    private record Scored(MemoryFragment fragment, double retention) {}
}
