package com.openforge.gazetranslate.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One remembered piece of foreign text in one language pair, owned by one user.
 *
 * Identity is (owner_id, source_text, source_lang, target_lang). The text
 * itself can be long, so the unique key uses {@code source_key}, the SHA-256
 * of the source text.
 *
 * This entity never leaves the memory store; callers receive
 * {@link com.openforge.gazetranslate.memory.MemoryFragment} snapshots.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "memory_fragments",
    uniqueConstraints = @UniqueConstraint(
        name = "uq_fragment_identity",
        columnNames = {"owner_id", "source_key", "source_lang", "target_lang"}),
    indexes = {
        @Index(name = "idx_fragment_owner_pair", columnList = "owner_id, source_lang, target_lang"),
        @Index(name = "idx_fragment_status_created", columnList = "status, create_time")
    }
)
public class Fragment extends BaseEntity {

    @Column(name = "owner_id", nullable = false, length = 64)
    private String ownerId;

    @Column(name = "source_key", nullable = false, length = 64)
    private String sourceKey;

    @Column(name = "source_text", nullable = false, columnDefinition = "TEXT")
    private String sourceText;

    @Column(name = "translated_text", nullable = false, columnDefinition = "TEXT")
    private String translatedText;

    @Column(name = "source_lang", nullable = false, length = 16)
    private String sourceLang;

    @Column(name = "target_lang", nullable = false, length = 16)
    private String targetLang;

    @Enumerated(EnumType.STRING)
    @Column(name = "fragment_type", nullable = false, length = 16)
    private FragmentType type;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private FragmentStatus status = FragmentStatus.FRESH;

    @Column(name = "last_accessed_at", nullable = false)
    private Instant lastAccessedAt;

    @Builder.Default
    @Column(name = "access_count", nullable = false)
    private Integer accessCount = 1;

    @Embedded
    private RetentionState retention;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "memory_fragment_tags", joinColumns = @JoinColumn(name = "fragment_id"))
    @Column(name = "tag", nullable = false, length = 64)
    private List<String> tags = new ArrayList<>();

    // ── Capture context (all nullable) ───────────────────────────────────────

    @Column(name = "capture_session_id", length = 64)
    private String captureSessionId;

    @Column(name = "gaze_x")
    private Double gazeX;

    @Column(name = "gaze_y")
    private Double gazeY;

    @Enumerated(EnumType.STRING)
    @Column(name = "capture_trigger", length = 16)
    private CaptureTrigger captureTrigger;

    @Column(name = "device_type", length = 32)
    private String deviceType;

    public void touch(Instant now) {
        this.lastAccessedAt = now;
        this.accessCount = accessCount + 1;
    }
}
