package com.openforge.gazetranslate.memory;

import com.openforge.gazetranslate.domain.CaptureTrigger;
import com.openforge.gazetranslate.domain.FragmentStatus;
import com.openforge.gazetranslate.domain.FragmentType;
import com.openforge.gazetranslate.error.FragmentNotFoundException;
import com.openforge.gazetranslate.retention.RetentionRecord;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = MemoryController.class)
class MemoryControllerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T08:00:00Z");

    @Autowired
    private MockMvc mvc;

    @MockBean
    private MemoryStore memoryStore;

    @Test
    void checkReturnsCachedTranslationInSnakeCase() throws Exception {
        when(memoryStore.checkMemory(eq("alice"), eq("Hello"), eq(LanguagePair.of("en", "zh"))))
                .thenReturn(MemoryCheck.found(fragment(7L, FragmentStatus.FRESH), false));

        mvc.perform(post("/api/memory/check")
                        .header(MemoryController.OWNER_HEADER, "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"source_text": "Hello", "source_lang": "EN", "target_lang": "zh"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.exists").value(true))
                .andExpect(jsonPath("$.should_translate").value(false))
                .andExpect(jsonPath("$.cached_translation").value("你好"))
                .andExpect(jsonPath("$.fragment.id").value(7))
                .andExpect(jsonPath("$.fragment.source_lang").value("en"))
                .andExpect(jsonPath("$.fragment.retention.reinforce_count").value(0));
    }

    @Test
    void missingOwnerHeaderIsBadRequest() throws Exception {
        mvc.perform(post("/api/memory/check")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"source_text": "Hello", "source_lang": "en", "target_lang": "zh"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        verifyNoInteractions(memoryStore);
    }

    @Test
    void autoTargetLanguageIsRejected() throws Exception {
        mvc.perform(post("/api/memory/check")
                        .header(MemoryController.OWNER_HEADER, "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"source_text": "Hello", "source_lang": "en", "target_lang": "auto"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    void createStoresManualFragment() throws Exception {
        when(memoryStore.createOrTouch(eq("alice"), any(FragmentDraft.class)))
                .thenReturn(fragment(9L, FragmentStatus.FRESH));

        mvc.perform(post("/api/memory/items")
                        .header(MemoryController.OWNER_HEADER, "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"source_text": "Hello", "translated_text": "你好",
                                 "source_lang": "en", "target_lang": "ZH", "tags": ["greeting"], "difficulty": 2}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(9));

        ArgumentCaptor<FragmentDraft> draft = ArgumentCaptor.forClass(FragmentDraft.class);
        verify(memoryStore).createOrTouch(eq("alice"), draft.capture());
        assertThat(draft.getValue().languages()).isEqualTo(LanguagePair.of("en", "zh"));
        assertThat(draft.getValue().tags()).containsExactly("greeting");
        assertThat(draft.getValue().difficulty()).isEqualTo(2.0);
        assertThat(draft.getValue().context().trigger()).isEqualTo(CaptureTrigger.MANUAL);
    }

    @Test
    void blankTranslationIsRejected() throws Exception {
        mvc.perform(post("/api/memory/items")
                        .header(MemoryController.OWNER_HEADER, "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"source_text": "Hello", "translated_text": " ", "source_lang": "en", "target_lang": "zh"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("translatedText is invalid"));
    }

    @Test
    void unknownFragmentIsNotFound() throws Exception {
        when(memoryStore.getFragment("alice", 42L)).thenThrow(new FragmentNotFoundException("alice", 42L));

        mvc.perform(get("/api/memory/items/42").header(MemoryController.OWNER_HEADER, "alice"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    void oversizedPageIsBadRequest() throws Exception {
        mvc.perform(get("/api/memory/items")
                        .header(MemoryController.OWNER_HEADER, "alice")
                        .param("size", "500"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(memoryStore);
    }

    @Test
    void listPassesFiltersThrough() throws Exception {
        when(memoryStore.queryFragments(eq("alice"), any(FragmentQuery.class)))
                .thenReturn(new FragmentPage(List.of(fragment(1L, FragmentStatus.LEARNING)), 1, 0, 20));

        mvc.perform(get("/api/memory/items")
                        .header(MemoryController.OWNER_HEADER, "alice")
                        .param("status", "LEARNING")
                        .param("tag", "travel")
                        .param("sort", "RETENTION_STRENGTH")
                        .param("direction", "ASC"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.items[0].status").value("LEARNING"));

        ArgumentCaptor<FragmentQuery> query = ArgumentCaptor.forClass(FragmentQuery.class);
        verify(memoryStore).queryFragments(eq("alice"), query.capture());
        assertThat(query.getValue().status()).isEqualTo(FragmentStatus.LEARNING);
        assertThat(query.getValue().tag()).isEqualTo("travel");
        assertThat(query.getValue().sortBy()).isEqualTo(FragmentQuery.SortField.RETENTION_STRENGTH);
    }

    @Test
    void reviewRequiresOutcome() throws Exception {
        mvc.perform(post("/api/memory/review/1")
                        .header(MemoryController.OWNER_HEADER, "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"response_time_ms\": 1200}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(memoryStore);
    }

    @Test
    void reviewRecordsOutcome() throws Exception {
        when(memoryStore.recordReinforcement("alice", 1L, true, 1200L, null))
                .thenReturn(fragment(1L, FragmentStatus.LEARNING));

        mvc.perform(post("/api/memory/review/1")
                        .header(MemoryController.OWNER_HEADER, "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"was_successful\": true, \"response_time_ms\": 1200}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("LEARNING"));
    }

    @Test
    void bulkExcludeReportsAffectedCount() throws Exception {
        when(memoryStore.setExcluded("alice", List.of(1L, 2L, 3L))).thenReturn(2);

        mvc.perform(post("/api/memory/exclude")
                        .header(MemoryController.OWNER_HEADER, "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ids\": [1, 2, 3]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.affected").value(2));
    }

    @Test
    void reviewQueueHonoursLimit() throws Exception {
        when(memoryStore.itemsDueForReview(anyString(), anyInt())).thenReturn(List.of());

        mvc.perform(get("/api/memory/review").header(MemoryController.OWNER_HEADER, "alice").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray());

        verify(memoryStore).itemsDueForReview("alice", 5);
    }

    @Test
    void deleteReturnsNoContent() throws Exception {
        mvc.perform(delete("/api/memory/items/3").header(MemoryController.OWNER_HEADER, "alice"))
                .andExpect(status().isNoContent());

        verify(memoryStore).deleteFragment("alice", 3L);
    }

    private static MemoryFragment fragment(Long id, FragmentStatus status) {
        return new MemoryFragment(id, "alice", "Hello", "你好", "en", "zh", FragmentType.WORD, status,
                NOW, NOW, 1,
                new RetentionRecord(1.0, 1.0, NOW, NOW.plusSeconds(1200), 0, 0, 3.0),
                List.of(), CaptureContext.manual());
    }
}
