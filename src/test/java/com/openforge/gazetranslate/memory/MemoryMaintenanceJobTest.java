package com.openforge.gazetranslate.memory;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MemoryMaintenanceJobTest {

    @Mock
    private MemoryStore memoryStore;

    @InjectMocks
    private MemoryMaintenanceJob job;

    @Test
    void delegatesToStore() {
        when(memoryStore.purgeStale()).thenReturn(3);

        job.purgeStale();
        job.purgeStale();

        verify(memoryStore, times(2)).purgeStale();
    }

    @Test
    void failedSweepDoesNotEscapeTheScheduler() {
        when(memoryStore.purgeStale()).thenThrow(new QueryTimeoutException("lock wait timeout"));

        assertThatCode(job::purgeStale).doesNotThrowAnyException();
    }
}
