package com.work.archive.indexer.service.cleanup;

import com.work.archive.indexer.config.ArchiveProperties;
import com.work.archive.indexer.repository.mapper.RecoveryTaskMapper;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class RecoveryTaskCleanupJobTest {

    @Test
    public void deletes_done_tasks_older_than_retention() {
        ArchiveProperties props = new ArchiveProperties();
        props.getCleanup().setRetention(Duration.ofDays(3));
        RecoveryTaskMapper mapper = mock(RecoveryTaskMapper.class);
        RecoveryTaskCleanupJob job = new RecoveryTaskCleanupJob(props, mapper);

        Instant before = Instant.now();
        job.runOnce();

        ArgumentCaptor<Instant> cutoff = ArgumentCaptor.forClass(Instant.class);
        verify(mapper).deleteDoneBefore(cutoff.capture());
        Duration age = Duration.between(cutoff.getValue(), before);
        assertTrue(age.compareTo(Duration.ofDays(3).minusSeconds(5)) > 0);
        assertTrue(age.compareTo(Duration.ofDays(3).plusSeconds(5)) < 0);
    }

    @Test
    public void zero_retention_is_rejected() {
        ArchiveProperties props = new ArchiveProperties();
        props.getCleanup().setRetention(Duration.ZERO);
        RecoveryTaskMapper mapper = mock(RecoveryTaskMapper.class);

        assertThrows(IllegalArgumentException.class, () -> new RecoveryTaskCleanupJob(props, mapper).runOnce());
        verifyNoInteractions(mapper);
    }
}
