package com.fplrefresh.queue;

import com.fplrefresh.domain.JobType;
import com.fplrefresh.domain.RefreshJob.JobStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QueueMaintenanceJobTest {

    @Mock
    private RefreshJobQueue queue;

    @InjectMocks
    private QueueMaintenanceJob job;

    @Test
    void checkStalled_delegatesToQueue() {
        when(queue.recoverStalled()).thenReturn(2);

        job.checkStalled();

        verify(queue).recoverStalled();
    }

    @Test
    void cleanup_sweepsThenReportsEveryQueue() {
        when(queue.cleanup()).thenReturn(3L);
        when(queue.getJobCounts(any(JobType.class))).thenReturn(Map.of(JobStatus.WAITING, 1L));

        job.cleanup();

        verify(queue).cleanup();
        verify(queue, times(JobType.values().length)).getJobCounts(any(JobType.class));
    }
}
