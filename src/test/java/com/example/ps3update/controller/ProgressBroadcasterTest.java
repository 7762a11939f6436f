package com.example.ps3update.controller;

import com.example.ps3update.core.DownloadManager;
import com.example.ps3update.model.DownloadStatus;
import com.example.ps3update.model.ProgressInfo;
import org.junit.jupiter.api.Test;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ProgressBroadcasterTest {

    private final DownloadManager downloadManager = mock(DownloadManager.class);
    private final SimpMessagingTemplate template = mock(SimpMessagingTemplate.class);
    private final ProgressBroadcaster broadcaster = new ProgressBroadcaster(downloadManager, template);

    @Test
    void nothingIsSentWithoutJobs() {
        broadcaster.pushProgress();
        verifyNoInteractions(template);
    }

    @Test
    void pushesAllSnapshots() {
        List<ProgressInfo> updates = Collections.singletonList(
                ProgressInfo.builder().jobId("a").status(DownloadStatus.RUNNING).build());
        when(downloadManager.hasJobs()).thenReturn(true);
        when(downloadManager.getAllProgress()).thenReturn(updates);

        broadcaster.pushProgress();

        verify(template).convertAndSend(ProgressBroadcaster.TOPIC, updates);
    }

    @Test
    void deliveryFailureDoesNotPropagate() {
        when(downloadManager.hasJobs()).thenReturn(true);
        when(downloadManager.getAllProgress()).thenReturn(Collections.emptyList());
        doThrow(new MessageDeliveryException("broker down")).when(template).convertAndSend(anyString(), any(Object.class));

        assertThatCode(broadcaster::pushProgress).doesNotThrowAnyException();
    }
}
