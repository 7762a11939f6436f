package com.example.ps3update.controller;

import com.example.ps3update.core.DownloadManager;
import com.example.ps3update.model.ProgressInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 定时推送所有任务的进度到 /topic/progress
 */
@Slf4j
@Component
public class ProgressBroadcaster {

    public static final String TOPIC = "/topic/progress";

    private final DownloadManager downloadManager;
    private final SimpMessagingTemplate messagingTemplate;

    public ProgressBroadcaster(DownloadManager downloadManager, SimpMessagingTemplate messagingTemplate) {
        this.downloadManager = downloadManager;
        this.messagingTemplate = messagingTemplate;
    }

    @Scheduled(fixedRate = 800)
    public void pushProgress() {
        if (!downloadManager.hasJobs()) {
            return;
        }
        List<ProgressInfo> updates = downloadManager.getAllProgress();
        try {
            messagingTemplate.convertAndSend(TOPIC, updates);
        } catch (MessagingException e) {
            // 推送失败不能终止定时任务
            log.warn("推送进度失败: {}", e.getMessage());
        }
    }
}
