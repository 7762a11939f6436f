package com.example.ps3update.controller;

import com.example.ps3update.model.FetchResult;
import com.example.ps3update.model.ProgressInfo;
import com.example.ps3update.service.UpdateCommandService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Collections;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
@CrossOrigin
public class UpdateController {

    private final UpdateCommandService commandService;

    public UpdateController(UpdateCommandService commandService) {
        this.commandService = commandService;
    }

    @GetMapping("/server/status")
    public Map<String, Boolean> serverStatus() {
        return Collections.singletonMap("online", commandService.checkServerStatus());
    }

    @GetMapping("/updates/{titleId}")
    public FetchResult fetchUpdates(@PathVariable String titleId) {
        return commandService.fetchUpdates(titleId);
    }

    @PostMapping("/downloads")
    public Map<String, String> startDownload(@RequestBody StartDownloadRequest request) {
        if (request.getUrl() == null || request.getUrl().trim().isEmpty()) {
            throw new IllegalArgumentException("url is required");
        }
        String jobId = commandService.startDownload(request.getUrl().trim(), request.getFilename(),
                request.getDownloadPath(), request.getGameTitle(), request.getTitleId(), request.isMultiPart());
        return Collections.singletonMap("jobId", jobId);
    }

    @GetMapping("/downloads/default-path")
    public Map<String, String> defaultPath() {
        return Collections.singletonMap("path", commandService.getDefaultDownloadPath());
    }

    @GetMapping("/downloads/{jobId}")
    public ProgressInfo progress(@PathVariable String jobId) {
        return commandService.getDownloadProgress(jobId);
    }

    @PostMapping("/downloads/{jobId}/cancel")
    public void cancel(@PathVariable String jobId) {
        log.info("取消任务请求: {}", jobId);
        commandService.cancelDownload(jobId);
    }

    @DeleteMapping("/downloads/{jobId}")
    public void remove(@PathVariable String jobId) {
        commandService.removeDownloadJob(jobId);
    }
}
