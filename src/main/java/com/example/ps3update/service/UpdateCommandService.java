package com.example.ps3update.service;

import com.example.ps3update.config.Ps3Properties;
import com.example.ps3update.core.DownloadManager;
import com.example.ps3update.core.UpdateFetcher;
import com.example.ps3update.model.DownloadMode;
import com.example.ps3update.model.FetchResult;
import com.example.ps3update.model.ProgressInfo;
import com.example.ps3update.util.FileUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 面向界面层的命令接口
 * <p>
 * 界面层只通过这里调用核心：查询更新、启动/查询/取消/移除下载任务。
 * 下载文件保存在 下载目录/"游戏名 (TITLEID)"/文件名。
 * </p>
 */
@Slf4j
@Service
public class UpdateCommandService {

    private final UpdateFetcher updateFetcher;
    private final DownloadManager downloadManager;
    private final Ps3Properties.Download settings;

    public UpdateCommandService(UpdateFetcher updateFetcher, DownloadManager downloadManager, Ps3Properties properties) {
        this.updateFetcher = updateFetcher;
        this.downloadManager = downloadManager;
        this.settings = properties.getDownload();
    }

    public boolean checkServerStatus() {
        return updateFetcher.checkServerStatus();
    }

    public FetchResult fetchUpdates(String titleId) {
        return updateFetcher.fetchUpdates(titleId);
    }

    /**
     * 启动下载
     *
     * @param url 更新包地址
     * @param filename 保存的文件名，为空时取 URL 最后一段
     * @param downloadPath 下载根目录，为空时使用默认目录
     * @param gameTitle 游戏名，用于子目录
     * @param titleId Title ID，用于子目录
     * @param multiPart 是否分片下载
     * @return 任务 ID
     */
    public String startDownload(String url, String filename, String downloadPath,
                                String gameTitle, String titleId, boolean multiPart) {
        Path target = resolveTarget(url, filename, downloadPath, gameTitle, titleId);
        DownloadMode mode = multiPart ? DownloadMode.multiPart(settings.getDefaultParts()) : DownloadMode.direct();
        return downloadManager.startDownload(url, target, mode);
    }

    Path resolveTarget(String url, String filename, String downloadPath, String gameTitle, String titleId) {
        String root = isBlank(downloadPath) ? getDefaultDownloadPath() : downloadPath.trim();
        String name = isBlank(filename) ? FileUtils.fileNameFromUrl(url) : FileUtils.safeFileName(filename);
        String folder = FileUtils.gameFolderName(
                isBlank(gameTitle) ? FileUtils.DEFAULT_DIR_NAME : gameTitle.trim(),
                isBlank(titleId) ? "UNKNOWN" : titleId.trim());
        return Paths.get(root, folder, name);
    }

    public ProgressInfo getDownloadProgress(String jobId) {
        return downloadManager.getProgress(jobId);
    }

    public void cancelDownload(String jobId) {
        downloadManager.cancelDownload(jobId);
    }

    public void removeDownloadJob(String jobId) {
        downloadManager.removeJob(jobId);
    }

    public String getDefaultDownloadPath() {
        return FileUtils.defaultDownloadPath(settings.getDefaultPath());
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
