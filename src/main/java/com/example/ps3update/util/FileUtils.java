package com.example.ps3update.util;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 文件工具类
 * <p>
 * 提供文件名提取、游戏目录命名和默认下载目录解析
 * </p>
 */
public final class FileUtils {

    public static final String DEFAULT_FILE_NAME = "update.pkg";
    public static final String DEFAULT_DIR_NAME = "PS3Updates";

    private FileUtils() {
    }

    /**
     * 从URL中提取文件名（解码后的最后一段路径），不存在时返回 update.pkg
     *
     * @param url 下载URL
     * @return 提取的文件名
     */
    public static String fileNameFromUrl(String url) {
        if (url == null) {
            return DEFAULT_FILE_NAME;
        }
        String path = url.trim();
        // 去掉可能的URL参数和锚点
        int questionMarkIndex = path.indexOf('?');
        if (questionMarkIndex >= 0) {
            path = path.substring(0, questionMarkIndex);
        }
        int hashIndex = path.indexOf('#');
        if (hashIndex >= 0) {
            path = path.substring(0, hashIndex);
        }
        // 先解码整个路径再取最后一段，%2F 不能带出目录
        String decoded;
        try {
            decoded = URLDecoder.decode(path, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            decoded = path; // 非法转义按原样处理
        }
        return safeFileName(decoded);
    }

    /**
     * 只保留最后一段作为文件名，空名、"."、".." 或含 NUL 时返回 update.pkg
     */
    public static String safeFileName(String raw) {
        if (raw == null) {
            return DEFAULT_FILE_NAME;
        }
        int cut = Math.max(raw.lastIndexOf('/'), raw.lastIndexOf('\\'));
        String name = raw.substring(cut + 1).trim();
        if (name.isEmpty() || ".".equals(name) || "..".equals(name) || name.indexOf('\0') >= 0) {
            return DEFAULT_FILE_NAME;
        }
        return name;
    }

    /**
     * 游戏子目录名 "GameTitle (TITLEID)"，文件系统保留字符替换为下划线
     */
    public static String gameFolderName(String gameTitle, String titleId) {
        String folder = gameTitle + " (" + titleId + ")";
        return folder.replaceAll("[/\\\\:*?\"<>|]", "_");
    }

    /**
     * 解析默认下载目录：配置值优先，其次 ~/Downloads，最后当前工作目录
     *
     * @param configured 配置的目录，可为空
     * @return 目录绝对路径
     */
    public static String defaultDownloadPath(String configured) {
        if (configured != null && !configured.trim().isEmpty()) {
            return Paths.get(configured.trim()).toAbsolutePath().toString();
        }
        Path downloads = Paths.get(System.getProperty("user.home"), "Downloads");
        if (Files.isDirectory(downloads)) {
            return downloads.toAbsolutePath().toString();
        }
        return Paths.get(".").toAbsolutePath().normalize().toString();
    }
}
