package com.example.ps3update.controller;

import lombok.Data;

/**
 * POST /api/downloads 请求体
 */
@Data
public class StartDownloadRequest {
    private String url;
    private String filename;
    private String downloadPath;
    private String gameTitle;
    private String titleId;
    private boolean multiPart;
}
