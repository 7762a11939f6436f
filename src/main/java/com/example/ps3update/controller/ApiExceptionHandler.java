package com.example.ps3update.controller;

import com.example.ps3update.exception.DownloadIoException;
import com.example.ps3update.exception.InvalidTitleIdException;
import com.example.ps3update.exception.JobNotFoundException;
import com.example.ps3update.exception.NetworkException;
import com.example.ps3update.exception.NoUpdatesFoundException;
import com.example.ps3update.exception.Ps3UpdateException;
import com.example.ps3update.exception.XmlParseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Collections;
import java.util.Map;

/**
 * 把核心异常转换为 HTTP 状态码和 {"error": "..."} 响应体
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler({InvalidTitleIdException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, String>> badRequest(RuntimeException e) {
        return error(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler({NoUpdatesFoundException.class, JobNotFoundException.class})
    public ResponseEntity<Map<String, String>> notFound(Ps3UpdateException e) {
        return error(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler({NetworkException.class, XmlParseException.class})
    public ResponseEntity<Map<String, String>> badGateway(Ps3UpdateException e) {
        log.warn("上游服务错误: {}", e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, e);
    }

    @ExceptionHandler(DownloadIoException.class)
    public ResponseEntity<Map<String, String>> ioError(DownloadIoException e) {
        log.error("文件系统错误", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, RuntimeException e) {
        return ResponseEntity.status(status).body(Collections.singletonMap("error", e.getMessage()));
    }
}
