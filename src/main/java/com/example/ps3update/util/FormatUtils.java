package com.example.ps3update.util;

import com.example.ps3update.exception.InvalidTitleIdException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 格式化与 Title ID 校验工具类
 */
public final class FormatUtils {

    private static final String[] UNITS = {"B", "KB", "MB", "GB", "TB"};
    private static final Pattern TITLE_ID_PATTERN = Pattern.compile("^[A-Z]{4}[0-9]{5}$");
    private static final Pattern SEPARATORS = Pattern.compile("[\\s\\-_.]+");

    private FormatUtils() {
    }

    /**
     * 字节数转为可读字符串，以 1024 为进制，保留两位小数
     * <p>
     * 例如: 123456789 -> "117.74 MB"，0 -> "0 B"
     * </p>
     *
     * @param bytes 字节数
     * @return 可读字符串
     */
    public static String formatSize(long bytes) {
        if (bytes <= 0) {
            return "0 B";
        }
        double size = bytes;
        int unit = 0;
        while (size >= 1024 && unit < UNITS.length - 1) {
            size /= 1024;
            unit++;
        }
        return String.format(Locale.ROOT, "%.2f %s", size, UNITS[unit]);
    }

    public static String formatSpeed(double bytesPerSecond) {
        if (bytesPerSecond < 1) {
            return "0 B/s";
        }
        return formatSize((long) bytesPerSecond) + "/s";
    }

    /**
     * 清洗 Title ID：去掉空白和分隔符 (- _ .)，转为大写，再校验格式
     * <p>
     * "bles-00799"、"BLES 00799"、"BLES00799" 均得到 "BLES00799"。
     * 其他非法字符不会被剔除，校验直接失败。
     * </p>
     *
     * @param raw 用户输入
     * @return 规范化后的 9 位 Title ID
     * @throws InvalidTitleIdException 清洗结果不是 4 位字母 + 5 位数字
     */
    public static String cleanTitleId(String raw) {
        if (raw == null) {
            throw new InvalidTitleIdException("null");
        }
        String cleaned = SEPARATORS.matcher(raw).replaceAll("").toUpperCase(Locale.ROOT);
        if (!TITLE_ID_PATTERN.matcher(cleaned).matches()) {
            throw new InvalidTitleIdException(raw);
        }
        return cleaned;
    }
}
