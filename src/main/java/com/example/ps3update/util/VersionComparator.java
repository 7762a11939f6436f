package com.example.ps3update.util;

import java.math.BigInteger;
import java.util.Comparator;

/**
 * 版本号比较器：按 "." 分段逐段做数值比较
 * <p>
 * "1.10" > "1.2" > "1.02"。分段按数值比较，缺失的分段视为 0；
 * 非数字分段排在数字分段之前并按字典序比较。
 * 各段数值全部相等时（如 "1.2" 与 "1.02"）以原始字符串字典序裁决，结果是全序。
 * </p>
 */
public final class VersionComparator implements Comparator<String> {

    public static final VersionComparator INSTANCE = new VersionComparator();

    /**
     * 降序（最新版本在前）
     */
    public static final Comparator<String> DESCENDING = INSTANCE.reversed();

    private VersionComparator() {
    }

    @Override
    public int compare(String a, String b) {
        if (a == null || b == null) {
            return a == null ? (b == null ? 0 : -1) : 1;
        }
        String[] partsA = a.trim().split("\\.");
        String[] partsB = b.trim().split("\\.");
        int length = Math.max(partsA.length, partsB.length);
        for (int i = 0; i < length; i++) {
            String pa = i < partsA.length ? partsA[i] : "0";
            String pb = i < partsB.length ? partsB[i] : "0";
            int result = compareSegment(pa, pb);
            if (result != 0) {
                return result;
            }
        }
        return a.compareTo(b);
    }

    private static int compareSegment(String a, String b) {
        boolean numA = isNumeric(a);
        boolean numB = isNumeric(b);
        if (numA && numB) {
            return new BigInteger(a).compareTo(new BigInteger(b));
        }
        if (numA != numB) {
            return numA ? 1 : -1;
        }
        return a.compareTo(b);
    }

    private static boolean isNumeric(String s) {
        if (s.isEmpty()) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
