package com.songbook.common.util;

import java.util.Locale;
import java.util.function.Predicate;

/**
 * URL slug 生成：小写，非字母数字折叠为 "-"，去掉首尾 "-"。
 */
public final class Slugs {

    private static final int MAX_LENGTH = 64;

    private Slugs() {
    }

    public static String slugify(String raw, String fallback) {
        String s = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-+|-+$", "");
        if (s.length() > MAX_LENGTH) {
            s = s.substring(0, MAX_LENGTH).replaceAll("-+$", "");
        }
        return s.isEmpty() ? fallback : s;
    }

    /**
     * 生成唯一 slug：被占用时依次尝试 base-1、base-2 ...
     */
    public static String unique(String raw, String fallback, Predicate<String> taken) {
        String base = slugify(raw, fallback);
        String slug = base;
        int counter = 1;
        while (taken.test(slug)) {
            slug = base + "-" + counter;
            counter++;
        }
        return slug;
    }
}
