package com.asiainfo.dimensional.common.util;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 文本归一化工具
 */
public final class TextNormalizer {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");

    private TextNormalizer() {
    }

    /**
     * 去重音 + 小写，用于检索比较
     */
    public static String unaccentLower(String text) {
        if (text == null) {
            return "";
        }
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
        return COMBINING_MARKS.matcher(decomposed).replaceAll("").toLowerCase(Locale.ROOT);
    }

    public static String trimToNull(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static String lowerTrim(String text) {
        return text == null ? null : text.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * "country" -> "Country"，"sales_channel" -> "Sales Channel"
     */
    public static String displayName(String key) {
        String[] words = key.replace('_', ' ').split(" ", -1);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < words.length; i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append(titleCase(words[i]));
        }
        return sb.toString();
    }

    // 字母序列首字母大写，其余小写；非字母字符断开序列
    private static String titleCase(String word) {
        StringBuilder sb = new StringBuilder(word.length());
        boolean previousLetter = false;
        for (char c : word.toCharArray()) {
            if (Character.isLetter(c)) {
                sb.append(previousLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
                previousLetter = true;
            } else {
                sb.append(c);
                previousLetter = false;
            }
        }
        return sb.toString();
    }

    /**
     * 展开重复参数与 "|" 分隔的多值：["a|b", "c"] -> [a, b, c]，去空去重保序
     */
    public static List<String> splitPipes(Collection<String> raw) {
        LinkedHashSet<String> values = new LinkedHashSet<>();
        if (raw != null) {
            for (String item : raw) {
                if (item == null) {
                    continue;
                }
                for (String part : item.split("\\|")) {
                    String trimmed = part.trim();
                    if (!trimmed.isEmpty()) {
                        values.add(trimmed);
                    }
                }
            }
        }
        return new ArrayList<>(values);
    }

    /**
     * 去重保序
     */
    public static List<String> distinct(Collection<String> keys) {
        return keys == null ? List.of() : new ArrayList<>(new LinkedHashSet<>(keys));
    }
}
