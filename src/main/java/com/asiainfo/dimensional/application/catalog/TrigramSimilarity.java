package com.asiainfo.dimensional.application.catalog;

import com.asiainfo.dimensional.common.util.TextNormalizer;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * 三元组相似度（与 pg_trgm 的 similarity() 语义一致）
 * <p>
 * 文本去重音、转小写后按非字母数字切词，每个词前补两个空格、后补一个空格再取三元组，
 * 相似度 = 共有三元组数 / 三元组并集大小。
 */
public final class TrigramSimilarity {

    private TrigramSimilarity() {
    }

    public static double similarity(String a, String b) {
        Set<String> left = trigrams(a);
        Set<String> right = trigrams(b);
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        Set<String> shared = new HashSet<>(left);
        shared.retainAll(right);
        int union = left.size() + right.size() - shared.size();
        return (double) shared.size() / union;
    }

    static Set<String> trigrams(String text) {
        Set<String> result = new HashSet<>();
        for (String word : words(text)) {
            String padded = "  " + word + " ";
            for (int i = 0; i + 3 <= padded.length(); i++) {
                result.add(padded.substring(i, i + 3));
            }
        }
        return result;
    }

    static String[] words(String text) {
        String normalized = TextNormalizer.unaccentLower(text).trim();
        if (normalized.isEmpty()) {
            return new String[0];
        }
        return Arrays.stream(normalized.split("[^\\p{L}\\p{N}]+"))
                .filter(w -> !w.isEmpty())
                .toArray(String[]::new);
    }
}
