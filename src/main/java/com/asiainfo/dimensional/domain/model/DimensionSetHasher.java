package com.asiainfo.dimensional.domain.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * 维度集合的内容寻址哈希
 * <p>
 * set_hash = SHA256(按维度 key 排序后的 "key=value" 用 "|" 拼接)，与插入顺序无关。
 * 空集合同样合法，哈希为空串的 SHA256。
 */
public final class DimensionSetHasher {

    private DimensionSetHasher() {
    }

    public static String canonicalForm(Map<String, String> pairs) {
        return new TreeMap<>(pairs).entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("|"));
    }

    public static String hash(Map<String, String> pairs) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(canonicalForm(pairs).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
