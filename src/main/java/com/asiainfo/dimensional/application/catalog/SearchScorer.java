package com.asiainfo.dimensional.application.catalog;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalDouble;

/**
 * 目录检索打分
 * <p>
 * 命中条件：词法命中（查询词全部出现在检索字段中）或 最佳三元组相似度 >= 阈值。
 * 得分 = 2 × 词法得分 + 1.5 × 最佳相似度。
 * 词法得分为各字段权重 × 该字段命中的查询词占比之和，权重 A=1.0、B=0.4、C=0.2、D=0.1。
 */
public final class SearchScorer {

    public static final double WEIGHT_A = 1.0;
    public static final double WEIGHT_B = 0.4;
    public static final double WEIGHT_C = 0.2;
    public static final double WEIGHT_D = 0.1;

    private static final double LEXICAL_FACTOR = 2.0;
    private static final double SIMILARITY_FACTOR = 1.5;

    private SearchScorer() {
    }

    /**
     * 参与检索的字段文本及其权重
     */
    public record Field(String text, double weight) {
    }

    /**
     * 未命中时返回空
     */
    public static OptionalDouble score(String query, List<Field> fields, double threshold) {
        String[] queryTerms = TrigramSimilarity.words(query);
        if (queryTerms.length == 0) {
            return OptionalDouble.empty();
        }
        double lexical = lexicalRank(queryTerms, fields);
        double bestSimilarity = fields.stream()
                .mapToDouble(f -> TrigramSimilarity.similarity(f.text(), query))
                .max()
                .orElse(0.0);
        if (lexical <= 0.0 && bestSimilarity < threshold) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(LEXICAL_FACTOR * lexical + SIMILARITY_FACTOR * bestSimilarity);
    }

    static double lexicalRank(String[] queryTerms, List<Field> fields) {
        List<List<String>> fieldTerms = new ArrayList<>();
        for (Field field : fields) {
            fieldTerms.add(Arrays.asList(TrigramSimilarity.words(field.text())));
        }
        for (String term : queryTerms) {
            boolean present = fieldTerms.stream().anyMatch(terms -> terms.contains(term));
            if (!present) {
                return 0.0;
            }
        }
        double rank = 0.0;
        for (int i = 0; i < fields.size(); i++) {
            List<String> terms = fieldTerms.get(i);
            long matched = Arrays.stream(queryTerms).filter(terms::contains).count();
            rank += fields.get(i).weight() * matched / queryTerms.length;
        }
        return rank;
    }
}
