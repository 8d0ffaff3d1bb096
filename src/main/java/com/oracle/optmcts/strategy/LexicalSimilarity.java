package com.oracle.optmcts.strategy;

import org.apache.commons.lang3.StringUtils;

import java.util.HashMap;
import java.util.Map;

/**
 * Cosine similarity of term-frequency vectors over the leading characters of each fragment.
 * Tokens are lower-cased runs of letters and digits.
 */
public class LexicalSimilarity implements SimilarityStrategy {

    public static final int DEFAULT_PREFIX_CHARS = 300;

    private final int prefixChars;

    public LexicalSimilarity() {
        this(DEFAULT_PREFIX_CHARS);
    }

    public LexicalSimilarity(int prefixChars) {
        this.prefixChars = prefixChars;
    }

    @Override
    public double similarity(String a, String b) {
        Map<String, Integer> ta = termFrequencies(a);
        Map<String, Integer> tb = termFrequencies(b);
        if (ta.isEmpty() && tb.isEmpty()) {
            return StringUtils.equals(StringUtils.trimToEmpty(a), StringUtils.trimToEmpty(b)) ? 1.0 : 0.0;
        }
        if (ta.isEmpty() || tb.isEmpty()) {
            return 0.0;
        }

        double dot = 0.0;
        for (Map.Entry<String, Integer> e : ta.entrySet()) {
            Integer f = tb.get(e.getKey());
            if (f != null) {
                dot += (double) e.getValue() * f;
            }
        }
        double cosine = dot / (norm(ta) * norm(tb));
        return Math.max(0.0, Math.min(1.0, cosine));
    }

    private Map<String, Integer> termFrequencies(String text) {
        Map<String, Integer> tf = new HashMap<>();
        if (StringUtils.isBlank(text)) {
            return tf;
        }
        String s = StringUtils.left(text, prefixChars).toLowerCase();
        StringBuilder b = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            b.append(Character.isLetterOrDigit(c) ? c : ' ');
        }
        for (String token : StringUtils.split(b.toString())) {
            tf.merge(token, 1, Integer::sum);
        }
        return tf;
    }

    private static double norm(Map<String, Integer> tf) {
        double sum = 0.0;
        for (int f : tf.values()) {
            sum += (double) f * f;
        }
        return Math.sqrt(sum);
    }
}
