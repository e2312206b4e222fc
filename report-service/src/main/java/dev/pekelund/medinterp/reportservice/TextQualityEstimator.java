package dev.pekelund.medinterp.reportservice;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scores recovered report text by how much it looks like a lab report: medical vocabulary,
 * numeric density and unit tokens.
 */
final class TextQualityEstimator {

    static final double MINIMUM_SCORE = 0.1;
    static final int MINIMUM_LENGTH = 50;

    private static final double BASE_SCORE = 0.5;
    private static final double KEYWORD_WEIGHT = 0.3;
    private static final double NUMBERS_BONUS = 0.1;
    private static final double UNITS_BONUS = 0.1;
    private static final int NUMBERS_REQUIRED = 6;
    private static final double CONFIDENT_QUALITY = 0.6;

    private static final List<String> MEDICAL_KEYWORDS = List.of("patient", "test", "result", "value", "range",
        "reference", "normal", "abnormal", "lab", "blood", "specimen", "collected");
    private static final Pattern NUMBER = Pattern.compile("\\d+\\.?\\d*");
    private static final Pattern UNIT = Pattern.compile("mg/dL|mmol/L|g/L|U/L|%|bpm|mmHg", Pattern.CASE_INSENSITIVE);

    private TextQualityEstimator() {
    }

    static double qualityOf(String text) {
        if (text == null || text.length() < MINIMUM_LENGTH) {
            return MINIMUM_SCORE;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        long keywordMatches = MEDICAL_KEYWORDS.stream().filter(lower::contains).count();
        double score = BASE_SCORE + ((double) keywordMatches / MEDICAL_KEYWORDS.size()) * KEYWORD_WEIGHT;
        if (countNumbers(text) >= NUMBERS_REQUIRED) {
            score += NUMBERS_BONUS;
        }
        if (UNIT.matcher(text).find()) {
            score += UNITS_BONUS;
        }
        return Math.min(score, 1.0);
    }

    static double confidenceFor(double quality) {
        return quality > CONFIDENT_QUALITY ? 0.9 : 0.7;
    }

    private static int countNumbers(String text) {
        Matcher matcher = NUMBER.matcher(text);
        int count = 0;
        while (matcher.find() && count < NUMBERS_REQUIRED) {
            count++;
        }
        return count;
    }
}
