package com.goormthonuniv.derigo.util;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class TextUtils {
    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+");
    private static final Pattern EDGE_PUNCT = Pattern.compile("^\\p{Punct}+|\\p{Punct}+$");

    private TextUtils() {}

    /** 키워드 채점용 정규화: 소문자, 구두점 → 공백, 공백 압축 */
    public static String normalize(String text) {
        if (text == null) return "";
        String t = text.toLowerCase(Locale.ROOT);
        t = NON_WORD.matcher(t).replaceAll(" ");
        return WHITESPACE.matcher(t).replaceAll(" ").trim();
    }

    /** 공백 기준 토큰(빈 토큰 제외). 대소문자는 보존 */
    public static List<String> words(String text) {
        if (text == null || text.isBlank()) return List.of();
        return Arrays.stream(WHITESPACE.split(text.strip()))
                .filter(w -> !w.isEmpty())
                .toList();
    }

    /** 단어 앞뒤 구두점 제거 + 소문자 */
    public static String bareWord(String word) {
        return EDGE_PUNCT.matcher(word).replaceAll("").toLowerCase(Locale.ROOT);
    }

    /** . ! ? 기준 문장 분리(공백만 남는 조각 제외) */
    public static List<String> sentences(String text) {
        if (text == null || text.isBlank()) return List.of();
        return Arrays.stream(SENTENCE_END.split(text))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    public static int countMatches(Pattern pattern, String text) {
        if (text == null || text.isEmpty()) return 0;
        Matcher m = pattern.matcher(text);
        int n = 0;
        while (m.find()) n++;
        return n;
    }

    public static int countMatches(List<Pattern> patterns, String text) {
        int n = 0;
        for (Pattern p : patterns) n += countMatches(p, text);
        return n;
    }

    public static boolean containsAny(String lowerText, List<String> phrases) {
        for (String p : phrases) {
            if (lowerText.contains(p)) return true;
        }
        return false;
    }
}
