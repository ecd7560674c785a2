package com.gdin.inspection.erpvector.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

public class TextDistanceUtil {

    public static int levenshtein(String a, String b) {
        if (a.equals(b)) return 0;
        if (a.isEmpty()) return b.length();
        if (b.isEmpty()) return a.length();

        int[] prev = new int[b.length() + 1];
        int[] curr = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) prev[j] = j;

        for (int i = 1; i <= a.length(); i++) {
            curr[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[b.length()];
    }

    /**
     * 按编辑距离找相近候选，距离升序、同距离按字母序
     */
    public static List<String> closest(String input, Collection<String> candidates, int maxDistance, int limit) {
        if (input == null) return List.of();
        String needle = input.toLowerCase(Locale.ROOT);
        List<Scored> scored = new ArrayList<>();
        for (String candidate : candidates) {
            int d = levenshtein(needle, candidate.toLowerCase(Locale.ROOT));
            if (d <= maxDistance) scored.add(new Scored(candidate, d));
        }
        return scored.stream()
                .sorted(Comparator.comparingInt((Scored s) -> s.distance).thenComparing(s -> s.value))
                .limit(limit)
                .map(s -> s.value)
                .collect(Collectors.toList());
    }

    private static class Scored {
        final String value;
        final int distance;

        Scored(String value, int distance) {
            this.value = value;
            this.distance = distance;
        }
    }
}
