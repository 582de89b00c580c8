package com.pharmanio.duty.matching;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Ratcliff/Obershelp similarity: {@code 2 * M / T} where M is the total size of the matching
 * blocks found by repeatedly taking the longest common substring (leftmost on ties) and recursing
 * on both sides of it, and T is the combined length of both strings.
 */
public final class SimilarityRatio {

    private SimilarityRatio() {
    }

    public static double ignoreCase(String a, String b) {
        return ratio(lower(a), lower(b));
    }

    public static double ratio(String a, String b) {
        String left = a == null ? "" : a;
        String right = b == null ? "" : b;

        int total = left.length() + right.length();
        if (total == 0) return 1.0;

        return 2.0 * matchingCharacters(left, right) / total;
    }

    static int matchingCharacters(String a, String b) {
        Map<Character, List<Integer>> b2j = indexOf(b);

        int matched = 0;
        Deque<int[]> queue = new ArrayDeque<>();
        queue.push(new int[]{0, a.length(), 0, b.length()});

        while (!queue.isEmpty()) {
            int[] range = queue.pop();
            int alo = range[0], ahi = range[1], blo = range[2], bhi = range[3];

            int[] block = longestMatch(a, b2j, alo, ahi, blo, bhi);
            int i = block[0], j = block[1], k = block[2];
            if (k == 0) continue;

            matched += k;
            if (alo < i && blo < j) {
                queue.push(new int[]{alo, i, blo, j});
            }
            if (i + k < ahi && j + k < bhi) {
                queue.push(new int[]{i + k, ahi, j + k, bhi});
            }
        }
        return matched;
    }

    // {start in a, start in b, length}
    private static int[] longestMatch(String a, Map<Character, List<Integer>> b2j,
                                      int alo, int ahi, int blo, int bhi) {
        int besti = alo, bestj = blo, bestSize = 0;

        Map<Integer, Integer> j2len = new HashMap<>();
        for (int i = alo; i < ahi; i++) {
            Map<Integer, Integer> next = new HashMap<>();
            for (int j : b2j.getOrDefault(a.charAt(i), List.of())) {
                if (j < blo) continue;
                if (j >= bhi) break;

                int k = j2len.getOrDefault(j - 1, 0) + 1;
                next.put(j, k);
                if (k > bestSize) {
                    besti = i - k + 1;
                    bestj = j - k + 1;
                    bestSize = k;
                }
            }
            j2len = next;
        }
        return new int[]{besti, bestj, bestSize};
    }

    private static Map<Character, List<Integer>> indexOf(String b) {
        Map<Character, List<Integer>> b2j = new HashMap<>();
        for (int j = 0; j < b.length(); j++) {
            b2j.computeIfAbsent(b.charAt(j), c -> new ArrayList<>()).add(j);
        }
        return b2j;
    }

    private static String lower(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }
}
