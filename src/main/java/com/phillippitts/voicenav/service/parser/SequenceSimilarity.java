package com.phillippitts.voicenav.service.parser;

/**
 * Ratcliff/Obershelp string similarity: {@code 2*M / T}, where {@code M} is the number of
 * characters in matching blocks and {@code T} the combined length. Matching blocks are found
 * by taking the longest common substring and recursing on the pieces to its left and right;
 * ties go to the block that starts earliest.
 */
final class SequenceSimilarity {

    private SequenceSimilarity() {
    }

    static double ratio(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * matchingCharacters(a, 0, a.length(), b, 0, b.length()) / total;
    }

    private static int matchingCharacters(String a, int aLo, int aHi, String b, int bLo, int bHi) {
        if (aLo >= aHi || bLo >= bHi) {
            return 0;
        }
        int bestI = aLo;
        int bestJ = bLo;
        int bestSize = 0;
        // lengths[j + 1] holds the length of the common suffix ending at a[i], b[j]
        int[] lengths = new int[bHi - bLo + 1];
        for (int i = aLo; i < aHi; i++) {
            int[] next = new int[lengths.length];
            for (int j = bLo; j < bHi; j++) {
                if (a.charAt(i) == b.charAt(j)) {
                    int k = lengths[j - bLo] + 1;
                    next[j - bLo + 1] = k;
                    if (k > bestSize) {
                        bestI = i - k + 1;
                        bestJ = j - k + 1;
                        bestSize = k;
                    }
                }
            }
            lengths = next;
        }
        if (bestSize == 0) {
            return 0;
        }
        return bestSize
                + matchingCharacters(a, aLo, bestI, b, bLo, bestJ)
                + matchingCharacters(a, bestI + bestSize, aHi, b, bestJ + bestSize, bHi);
    }
}
