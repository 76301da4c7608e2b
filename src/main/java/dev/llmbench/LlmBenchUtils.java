package dev.llmbench;

import java.util.Arrays;
import java.util.List;

public class LlmBenchUtils {
    public static List<String> parseCsv(String csv) {
        if (csv == null || csv.isBlank()) {
            return List.of();
        }

        return Arrays.stream(csv.trim().split("\\s*,\\s*")).toList();
    }

    /** Rounds to one decimal place, half up. */
    public static double roundToTenth(double value) {
        return Math.round(value * 10) / 10.0;
    }

    /** Rough output token estimate: one token per four characters of English text. */
    public static int estimateTokenCount(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (int) Math.ceil(text.length() / 4.0);
    }
}
