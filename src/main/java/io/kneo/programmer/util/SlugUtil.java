package io.kneo.programmer.util;

import java.util.Locale;
import java.util.regex.Pattern;

public final class SlugUtil {
    private static final Pattern YEAR_SUFFIX = Pattern.compile("\\s*\\(\\d{4}\\)\\s*");
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");

    private SlugUtil() {
    }

    public static String slugify(String name) {
        String s = name.strip().toLowerCase(Locale.ROOT);
        s = YEAR_SUFFIX.matcher(s).replaceAll("");
        s = NON_ALNUM.matcher(s).replaceAll("_");
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '_') {
            start++;
        }
        while (end > start && s.charAt(end - 1) == '_') {
            end--;
        }
        return s.substring(start, end);
    }

    public static String episodeAlias(String seriesTitle, int season, int episode) {
        return String.format("asset.%s.s%02de%02d", slugify(seriesTitle), season, episode);
    }
}
