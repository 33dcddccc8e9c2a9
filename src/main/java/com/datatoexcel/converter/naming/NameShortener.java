package com.datatoexcel.converter.naming;

import lombok.experimental.UtilityClass;

/**
 * Compresses dotted table path names to fit the 31-character sheet name limit.
 *
 * Names within the limit are returned unchanged. Longer names keep their last segment whole and
 * reduce every other segment to its first two characters plus its last one. A result that is
 * still too long is cut to 30 characters followed by its own last character.
 * Distinct names may shorten to the same result.
 */
@UtilityClass
public class NameShortener {

    public static final int MAX_LENGTH = 31;

    public static String shorten(String name) {
        if (name.length() <= MAX_LENGTH) {
            return name;
        }
        String[] segments = name.split("\\.", -1);
        StringBuilder shortName = new StringBuilder();
        for (int i = 0; i < segments.length - 1; i++) {
            shortName.append(abbreviate(segments[i])).append('.');
        }
        shortName.append(segments[segments.length - 1]);

        if (shortName.length() <= MAX_LENGTH) {
            return shortName.toString();
        }
        return shortName.substring(0, MAX_LENGTH - 1) + shortName.charAt(shortName.length() - 1);
    }

    private static String abbreviate(String segment) {
        if (segment.isEmpty()) {
            return segment;
        }
        return segment.substring(0, Math.min(2, segment.length())) + segment.charAt(segment.length() - 1);
    }
}
