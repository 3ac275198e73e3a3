package com.hearth.common.version;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A version string together with the strategy it was recognised under.
 * Ordering compares the numeric segments left to right.
 */
public record Version(String raw, VersionStrategy strategy) implements Comparable<Version> {

    private static final Pattern NUMBER = Pattern.compile("\\d+");

    public List<Long> segments() {
        List<Long> parts = new ArrayList<>();
        Matcher matcher = NUMBER.matcher(raw);
        while (matcher.find()) {
            try {
                parts.add(Long.parseLong(matcher.group()));
            } catch (NumberFormatException e) {
                parts.add(Long.MAX_VALUE);
            }
        }
        return parts;
    }

    @Override
    public int compareTo(Version other) {
        List<Long> a = segments();
        List<Long> b = other.segments();
        for (int i = 0; i < Math.max(a.size(), b.size()); i++) {
            long left = i < a.size() ? a.get(i) : 0;
            long right = i < b.size() ? b.get(i) : 0;
            if (left != right) {
                return left < right ? -1 : 1;
            }
        }
        return 0;
    }

    @Override
    public String toString() {
        return raw;
    }
}
