package im.arun.linktree.util;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Splitting and joining of delimited tag strings.
 */
public final class TagUtils {

    private TagUtils() {}

    /**
     * Split a tag string on the delimiter, trimming each segment and dropping empty ones.
     * Duplicates collapse onto their first position.
     * e.g., " Pump , ,Valve,Pump" -> [Pump, Valve]
     */
    public static Set<String> parseTags(String tagString, String delimiter) {
        Set<String> tags = new LinkedHashSet<>();
        if (tagString == null || tagString.isBlank()) {
            return tags;
        }

        for (String segment : tagString.split(Pattern.quote(delimiter), -1)) {
            String tag = segment.strip();
            if (!tag.isEmpty()) {
                tags.add(tag);
            }
        }
        return tags;
    }

    public static String joinTags(Collection<String> tags, String delimiter) {
        if (tags == null || tags.isEmpty()) {
            return "";
        }
        return String.join(delimiter, tags);
    }
}
