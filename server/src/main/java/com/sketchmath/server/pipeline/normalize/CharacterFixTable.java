package com.sketchmath.server.pipeline.normalize;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ordered table of literal replacements for recognition artifacts. Entries are
 * applied one after another over the whole text, so output of an earlier entry
 * is visible to later ones.
 */
public final class CharacterFixTable {

    private final List<String[]> entries;

    private CharacterFixTable(List<String[]> entries) {
        this.entries = Collections.unmodifiableList(entries);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String apply(String text) {
        String result = text;
        for (String[] entry : entries) {
            result = result.replace(entry[0], entry[1]);
        }
        return result;
    }

    /**
     * Applies the table everywhere except inside occurrences of the protected
     * words that are not part of a longer name. Digits do not join a name, so
     * "2cos(60)" and "log2" keep their function names.
     */
    public String applyOutside(String text, Set<String> protectedWords) {
        if (protectedWords.isEmpty()) {
            return apply(text);
        }
        Matcher m = wordPattern(protectedWords).matcher(text);
        StringBuilder sb = new StringBuilder();
        int last = 0;
        while (m.find()) {
            sb.append(apply(text.substring(last, m.start())));
            sb.append(m.group());
            last = m.end();
        }
        sb.append(apply(text.substring(last)));
        return sb.toString();
    }

    public int size() {
        return entries.size();
    }

    private static Pattern wordPattern(Set<String> words) {
        StringBuilder alternation = new StringBuilder();
        for (String word : words) {
            if (alternation.length() > 0) {
                alternation.append('|');
            }
            alternation.append(Pattern.quote(word));
        }
        return Pattern.compile("(?<![A-Za-z_])(?:" + alternation + ")(?![A-Za-z_])");
    }

    public static final class Builder {
        private final List<String[]> entries = new ArrayList<>();

        public Builder fix(String from, String to) {
            entries.add(new String[] { from, to });
            return this;
        }

        public CharacterFixTable build() {
            return new CharacterFixTable(new ArrayList<>(entries));
        }
    }
}
