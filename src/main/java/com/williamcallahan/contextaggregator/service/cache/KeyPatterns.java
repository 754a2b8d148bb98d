package com.williamcallahan.contextaggregator.service.cache;

import java.util.regex.Pattern;

/**
 * Glob matching for cache keys.
 */
final class KeyPatterns {

    private KeyPatterns() {}

    /**
     * Compiles a glob where {@code *} matches any run of characters and everything else is literal.
     *
     * @param glob glob pattern
     * @return anchored regular expression
     */
    static Pattern compile(String glob) {
        StringBuilder regex = new StringBuilder("^");
        int literalStart = 0;
        for (int index = 0; index < glob.length(); index++) {
            if (glob.charAt(index) == '*') {
                if (index > literalStart) {
                    regex.append(Pattern.quote(glob.substring(literalStart, index)));
                }
                regex.append(".*");
                literalStart = index + 1;
            }
        }
        if (literalStart < glob.length()) {
            regex.append(Pattern.quote(glob.substring(literalStart)));
        }
        return Pattern.compile(regex.append('$').toString(), Pattern.DOTALL);
    }

    /**
     * Rewrites a glob for Redis {@code SCAN MATCH}, escaping the characters Redis treats as special
     * besides {@code *} so both cache providers match the same keys.
     *
     * @param glob glob pattern
     * @return Redis match pattern
     */
    static String toRedisMatch(String glob) {
        StringBuilder match = new StringBuilder(glob.length());
        for (int index = 0; index < glob.length(); index++) {
            char character = glob.charAt(index);
            if (character == '?' || character == '[' || character == ']' || character == '\\') {
                match.append('\\');
            }
            match.append(character);
        }
        return match.toString();
    }
}
