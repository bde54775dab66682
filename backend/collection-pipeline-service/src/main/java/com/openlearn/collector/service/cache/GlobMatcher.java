package com.openlearn.collector.service.cache;

import java.util.regex.Pattern;

/**
 * Redis-style glob ({@code *}, {@code ?}, {@code [abc]}) compiled to a regex.
 */
final class GlobMatcher {

    private GlobMatcher() {
    }

    static Pattern compile(String glob) {
        StringBuilder regex = new StringBuilder();
        boolean inClass = false;
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '\\' && i + 1 < glob.length()) {
                regex.append(Pattern.quote(String.valueOf(glob.charAt(++i))));
            } else if (inClass) {
                if (c == ']') {
                    inClass = false;
                }
                regex.append(c);
            } else if (c == '*') {
                regex.append(".*");
            } else if (c == '?') {
                regex.append('.');
            } else if (c == '[') {
                inClass = true;
                regex.append(c);
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }
}
