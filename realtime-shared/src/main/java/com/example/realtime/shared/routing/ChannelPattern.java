package com.example.realtime.shared.routing;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.regex.Pattern;

/**
 * A glob channel pattern with the store's PSUBSCRIBE semantics: {@code *} matches any run of
 * characters, {@code ?} a single character, everything else literally.
 */
@Getter
@EqualsAndHashCode(of = "glob")
public final class ChannelPattern {

    private final String glob;
    private final Pattern regex;

    private ChannelPattern(String glob) {
        this.glob = glob;
        this.regex = Pattern.compile(toRegex(glob));
    }

    public static ChannelPattern of(String glob) {
        if (glob == null || glob.isBlank()) {
            throw new IllegalArgumentException("Channel pattern must not be blank");
        }
        return new ChannelPattern(glob);
    }

    public boolean matches(String channel) {
        return channel != null && regex.matcher(channel).matches();
    }

    private static String toRegex(String glob) {
        StringBuilder sb = new StringBuilder(glob.length() + 8);
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    sb.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                sb.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            sb.append(Pattern.quote(literal.toString()));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return glob;
    }
}
