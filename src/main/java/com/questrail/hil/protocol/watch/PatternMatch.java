package com.questrail.hil.protocol.watch;

import java.util.Objects;
import java.util.regex.MatchResult;

/**
 * A line that matched the watched pattern.
 *
 * @param match       the match, detached from its matcher so groups stay readable
 * @param matchedLine the full line, without its terminator
 */
public record PatternMatch(MatchResult match, String matchedLine)
{
    public PatternMatch {
        Objects.requireNonNull(match, "match");
        Objects.requireNonNull(matchedLine, "matchedLine");
    }

    public String group(int group)
    {
        return match.group(group);
    }
}
