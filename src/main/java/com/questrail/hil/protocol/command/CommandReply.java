package com.questrail.hil.protocol.command;

/**
 * Outcome of one command exchange.
 *
 * @param lastLine     the last non-blank line that was not the acknowledgement,
 *                     or {@code null} if the supply sent none
 * @param acknowledged true once a fresh {@code OK} arrived; false for raw
 *                     characters, which the supply never answers
 */
public record CommandReply(String lastLine, boolean acknowledged)
{
    public static CommandReply unacknowledged()
    {
        return new CommandReply(null, false);
    }

    public boolean hasLastLine()
    {
        return lastLine != null;
    }
}
