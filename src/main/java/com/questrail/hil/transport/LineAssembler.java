package com.questrail.hil.transport;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * LineAssembler
 * -----------------------------------------------------------------------------
 * Turns raw byte chunks into terminated lines.
 *
 * <p>Bytes are decoded incrementally as UTF-8. Malformed sequences become
 * U+FFFD; a multi-byte sequence split across chunks is held back until it is
 * complete. Decoded text is split on the terminator; the unterminated remainder
 * stays pending for the next chunk. Each terminator yields exactly one line.</p>
 *
 * <p>Not thread-safe. Owned by the reader worker.</p>
 */
final class LineAssembler
{
    private final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);

    private final StringBuilder pending = new StringBuilder();
    private byte[] undecoded = new byte[0];

    /**
     * Accept {@code length} bytes of {@code chunk} and return every line whose
     * terminator has now been seen, in order.
     */
    List<String> accept(byte[] chunk, int length, String eol)
    {
        if (eol.isEmpty()) {
            throw new IllegalArgumentException("eol must not be empty");
        }

        ByteBuffer in = ByteBuffer.allocate(undecoded.length + length);
        in.put(undecoded).put(chunk, 0, length).flip();

        CharBuffer out = CharBuffer.allocate(in.remaining() + 1);
        while (true) {
            CoderResult result = decoder.decode(in, out, false);
            if (!result.isOverflow()) {
                break;
            }
            CharBuffer larger = CharBuffer.allocate(out.capacity() * 2);
            out.flip();
            larger.put(out);
            out = larger;
        }

        undecoded = new byte[in.remaining()];
        in.get(undecoded);

        out.flip();
        pending.append(out);
        return drainLines(eol);
    }

    /**
     * Text received after the last terminator.
     */
    String pendingText()
    {
        return pending.toString();
    }

    private List<String> drainLines(String eol)
    {
        List<String> lines = new ArrayList<>();
        int from = 0;
        int end;
        while ((end = pending.indexOf(eol, from)) >= 0) {
            lines.add(pending.substring(from, end));
            from = end + eol.length();
        }
        pending.delete(0, from);
        return lines;
    }
}
