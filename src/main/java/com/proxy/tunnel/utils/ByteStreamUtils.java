package com.proxy.tunnel.utils;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

public final class ByteStreamUtils {

    private ByteStreamUtils() {}

    /**
     * Reads one line terminated by LF (optionally preceded by CR), one byte at a time so that
     * nothing past the line is consumed from the stream.
     *
     * @return the line without its terminator, or {@code null} if the stream ended before any byte
     * @throws IOException if the line exceeds {@code maxLength} bytes or the stream ends mid-line
     */
    public static String readLine(InputStream in, int maxLength) throws IOException {
        ByteArrayOutputStream lineBuffer = new ByteArrayOutputStream();
        int prevChar = -1;
        int currentChar;
        while ((currentChar = in.read()) != -1) {
            if (currentChar == '\n') {
                int end = prevChar == '\r' ? lineBuffer.size() - 1 : lineBuffer.size();
                return new String(lineBuffer.toByteArray(), 0, end, StandardCharsets.ISO_8859_1);
            }
            if (lineBuffer.size() >= maxLength) {
                throw new IOException("Line exceeds " + maxLength + " bytes");
            }
            lineBuffer.write(currentChar);
            prevChar = currentChar;
        }
        if (lineBuffer.size() == 0) {
            return null;
        }
        throw new IOException("Reached end of stream in the middle of a line");
    }

    /**
     * Reads and discards up to {@code length} bytes.
     *
     * @return the number of bytes discarded, less than {@code length} only at end of stream
     */
    public static long discard(InputStream in, long length) throws IOException {
        byte[] scratch = new byte[(int) Math.min(length, 4096)];
        long discarded = 0;
        while (discarded < length) {
            int read = in.read(scratch, 0, (int) Math.min(scratch.length, length - discarded));
            if (read == -1) {
                break;
            }
            discarded += read;
        }
        return discarded;
    }
}
