package net.spookly.edgegate.proxy;

import java.nio.charset.StandardCharsets;

import io.netty.buffer.ByteBuf;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaders;
import net.spookly.edgegate.error.UpstreamProtocolException;

/**
 * Finds and parses an HTTP/1.x response head at the start of a buffer without consuming it.
 */
public final class ResponseHeadParser {
    private ResponseHeadParser() {
    }

    /**
     * @return the head, or null when more bytes are needed
     * @throws UpstreamProtocolException when the head is malformed or larger than {@code maxHeadBytes}
     */
    public static ResponseHead tryParse(ByteBuf buffer, int maxHeadBytes) {
        int start = buffer.readerIndex();
        int end = indexOfBlankLine(buffer, start, Math.min(buffer.writerIndex(), start + maxHeadBytes));
        if (end < 0) {
            if (buffer.readableBytes() >= maxHeadBytes) {
                throw new UpstreamProtocolException("upstream response head exceeds " + maxHeadBytes + " bytes");
            }
            return null;
        }
        int headLength = end - start;
        String text = buffer.toString(start, headLength - 4, StandardCharsets.ISO_8859_1);
        String[] lines = text.split("\r\n");
        String statusLine = lines[0];
        if (!statusLine.startsWith("HTTP/1.")) {
            throw new UpstreamProtocolException("upstream did not answer with HTTP/1.x: " + abbreviate(statusLine));
        }
        int firstSpace = statusLine.indexOf(' ');
        if (firstSpace < 0 || statusLine.length() < firstSpace + 4) {
            throw new UpstreamProtocolException("malformed upstream status line: " + abbreviate(statusLine));
        }
        int status;
        try {
            status = Integer.parseInt(statusLine.substring(firstSpace + 1, firstSpace + 4));
        } catch (NumberFormatException e) {
            throw new UpstreamProtocolException("malformed upstream status code: " + abbreviate(statusLine), e);
        }
        if (status < 100 || status > 599) {
            throw new UpstreamProtocolException("upstream status code out of range: " + status);
        }
        String reason = statusLine.length() > firstSpace + 5 ? statusLine.substring(firstSpace + 5) : "";
        HttpHeaders headers = new DefaultHttpHeaders(false);
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i];
            int colon = line.indexOf(':');
            if (colon <= 0) {
                throw new UpstreamProtocolException("malformed upstream header line: " + abbreviate(line));
            }
            headers.add(line.substring(0, colon).trim(), line.substring(colon + 1).trim());
        }
        return new ResponseHead(status, reason, headers, headLength);
    }

    /**
     * @return index just past the first CRLFCRLF in [from, to), or -1
     */
    private static int indexOfBlankLine(ByteBuf buffer, int from, int to) {
        for (int i = from; i + 3 < to; i++) {
            if (buffer.getByte(i) == '\r' && buffer.getByte(i + 1) == '\n'
                    && buffer.getByte(i + 2) == '\r' && buffer.getByte(i + 3) == '\n') {
                return i + 4;
            }
        }
        return -1;
    }

    private static String abbreviate(String value) {
        return value.length() <= 80 ? value : value.substring(0, 80) + "...";
    }
}
