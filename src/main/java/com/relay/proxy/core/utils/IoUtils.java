package com.relay.proxy.core.utils;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Common I/O helpers for reading HTTP/1.1 requests off a client socket.
 */
public class IoUtils {

    private IoUtils() {
        // Utility class
    }

    private static final Logger log = LoggerFactory.getLogger(IoUtils.class);

    /** Longest request line or header line accepted. */
    public static final int MAX_LINE_LENGTH = 8192;

    /**
     * Reads a single line of text from an input stream.
     * The line is considered terminated by CRLF (\r\n) or LF (\n).
     *
     * @param in The input stream to read from.
     * @return The line read, or null if the end of the stream is reached.
     * @throws IOException If an I/O error occurs.
     */
    public static String readLine(InputStream in) throws IOException {
        return readLine(in, MAX_LINE_LENGTH);
    }

    /**
     * Reads a single line of text from an input stream with a maximum length limit.
     * The line is considered terminated by CRLF (\r\n) or LF (\n) and decoded as
     * ISO-8859-1, the HTTP/1.1 wire encoding.
     *
     * @param in        The input stream to read from.
     * @param maxLength The maximum allowed length of the line.
     * @return The line read, or null if the end of the stream is reached.
     * @throws IOException If an I/O error occurs or the line exceeds maxLength.
     */
    public static String readLine(InputStream in, int maxLength) throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream(128);
        int len = 0;
        int c;
        while ((c = in.read()) != -1) {
            if (c == '\n') {
                break;
            }
            if (c != '\r') {
                if (++len > maxLength) {
                    throw new IOException("Line length exceeds maximum allowed length of " + maxLength);
                }
                buf.write(c);
            }
        }
        if (c == -1 && len == 0) {
            return null;
        }
        return buf.toString(StandardCharsets.ISO_8859_1);
    }

    /**
     * Reads exactly {@code length} bytes.
     *
     * @param in     The input stream to read from.
     * @param length Number of bytes to read.
     * @return The bytes read.
     * @throws IOException If an I/O error occurs or the stream ends early.
     */
    public static byte[] readFully(InputStream in, int length) throws IOException {
        byte[] data = in.readNBytes(length);
        if (data.length < length) {
            throw new EOFException("Stream ended after " + data.length + " of " + length + " bytes");
        }
        return data;
    }

    /**
     * Safely closes a resource without throwing exceptions.
     *
     * @param closeable The resource to close.
     */
    public static void closeQuietly(AutoCloseable closeable) {
        closeQuietly(closeable, "resource");
    }

    /**
     * Safely closes a resource, logging any exceptions.
     *
     * @param closeable The resource to close.
     * @param name      Name of the resource for logging.
     */
    public static void closeQuietly(AutoCloseable closeable, String name) {
        if (closeable != null) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.debug("Error closing {}: {}", name, e.getMessage());
            }
        }
    }
}
