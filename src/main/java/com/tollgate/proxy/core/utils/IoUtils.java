package com.tollgate.proxy.core.utils;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stream helpers for the HTTP front end.
 */
public class IoUtils {

    private IoUtils() {
        // Utility class
    }

    private static final Logger log = LoggerFactory.getLogger(IoUtils.class);

    /** Copy buffer size. */
    public static final int DEFAULT_BUFFER_SIZE = 8192;

    /** Longest request or header line accepted by default. */
    public static final int MAX_LINE_LENGTH = 8192;

    private static final byte[] CRLF = {'\r', '\n'};
    private static final byte[] LAST_CHUNK = "0\r\n\r\n".getBytes(StandardCharsets.ISO_8859_1);

    /**
     * Copies a stream to the end and flushes the output.
     *
     * @param in  source.
     * @param out destination.
     * @return bytes copied.
     * @throws IOException if either side fails.
     */
    public static long transfer(InputStream in, OutputStream out) throws IOException {
        byte[] buffer = new byte[DEFAULT_BUFFER_SIZE];
        long total = 0;
        int read;
        while ((read = in.read(buffer)) >= 0) {
            out.write(buffer, 0, read);
            total += read;
        }
        out.flush();
        return total;
    }

    /**
     * Copies a stream to the end using HTTP/1.1 chunked framing, including the
     * terminating zero-length chunk, and flushes the output.
     *
     * @param in  source.
     * @param out destination.
     * @return payload bytes copied.
     * @throws IOException if either side fails.
     */
    public static long transferChunked(InputStream in, OutputStream out) throws IOException {
        byte[] buffer = new byte[DEFAULT_BUFFER_SIZE];
        long total = 0;
        int read;
        while ((read = in.read(buffer)) >= 0) {
            if (read == 0) {
                continue;
            }
            out.write((Integer.toHexString(read) + "\r\n").getBytes(StandardCharsets.ISO_8859_1));
            out.write(buffer, 0, read);
            out.write(CRLF);
            out.flush();
            total += read;
        }
        out.write(LAST_CHUNK);
        out.flush();
        return total;
    }

    /**
     * Reads exactly {@code length} bytes.
     *
     * @param in     source.
     * @param length byte count.
     * @return the bytes.
     * @throws IOException  if the stream fails.
     * @throws EOFException if the stream ends early.
     */
    public static byte[] readFully(InputStream in, int length) throws IOException {
        byte[] data = in.readNBytes(length);
        if (data.length < length) {
            throw new EOFException("Expected " + length + " bytes, got " + data.length);
        }
        return data;
    }

    /**
     * Reads a single line of text terminated by CRLF or LF.
     *
     * @param in The input stream to read from.
     * @return The line read, or null if the end of the stream is reached.
     * @throws IOException If an I/O error occurs.
     */
    public static String readLine(InputStream in) throws IOException {
        return readLine(in, MAX_LINE_LENGTH);
    }

    /**
     * Reads a single line of text with a maximum length limit.
     * Decoded as ISO-8859-1, the HTTP/1.1 wire encoding.
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
