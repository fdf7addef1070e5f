package com.wtwr.wardrobe.infrastructure.web;

import jakarta.servlet.ReadListener;
import jakarta.servlet.ServletInputStream;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;
import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Request wrapper that lets the authentication filter peek at a bounded prefix of the body
 * without consuming it. Whatever was peeked is replayed to later readers ahead of the rest of
 * the original stream, so the handler always sees the full body.
 */
public class CachedBodyHttpServletRequest extends HttpServletRequestWrapper {

    private final int peekLimit;

    private byte[] peeked;
    private boolean complete;

    public CachedBodyHttpServletRequest(HttpServletRequest request, int peekLimit) {
        super(request);
        if (peekLimit < 0) {
            throw new IllegalArgumentException("peekLimit must not be negative");
        }
        this.peekLimit = peekLimit;
    }

    /**
     * The whole body when it is at most {@code peekLimit} bytes, otherwise empty. Never reads
     * more than {@code peekLimit + 1} bytes from the original stream.
     */
    public Optional<byte[]> peekBody() throws IOException {
        if (peeked == null) {
            peeked = super.getInputStream().readNBytes(peekLimit + 1);
            complete = peeked.length <= peekLimit;
        }
        return complete ? Optional.of(peeked) : Optional.empty();
    }

    @Override
    public ServletInputStream getInputStream() throws IOException {
        if (peeked == null) {
            return super.getInputStream();
        }
        return new ReplayingInputStream(peeked, complete ? null : super.getInputStream());
    }

    @Override
    public BufferedReader getReader() throws IOException {
        return new BufferedReader(new InputStreamReader(getInputStream(), charset()));
    }

    private Charset charset() {
        String encoding = getCharacterEncoding();
        return encoding == null ? StandardCharsets.UTF_8 : Charset.forName(encoding);
    }

    /** The peeked prefix, then whatever the original stream still holds. */
    private static final class ReplayingInputStream extends ServletInputStream {

        private final ByteArrayInputStream prefix;
        private final ServletInputStream remainder;

        ReplayingInputStream(byte[] prefix, ServletInputStream remainder) {
            this.prefix = new ByteArrayInputStream(prefix);
            this.remainder = remainder;
        }

        @Override
        public boolean isFinished() {
            return prefix.available() == 0 && (remainder == null || remainder.isFinished());
        }

        @Override
        public boolean isReady() {
            return prefix.available() > 0 || remainder == null || remainder.isReady();
        }

        @Override
        public void setReadListener(ReadListener listener) {
            throw new UnsupportedOperationException("async reads are not supported");
        }

        @Override
        public int read() throws IOException {
            int next = prefix.read();
            if (next != -1 || remainder == null) {
                return next;
            }
            return remainder.read();
        }

        @Override
        public int read(byte[] buffer, int offset, int length) throws IOException {
            if (length == 0) {
                return 0;
            }
            int read = prefix.read(buffer, offset, length);
            if (read != -1 || remainder == null) {
                return read;
            }
            return remainder.read(buffer, offset, length);
        }
    }
}
