package com.phillippitts.ambientscribe.service.audio.capture;

import java.util.Arrays;

/**
 * Fixed-capacity ring buffer holding the trailing window of retained PCM bytes.
 *
 * <p>Writes come from the capture thread; snapshots and purges may come from any thread. Every
 * operation holds the buffer's monitor for at most one array copy or fill, so a purge can never
 * interleave with a write.
 */
final class PcmRingBuffer {

    private final byte[] buffer;
    private int writePos = 0;
    private int size = 0;

    PcmRingBuffer(int capacityBytes) {
        if (capacityBytes <= 0) {
            throw new IllegalArgumentException("capacityBytes must be positive: " + capacityBytes);
        }
        this.buffer = new byte[capacityBytes];
    }

    int capacity() {
        return buffer.length;
    }

    synchronized int writeCursor() {
        return writePos;
    }

    synchronized int bytesBuffered() {
        return size;
    }

    synchronized boolean isEmpty() {
        return size == 0;
    }

    synchronized void write(byte[] src, int off, int len) {
        if (len <= 0) {
            return;
        }
        // Only the newest capacity bytes can survive a write this large
        if (len >= buffer.length) {
            int start = off + (len - buffer.length);
            int first = buffer.length - writePos;
            System.arraycopy(src, start, buffer, writePos, first);
            System.arraycopy(src, start + first, buffer, 0, writePos);
            size = buffer.length;
            return;
        }
        int first = Math.min(len, buffer.length - writePos);
        System.arraycopy(src, off, buffer, writePos, first);
        int remaining = len - first;
        if (remaining > 0) {
            System.arraycopy(src, off + first, buffer, 0, remaining);
            writePos = remaining;
        } else {
            writePos = (writePos + first) % buffer.length;
        }
        size = Math.min(size + len, buffer.length);
    }

    /**
     * Returns the buffered bytes oldest first. Exactly {@link #bytesBuffered()} bytes long.
     */
    synchronized byte[] snapshot() {
        if (size == 0) {
            return new byte[0];
        }
        byte[] out = new byte[size];
        int start = (writePos - size + buffer.length) % buffer.length;
        int first = Math.min(size, buffer.length - start);
        System.arraycopy(buffer, start, out, 0, first);
        if (first < size) {
            System.arraycopy(buffer, 0, out, first, size - first);
        }
        return out;
    }

    /**
     * Zero-fills the storage and resets the cursor.
     *
     * @return number of bytes that were buffered before the purge
     */
    synchronized int purge() {
        int purged = size;
        Arrays.fill(buffer, (byte) 0);
        writePos = 0;
        size = 0;
        return purged;
    }

    /** True when every storage byte is zero. Used to verify a purge. */
    synchronized boolean isZeroFilled() {
        for (byte b : buffer) {
            if (b != 0) {
                return false;
            }
        }
        return true;
    }
}
