/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package org.fireflyframework.flow.bridge;

import java.nio.ByteBuffer;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed-size shared buffer with two control words and a blocking wait/notify primitive.
 * <p>
 * Layout: {@code [lock:int32][length:int32][bytes...]}. The lock word carries the exchange state:
 * {@code 0} while a request is pending, {@code id} when the reply for request {@code id} is in the
 * buffer and {@code -id} when the request failed. In the failure case the length word holds the reply
 * size the buffer would have needed, or {@code -1} when the remote handler itself failed.
 * <p>
 * The channel is a single slot: callers must hold it ({@link #acquire(long)}) for the whole exchange.
 */
public class SharedChannel {
    public static final int DEFAULT_CAPACITY = 2 * 1024 * 1024;
    public static final int HANDLER_FAILED = -1;

    private static final int HEADER_BYTES = 8;

    public enum Word {
        LOCK(0), LENGTH(4);

        private final int offset;

        Word(int offset) {
            this.offset = offset;
        }
    }

    public enum WaitResult { OK, NOT_EQUAL, TIMED_OUT }

    private final int capacity;
    private final ByteBuffer buffer;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final Semaphore slot = new Semaphore(1, true);
    private int activeRequestId;

    public SharedChannel() {
        this(DEFAULT_CAPACITY);
    }

    public SharedChannel(int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
        this.capacity = capacity;
        this.buffer = ByteBuffer.allocate(HEADER_BYTES + capacity);
    }

    /** Size of the data region in bytes. */
    public int capacity() {
        return capacity;
    }

    public boolean acquire(long timeoutMs) throws InterruptedException {
        return slot.tryAcquire(Math.max(0L, timeoutMs), TimeUnit.MILLISECONDS);
    }

    public void release() {
        slot.release();
    }

    public int load(Word word) {
        lock.lock();
        try {
            return buffer.getInt(word.offset);
        } finally {
            lock.unlock();
        }
    }

    /** Writes a header word; the lock is reentrant, so this also runs inside the framing methods. */
    public void store(Word word, int value) {
        lock.lock();
        try {
            buffer.putInt(word.offset, value);
        } finally {
            lock.unlock();
        }
    }

    /** Wakes every thread blocked in {@link #await(Word, int, long)}. */
    public void signal() {
        lock.lock();
        try {
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks while {@code word} holds {@code expected}, for at most {@code timeoutMs}.
     *
     * @return {@code NOT_EQUAL} when the word did not hold {@code expected} on entry, {@code OK} when it
     * changed while waiting, {@code TIMED_OUT} otherwise
     */
    public WaitResult await(Word word, int expected, long timeoutMs) throws InterruptedException {
        long remaining = TimeUnit.MILLISECONDS.toNanos(Math.max(0L, timeoutMs));
        lock.lock();
        try {
            if (buffer.getInt(word.offset) != expected) {
                return WaitResult.NOT_EQUAL;
            }
            while (buffer.getInt(word.offset) == expected) {
                if (remaining <= 0L) {
                    return WaitResult.TIMED_OUT;
                }
                remaining = changed.awaitNanos(remaining);
            }
            return WaitResult.OK;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Publishes request {@code requestId}: writes its bytes, sets the length and clears the lock word.
     */
    public void beginRequest(int requestId, byte[] request) {
        if (request.length > capacity) {
            throw new BridgeBufferOverflowException(request.length, capacity);
        }
        lock.lock();
        try {
            writeData(request);
            buffer.putInt(Word.LENGTH.offset, request.length);
            buffer.putInt(Word.LOCK.offset, 0);
            activeRequestId = requestId;
        } finally {
            lock.unlock();
        }
    }

    /** Request bytes of {@code requestId}, or {@code null} when its caller already gave up. */
    public byte[] readRequest(int requestId) {
        lock.lock();
        try {
            if (activeRequestId != requestId || buffer.getInt(Word.LOCK.offset) != 0) {
                return null;
            }
            return readData(buffer.getInt(Word.LENGTH.offset));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Writes the reply of {@code requestId} and signals. A reply larger than the buffer is not
     * written: the lock word becomes {@code -requestId} and the length word the required size.
     *
     * @return {@code false} when the request was abandoned and the reply discarded
     */
    public boolean completeRequest(int requestId, byte[] reply) {
        lock.lock();
        try {
            if (activeRequestId != requestId) {
                return false;
            }
            if (reply.length > capacity) {
                store(Word.LENGTH, reply.length);
                store(Word.LOCK, -requestId);
            } else {
                writeData(reply);
                store(Word.LENGTH, reply.length);
                store(Word.LOCK, requestId);
            }
            signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** Marks {@code requestId} as failed on the remote side and signals. */
    public boolean failRequest(int requestId) {
        lock.lock();
        try {
            if (activeRequestId != requestId) {
                return false;
            }
            store(Word.LENGTH, HANDLER_FAILED);
            store(Word.LOCK, -requestId);
            signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** Caller side: stop accepting a reply for {@code requestId}. */
    public void abandon(int requestId) {
        lock.lock();
        try {
            if (activeRequestId == requestId) {
                activeRequestId = 0;
            }
        } finally {
            lock.unlock();
        }
    }

    /** Reads {@code length} bytes of the data region. */
    public byte[] read(int length) {
        lock.lock();
        try {
            return readData(length);
        } finally {
            lock.unlock();
        }
    }

    private void writeData(byte[] bytes) {
        buffer.put(HEADER_BYTES, bytes);
    }

    private byte[] readData(int length) {
        if (length < 0 || length > capacity) {
            throw new BridgeProtocolException("Invalid channel length " + length);
        }
        byte[] out = new byte[length];
        buffer.get(HEADER_BYTES, out);
        return out;
    }
}
