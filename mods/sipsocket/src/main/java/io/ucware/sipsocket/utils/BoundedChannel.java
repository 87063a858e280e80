/*
 * Copyright (C) 2024 by the ucware-cli authors
 *
 * This file is part of ucware-cli
 *
 * Licensed under the MIT License (the "License");
 * you may not use this file except in compliance with
 * the License. You may obtain a copy of the License at
 *
 *    https://opensource.org/licenses/MIT
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.ucware.sipsocket.utils;

import java.util.ArrayDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A closable FIFO hand-off between threads.
 *
 * <p>Senders block while the channel is full, receivers block while it is empty. Once closed,
 * sends are refused and receivers drain what is left before observing the end of the channel.
 *
 * <p>An optional change hook runs after every enqueue, dequeue and close, outside the channel's
 * lock, so a single thread can wait on several channels through one {@link Wakeup}.
 *
 * @param <T> The element type
 */
public class BoundedChannel<T> {
  private static final Runnable NO_HOOK = () -> { };

  private final ArrayDeque<T> items = new ArrayDeque<>();
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();
  private final Condition notFull = lock.newCondition();
  private final int capacity;
  private final Runnable onChange;
  private boolean closed;

  public BoundedChannel(final int capacity) {
    this(capacity, NO_HOOK);
  }

  /**
   * @param capacity The maximum number of queued items
   * @param onChange Runs after the content or the state of the channel changed
   */
  public BoundedChannel(final int capacity, final Runnable onChange) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be positive: " + capacity);
    }
    this.capacity = capacity;
    this.onChange = onChange;
  }

  /**
   * Creates a channel whose senders never block.
   *
   * @param <T> The element type
   * @return A new channel
   */
  public static <T> BoundedChannel<T> unbounded() {
    return new BoundedChannel<>(Integer.MAX_VALUE);
  }

  /**
   * Enqueues an item, waiting for room if necessary.
   *
   * @param item The item
   * @return False if the channel is closed
   * @throws InterruptedException if interrupted while waiting for room
   */
  public boolean send(final T item) throws InterruptedException {
    boolean sent;
    lock.lockInterruptibly();
    try {
      while (!closed && items.size() >= capacity) {
        notFull.await();
      }
      sent = enqueue(item);
    } finally {
      lock.unlock();
    }
    return changed(sent);
  }

  /**
   * Enqueues an item if there is room right now.
   *
   * @param item The item
   * @return False if the channel is closed or full
   */
  public boolean offerNow(final T item) {
    boolean sent;
    lock.lock();
    try {
      sent = items.size() < capacity && enqueue(item);
    } finally {
      lock.unlock();
    }
    return changed(sent);
  }

  /**
   * Takes the oldest item, waiting until one is available.
   *
   * @return The item, or null once the channel is closed and empty
   * @throws InterruptedException if interrupted while waiting
   */
  public T receive() throws InterruptedException {
    T item;
    lock.lockInterruptibly();
    try {
      while (!closed && items.isEmpty()) {
        notEmpty.await();
      }
      item = dequeue();
    } finally {
      lock.unlock();
    }
    changed(item != null);
    return item;
  }

  /**
   * Takes the oldest item, waiting at most the given time.
   *
   * @param timeout How long to wait
   * @param unit The unit of the timeout
   * @return The item, or null if none arrived in time or the channel is closed and empty
   * @throws InterruptedException if interrupted while waiting
   */
  public T poll(final long timeout, final TimeUnit unit) throws InterruptedException {
    long nanos = unit.toNanos(timeout);
    T item = null;
    lock.lockInterruptibly();
    try {
      while (!closed && items.isEmpty() && nanos > 0) {
        nanos = notEmpty.awaitNanos(nanos);
      }
      item = dequeue();
    } finally {
      lock.unlock();
    }
    changed(item != null);
    return item;
  }

  /**
   * Takes the oldest item if there is one.
   *
   * @return The item, or null if the channel is empty
   */
  public T pollNow() {
    T item;
    lock.lock();
    try {
      item = dequeue();
    } finally {
      lock.unlock();
    }
    changed(item != null);
    return item;
  }

  public void close() {
    lock.lock();
    try {
      closed = true;
      notEmpty.signalAll();
      notFull.signalAll();
    } finally {
      lock.unlock();
    }
    changed(true);
  }

  public boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }

  public boolean isEmpty() {
    return size() == 0;
  }

  public int size() {
    lock.lock();
    try {
      return items.size();
    } finally {
      lock.unlock();
    }
  }

  private boolean changed(final boolean changed) {
    if (changed) {
      onChange.run();
    }
    return changed;
  }

  private boolean enqueue(final T item) {
    if (closed) {
      return false;
    }
    items.addLast(item);
    notEmpty.signal();
    return true;
  }

  private T dequeue() {
    T item = items.pollFirst();
    if (item != null) {
      notFull.signal();
    }
    return item;
  }
}
