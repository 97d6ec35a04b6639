package io.github.bluuewhale.chainsmith;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.OptionalInt;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Fixed-capacity int-to-int map guarded by one lock per bucket.
 *
 * Design notes:
 * - Capacity never changes, so a key always maps to the same bucket and that bucket's lock
 *   serializes every operation on the key. Operations on different buckets never block each other.
 * - No operation holds more than one bucket lock at a time.
 * - {@link #size()} is updated while holding the lock of the bucket whose chain changed.
 * - {@link #operationCount()} is observability only and may lag under contention.
 * - {@link #dump()} takes no locks; under concurrent writers it may print a torn snapshot.
 *
 * Absent keys are reported with {@link OptionalInt#empty()} rather than a sentinel value,
 * so every int is a legal key and a legal value.
 */
public final class ConcurrentChainedIntMap implements AutoCloseable {

	private static final Logger log = Logger.getLogger(ConcurrentChainedIntMap.class.getName());

	/* Defaults */
	public static final int DEFAULT_CAPACITY = 16;

	/**
	 * Chain node. Exactly one predecessor (bucket head or previous node) references it.
	 * Links and values are volatile only so that the lock-free dump sees fully built nodes;
	 * every write happens under the bucket lock.
	 */
	private static final class Node {
		final int key;
		volatile int value;
		volatile Node next;

		Node(int key, int value) {
			this.key = key;
			this.value = value;
		}
	}

	private static final class Bucket {
		final ReentrantLock lock = new ReentrantLock();
		volatile Node head;
	}

	/* Storage */
	private final Bucket[] buckets;
	private final AtomicInteger size = new AtomicInteger();
	private final LongAdder operationCount = new LongAdder();
	private final AtomicBoolean closed = new AtomicBoolean();

	public ConcurrentChainedIntMap() {
		this(DEFAULT_CAPACITY);
	}

	public ConcurrentChainedIntMap(int capacity) {
		Hashing.checkCapacity(capacity);
		Bucket[] table = new Bucket[capacity];
		for (int i = 0; i < capacity; i++) table[i] = new Bucket();
		this.buckets = table;
		log.fine(() -> "Created map with " + capacity + " buckets");
	}

	/* ------------ Map API ------------ */

	/**
	 * Returns the value mapped to {@code key}, or empty if the key is absent.
	 *
	 * @throws IllegalStateException if the map has been closed
	 */
	public OptionalInt get(int key) {
		Bucket b = lockBucket(key);
		try {
			Node e = find(b, key);
			return (e == null) ? OptionalInt.empty() : OptionalInt.of(e.value);
		} finally {
			release(b);
		}
	}

	public int getOrDefault(int key, int defaultValue) {
		Bucket b = lockBucket(key);
		try {
			Node e = find(b, key);
			return (e == null) ? defaultValue : e.value;
		} finally {
			release(b);
		}
	}

	public boolean containsKey(int key) {
		Bucket b = lockBucket(key);
		try {
			return find(b, key) != null;
		} finally {
			release(b);
		}
	}

	/**
	 * Maps {@code key} to {@code value}. An existing entry is updated in place; a new entry is
	 * appended to the tail of the bucket's chain.
	 *
	 * @return the previous value, or empty if the key was absent
	 * @throws IllegalStateException if the map has been closed
	 */
	public OptionalInt put(int key, int value) {
		Bucket b = lockBucket(key);
		try {
			Node tail = null;
			for (Node e = b.head; e != null; e = e.next) {
				if (e.key == key) {
					int old = e.value;
					e.value = value;
					return OptionalInt.of(old);
				}
				tail = e;
			}
			// Allocated before any link changes: a failed allocation leaves the chain intact.
			Node created = new Node(key, value);
			if (tail == null) {
				b.head = created;
			} else {
				tail.next = created;
			}
			size.incrementAndGet();
			return OptionalInt.empty();
		} finally {
			release(b);
		}
	}

	/**
	 * Removes the entry for {@code key}.
	 *
	 * @return the removed value, or empty if the key was absent
	 * @throws IllegalStateException if the map has been closed
	 */
	public OptionalInt remove(int key) {
		Bucket b = lockBucket(key);
		try {
			Node prev = null;
			for (Node e = b.head; e != null; e = e.next) {
				if (e.key == key) {
					unlink(b, prev, e);
					size.decrementAndGet();
					return OptionalInt.of(e.value);
				}
				prev = e;
			}
			return OptionalInt.empty();
		} finally {
			release(b);
		}
	}

	public int size() {
		return size.get();
	}

	public boolean isEmpty() {
		return size() == 0;
	}

	public int capacity() {
		return buckets.length;
	}

	/** Number of completed lookup, put and remove calls. Approximate while calls are in flight. */
	public long operationCount() {
		return operationCount.sum();
	}

	public boolean isClosed() {
		return closed.get();
	}

	/* ------------ Diagnostics ------------ */

	/**
	 * Renders every bucket in index order, one line per bucket: {@code [i] -> (k,v) -> (k,v)}.
	 *
	 * <p>Takes no locks. With concurrent writers the output can mix states from different moments
	 * and must not be used to reason about consistency.
	 */
	public String dump() {
		StringBuilder sb = new StringBuilder();
		dump(sb);
		return sb.toString();
	}

	public void dump(Appendable out) {
		ensureOpen();
		try {
			for (int i = 0; i < buckets.length; i++) {
				out.append('[').append(Integer.toString(i)).append("] -> ");
				Node e = buckets[i].head;
				while (e != null) {
					out.append('(')
						.append(Integer.toString(e.key))
						.append(',')
						.append(Integer.toString(e.value))
						.append(')');
					e = e.next;
					if (e != null) out.append(" -> ");
				}
				out.append('\n');
			}
		} catch (IOException ex) {
			throw new UncheckedIOException("Failed to write map dump", ex);
		}
	}

	/* ------------ Lifecycle ------------ */

	/**
	 * Releases every entry and rejects all later lookups and mutations.
	 *
	 * <p>Buckets are swept one at a time under their own lock. A call that already holds a bucket
	 * lock finishes before that bucket is swept; a call that acquires the lock afterwards fails
	 * with {@link IllegalStateException}. Closing twice is a no-op.
	 */
	@Override
	public void close() {
		if (!closed.compareAndSet(false, true)) return;
		int released = 0;
		for (Bucket b : buckets) {
			b.lock.lock();
			try {
				int n = 0;
				Node e = b.head;
				b.head = null;
				while (e != null) {
					Node next = e.next;
					e.next = null;
					e = next;
					n++;
				}
				size.addAndGet(-n);
				released += n;
			} finally {
				b.lock.unlock();
			}
		}
		int total = released;
		log.fine(() -> "Closed map: released " + total + " entries from " + buckets.length + " buckets");
	}

	@Override
	public String toString() {
		return "ConcurrentChainedIntMap{capacity=" + buckets.length
			+ ", size=" + size()
			+ ", operations=" + operationCount()
			+ (isClosed() ? ", closed" : "")
			+ '}';
	}

	/* ------------ Internal helpers ------------ */

	private Bucket lockBucket(int key) {
		Bucket b = buckets[Hashing.bucketIndex(key, buckets.length)];
		b.lock.lock();
		if (closed.get()) {
			b.lock.unlock();
			throw new IllegalStateException("map is closed");
		}
		return b;
	}

	private void release(Bucket b) {
		operationCount.increment();
		b.lock.unlock();
	}

	private void ensureOpen() {
		if (closed.get()) throw new IllegalStateException("map is closed");
	}

	private static Node find(Bucket b, int key) {
		for (Node e = b.head; e != null; e = e.next) {
			if (e.key == key) return e;
		}
		return null;
	}

	private static void unlink(Bucket b, Node prev, Node e) {
		if (prev == null) {
			b.head = e.next;
		} else {
			prev.next = e.next;
		}
		e.next = null;
	}
}
