package io.github.bluuewhale.chainsmith;

/**
 * Static helpers for mapping int keys onto a fixed bucket table.
 */
final class Hashing {

	private Hashing() {}

	/*
	 * Keys are indexed by their unsigned value, so -1 lands in the last bucket of a power-of-two table
	 * rather than producing a negative index. No smearing: the index must stay a plain remainder.
	 */
	static int bucketIndex(int key, int capacity) {
		return Integer.remainderUnsigned(key, capacity);
	}

	static int checkCapacity(int capacity) {
		if (capacity < 1) {
			throw new IllegalArgumentException("capacity must be >= 1: " + capacity);
		}
		return capacity;
	}
}
