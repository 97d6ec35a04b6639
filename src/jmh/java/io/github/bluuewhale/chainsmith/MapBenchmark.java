package io.github.bluuewhale.chainsmith;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntMaps;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.TearDown;
import org.openjdk.jmh.annotations.Threads;
import org.openjdk.jmh.annotations.Warmup;

/**
 * Shared-map throughput of the chained map against a {@link ConcurrentHashMap} and a
 * globally synchronized fastutil map. All benchmarks run with several threads on one map.
 */
@Warmup(iterations = 3)
@Measurement(iterations = 5)
@Threads(4)
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
public class MapBenchmark {

	@State(Scope.Benchmark)
	public static class SharedState {
		@Param({ "1000", "100000" })
		int size;

		@Param({ "64", "4096" })
		int capacity;

		ConcurrentChainedIntMap chained;
		ConcurrentHashMap<Integer, Integer> chm;
		Int2IntMap fastutil;
		int[] keys;
		int[] misses;

		@Setup(Level.Iteration)
		public void setup() {
			var rnd = new Random(123);
			keys = new int[size];
			misses = new int[size];
			Set<Integer> keySet = new HashSet<>(size * 2);
			for (int i = 0; i < size; i++) {
				int k = rnd.nextInt();
				keys[i] = k;
				keySet.add(k);
			}
			for (int i = 0; i < size; i++) {
				int miss;
				do { miss = rnd.nextInt(); } while (keySet.contains(miss));
				misses[i] = miss;
			}
			chained = new ConcurrentChainedIntMap(capacity);
			chm = new ConcurrentHashMap<>(capacity);
			fastutil = Int2IntMaps.synchronize(new Int2IntOpenHashMap(capacity));
			fastutil.defaultReturnValue(-1);
			for (int i = 0; i < size; i++) {
				chained.put(keys[i], i);
				chm.put(keys[i], i);
				fastutil.put(keys[i], i);
			}
		}

		@TearDown(Level.Iteration)
		public void tearDown() {
			chained.close();
		}

		int nextKey() { return keys[ThreadLocalRandom.current().nextInt(keys.length)]; }
		int nextMiss() { return misses[ThreadLocalRandom.current().nextInt(misses.length)]; }
	}

	// ------- get hit/miss -------
	@Benchmark
	public int chainedGetHit(SharedState s) {
		return s.chained.getOrDefault(s.nextKey(), -1);
	}

	@Benchmark
	public int chmGetHit(SharedState s) {
		return s.chm.getOrDefault(s.nextKey(), -1);
	}

	@Benchmark
	public int fastutilGetHit(SharedState s) {
		return s.fastutil.get(s.nextKey());
	}

	@Benchmark
	public int chainedGetMiss(SharedState s) {
		return s.chained.getOrDefault(s.nextMiss(), -1);
	}

	@Benchmark
	public int chmGetMiss(SharedState s) {
		return s.chm.getOrDefault(s.nextMiss(), -1);
	}

	@Benchmark
	public int fastutilGetMiss(SharedState s) {
		return s.fastutil.get(s.nextMiss());
	}

	// ------- put hit (update in place) -------
	@Benchmark
	public int chainedPutHit(SharedState s) {
		return s.chained.put(s.nextKey(), 7).orElse(-1);
	}

	@Benchmark
	public int chmPutHit(SharedState s) {
		Integer prev = s.chm.put(s.nextKey(), 7);
		return prev == null ? -1 : prev;
	}

	@Benchmark
	public int fastutilPutHit(SharedState s) {
		return s.fastutil.put(s.nextKey(), 7);
	}

	// ------- remove + reinsert (keeps the population stable) -------
	@Benchmark
	public int chainedRemoveReinsert(SharedState s) {
		int k = s.nextKey();
		int v = s.chained.remove(k).orElse(-1);
		s.chained.put(k, v);
		return v;
	}

	@Benchmark
	public int chmRemoveReinsert(SharedState s) {
		int k = s.nextKey();
		Integer prev = s.chm.remove(k);
		int v = prev == null ? -1 : prev;
		s.chm.put(k, v);
		return v;
	}

	@Benchmark
	public int fastutilRemoveReinsert(SharedState s) {
		int k = s.nextKey();
		int v = s.fastutil.remove(k);
		s.fastutil.put(k, v);
		return v;
	}
}
