package io.github.bluuewhale.chainsmith;

import java.util.ArrayList;
import java.util.List;
import java.util.SplittableRandom;
import java.util.concurrent.CountDownLatch;

/**
 * A small driver that hammers one map from several worker threads, then prints the map and
 * tears it down once every worker has joined.
 *
 * <p>Usage:
 *   java ... ChainedMapWorkload [threads] [capacity] [opsPerThread] [keySpace] [dump]
 */
public final class ChainedMapWorkload {

	record Config(int threads, int capacity, int opsPerThread, int keySpace, boolean dump) {
		static Config parse(String[] args) {
			int threads = (args.length >= 1) ? Integer.parseInt(args[0]) : 4;
			int capacity = (args.length >= 2) ? Integer.parseInt(args[1]) : 8;
			int ops = (args.length >= 3) ? Integer.parseInt(args[2]) : 100_000;
			int keySpace = (args.length >= 4) ? Integer.parseInt(args[3]) : 64;
			boolean dump = args.length >= 5 && Boolean.parseBoolean(args[4]);
			if (threads < 1) throw new IllegalArgumentException("threads must be >= 1: " + threads);
			if (keySpace < 1) throw new IllegalArgumentException("keySpace must be >= 1: " + keySpace);
			return new Config(threads, capacity, ops, keySpace, dump);
		}
	}

	record Result(long puts, long gets, long removes, long hits, int finalSize, long operationCount, long elapsedNanos) {
		long total() {
			return puts + gets + removes;
		}
	}

	private ChainedMapWorkload() {}

	public static void main(String[] args) throws InterruptedException {
		Config cfg = Config.parse(args);
		try (var map = new ConcurrentChainedIntMap(cfg.capacity())) {
			Result r = run(map, cfg, 42L);
			if (cfg.dump()) System.out.print(map.dump());
			System.out.printf(
				"threads=%d capacity=%d ops=%,d (put %,d / get %,d / remove %,d, hits %,d) size=%d counted=%,d in %.2f ms%n",
				cfg.threads(), cfg.capacity(), r.total(), r.puts(), r.gets(), r.removes(), r.hits(),
				r.finalSize(), r.operationCount(), r.elapsedNanos() / 1_000_000.0
			);
		}
	}

	/**
	 * Runs the workload to completion. Every worker has been joined when this returns, so the map is
	 * quiescent and safe to close.
	 */
	static Result run(ConcurrentChainedIntMap map, Config cfg, long seed) throws InterruptedException {
		var start = new CountDownLatch(1);
		var stats = new long[cfg.threads()][4];
		var failures = new ArrayList<Throwable>();
		List<Thread> workers = new ArrayList<>();

		SplittableRandom root = new SplittableRandom(seed);
		for (int t = 0; t < cfg.threads(); t++) {
			SplittableRandom rnd = root.split();
			long[] s = stats[t];
			Thread w = new Thread(() -> {
				try {
					start.await();
					for (int i = 0; i < cfg.opsPerThread(); i++) {
						int key = rnd.nextInt(cfg.keySpace());
						int op = rnd.nextInt(10);
						if (op < 4) {
							map.put(key, i);
							s[0]++;
						} else if (op < 8) {
							if (map.get(key).isPresent()) s[3]++;
							s[1]++;
						} else {
							if (map.remove(key).isPresent()) s[3]++;
							s[2]++;
						}
					}
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				} catch (RuntimeException e) {
					synchronized (failures) {
						failures.add(e);
					}
				}
			}, "workload-" + t);
			workers.add(w);
			w.start();
		}

		long t0 = System.nanoTime();
		start.countDown();
		for (Thread w : workers) w.join();
		long elapsed = System.nanoTime() - t0;

		if (!failures.isEmpty()) {
			IllegalStateException ex = new IllegalStateException(failures.size() + " worker(s) failed");
			failures.forEach(ex::addSuppressed);
			throw ex;
		}

		long puts = 0, gets = 0, removes = 0, hits = 0;
		for (long[] s : stats) {
			puts += s[0];
			gets += s[1];
			removes += s[2];
			hits += s[3];
		}
		return new Result(puts, gets, removes, hits, map.size(), map.operationCount(), elapsed);
	}
}
