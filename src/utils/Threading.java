package utils;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

public class Threading {

	private static ExecutorService eService;
	private static int numThreads = Runtime.getRuntime().availableProcessors();

	/**
	 * Work item that may fail while reading its input.
	 */
	public interface IOFunction<T, R> {
		R apply(T item) throws IOException;
	}

	public static void execute(Runnable c) {
		Threading.eService.execute(c);
	}

	public static void shutdown() {
		if (Config.VERBOSE)
			System.err.println("Shutting down threading");
		if (Threading.eService != null)
			Threading.eService.shutdown();
	}

	public static void startThreading(int t) {
		Threading.numThreads = t;
		if (Threading.numThreads<2) {
			throw new RuntimeException("Sorry, at least two threads are needed.");
		}
		Threading.eService = Executors.newFixedThreadPool(Threading.numThreads);
		if (Config.VERBOSE)
			System.err.println("There are " + Threading.getNumThreads() + " threads used to run.");
	}

	public static int getNumThreads() {
		return numThreads;
	}

	/**
	 * Applies processor to every item, in chunks on a fixed thread pool, and
	 * returns the results in the order of the items. The first failure of any
	 * chunk is rethrown once all chunks have finished.
	 *
	 * @param <T> The type of items in the list
	 * @param <R> The type of results
	 * @param items The list of items to process
	 * @param processor Function to process each item and return a result
	 * @param threads Number of worker threads; fewer than two runs sequentially
	 */
	public static <T, R> List<R> mapInOrder(List<T> items, IOFunction<T, R> processor, int threads) throws IOException {
		List<R> results = new ArrayList<>();
		if (items.isEmpty()) {
			return results;
		}

		int workers = Math.min(threads, items.size());
		if (workers < 2) {
			// Fallback to sequential processing
			for (T item : items) {
				results.add(processor.apply(item));
			}
			return results;
		}

		startThreading(workers);

		List<R> slots = new ArrayList<>(Collections.<R>nCopies(items.size(), null));
		AtomicReference<Throwable> failure = new AtomicReference<>();
		int chunkSize = (items.size() + workers - 1) / workers;
		CountDownLatch latch = new CountDownLatch(workers);

		for (int i = 0; i < workers; i++) {
			final int startIdx = i * chunkSize;
			final int endIdx = Math.min(startIdx + chunkSize, items.size());
			final int threadId = i;

			if (startIdx >= items.size()) {
				latch.countDown();
				continue;
			}

			execute(() -> {
				try {
					if (Config.VERBOSE) {
						System.err.println("Thread " + threadId + " processing items " + startIdx + " to " + (endIdx-1));
					}
					for (int j = startIdx; j < endIdx && failure.get() == null; j++) {
						slots.set(j, processor.apply(items.get(j)));
					}
				} catch (Throwable e) {
					failure.compareAndSet(null, e);
				} finally {
					latch.countDown();
				}
			});
		}

		try {
			latch.await();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new RuntimeException("Parallel processing was interrupted", e);
		} finally {
			shutdown();
		}

		Throwable t = failure.get();
		if (t instanceof IOException) {
			throw (IOException) t;
		}
		if (t instanceof RuntimeException) {
			throw (RuntimeException) t;
		}
		if (t instanceof Error) {
			throw (Error) t;
		}
		if (t != null) {
			throw new RuntimeException("Parallel processing failed", t);
		}

		results.addAll(slots);
		return results;
	}
}
