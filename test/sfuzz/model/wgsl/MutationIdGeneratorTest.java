package sfuzz.model.wgsl;

import org.junit.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.Assert.*;

public class MutationIdGeneratorTest {

	@Test
	public void startsAtOne() {
		MutationIdGenerator generator = new MutationIdGenerator();
		assertEquals(1, generator.next());
		assertEquals(2, generator.next());
		assertEquals(3, generator.next());
	}

	@Test
	public void continuesAfterExistingIds() {
		MutationIdGenerator generator = new MutationIdGenerator(41);
		assertEquals(42, generator.next());
	}

	@Test
	public void uniqueAcrossThreads() throws Exception {
		MutationIdGenerator generator = new MutationIdGenerator();
		ExecutorService executor = Executors.newFixedThreadPool(4);
		try {
			List<Future<List<Integer>>> futures = new ArrayList<>();
			for (int i = 0; i < 4; i++) {
				futures.add(executor.submit(() -> {
					List<Integer> ids = new ArrayList<>();
					for (int j = 0; j < 1000; j++) {
						ids.add(generator.next());
					}
					return ids;
				}));
			}
			Set<Integer> seen = new HashSet<>();
			for (Future<List<Integer>> future : futures) {
				for (int id : future.get()) {
					assertTrue("duplicate id " + id, seen.add(id));
				}
			}
			assertEquals(4000, seen.size());
		} finally {
			executor.shutdownNow();
		}
	}
}
