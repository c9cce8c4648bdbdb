package sfuzz.model.wgsl;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * The single authority handing out mutation ids for a tree. Ids start at 1 and are never reused, even when mutations
 * are built from several threads.
 */
public class MutationIdGenerator {
	private final AtomicInteger lastId;

	public MutationIdGenerator() {
		this(0);
	}

	/**
	 * @param lastId the highest id already present in the tree being extended
	 */
	public MutationIdGenerator(int lastId) {
		this.lastId = new AtomicInteger(lastId);
	}

	public int next() {
		return lastId.incrementAndGet();
	}
}
