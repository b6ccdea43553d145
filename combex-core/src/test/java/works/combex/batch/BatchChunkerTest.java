package works.combex.batch;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatchChunkerTest {
	@Test
	void emptyInput_noBatches() {
		assertEquals(List.of(), BatchChunker.withDefaultLimits().chunk(List.of()));
	}

	@Test
	void body_isJsonArray() {
		Batch batch = new Batch(List.of(bytes("{\"a\":1}"), bytes("{\"b\":2}")));
		assertArrayEquals(bytes("[{\"a\":1},{\"b\":2}]"), batch.body());
		assertEquals(batch.body().length, batch.encodedLength());
	}

	@Test
	void batchesRespectCeilingAndPreserveOrder() {
		BatchChunker chunker = new BatchChunker(100, 250, Integer.MAX_VALUE);
		Random random = new Random(123);
		List<byte[]> events = new ArrayList<>();
		for (int i = 0; i < 200; i++) {
			events.add(bytes("x".repeat(1 + random.nextInt(100))));
		}
		List<Batch> batches = chunker.chunk(events);

		List<byte[]> flattened = new ArrayList<>();
		for (Batch batch : batches) {
			assertTrue(batch.encodedLength() <= 250, "Batch too long: " + batch.encodedLength());
			assertEquals(batch.encodedLength(), batch.body().length);
			flattened.addAll(batch.events());
		}
		assertEquals(events, flattened);
	}

	@Test
	void exactFit_staysInOneBatch() {
		// [aaa,bbb] is 9 bytes
		BatchChunker chunker = new BatchChunker(3, 9, Integer.MAX_VALUE);
		assertEquals(1, chunker.chunk(List.of(bytes("aaa"), bytes("bbb"))).size());
		assertEquals(2, new BatchChunker(3, 8, Integer.MAX_VALUE).chunk(List.of(bytes("aaa"), bytes("bbb"))).size());
	}

	@Test
	void oversizedEvents_areDropped() {
		BatchChunker chunker = new BatchChunker(5, 100, Integer.MAX_VALUE);
		List<Batch> batches = chunker.chunk(List.of(bytes("small"), bytes("too large"), bytes("fine")));
		assertEquals(1, batches.size());
		assertEquals(List.of("small", "fine"), strings(batches.get(0)));
	}

	@Test
	void onlyOversizedEvents_noBatches() {
		assertEquals(List.of(), new BatchChunker(2, 100, Integer.MAX_VALUE).chunk(List.of(bytes("big"))));
	}

	@Test
	void eventCountCap_splitsBatches() {
		BatchChunker chunker = new BatchChunker(10, 1000, 2);
		List<Batch> batches = chunker.chunk(List.of(bytes("1"), bytes("2"), bytes("3"), bytes("4"), bytes("5")));
		assertEquals(List.of(2, 2, 1), batches.stream().map(Batch::size).toList());
	}

	@Test
	void eventLimitMustFitInBatch() {
		assertThrows(IllegalArgumentException.class, () -> new BatchChunker(99, 100, 1));
		assertThrows(IllegalArgumentException.class, () -> new Batch(List.of()));
	}

	private static byte[] bytes(String s) {
		return s.getBytes(UTF_8);
	}

	private static List<String> strings(Batch batch) {
		return batch.events().stream().map(b -> new String(b, UTF_8)).toList();
	}
}
