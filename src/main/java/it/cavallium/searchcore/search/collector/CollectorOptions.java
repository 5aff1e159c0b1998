package it.cavallium.searchcore.search.collector;

import io.soabase.recordbuilder.core.RecordBuilder;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * @param size                number of hits to return
 * @param skip                number of best hits to skip
 * @param sort                order of the hits
 * @param fields              stored fields to load for each returned hit, {@link #ALL_FIELDS} loads every field
 * @param timeout             maximum duration of the collection, null to never time out
 * @param maxMemoryBytes      maximum memory usage of the query, 0 for no limit
 * @param memoryCheckInterval number of hits between two memory and timeout checks
 */
@RecordBuilder
public record CollectorOptions(int size,
															 int skip,
															 SortOrder sort,
															 List<String> fields,
															 @Nullable Duration timeout,
															 long maxMemoryBytes,
															 int memoryCheckInterval) {

	public static final String ALL_FIELDS = "*";
	public static final int DEFAULT_MEMORY_CHECK_INTERVAL = 1024;

	public CollectorOptions {
		if (size < 0) {
			throw new IllegalArgumentException("Size must not be negative, got " + size);
		}
		if (skip < 0) {
			throw new IllegalArgumentException("Skip must not be negative, got " + skip);
		}
		if (maxMemoryBytes < 0) {
			throw new IllegalArgumentException("Memory limit must not be negative, got " + maxMemoryBytes);
		}
		if (sort == null) {
			sort = SortOrder.BY_SCORE;
		}
		fields = fields == null ? List.of() : List.copyOf(fields);
		if (memoryCheckInterval <= 0) {
			memoryCheckInterval = DEFAULT_MEMORY_CHECK_INTERVAL;
		}
	}

	public static CollectorOptions top(int size) {
		return new CollectorOptions(size, 0, SortOrder.BY_SCORE, List.of(), null, 0, DEFAULT_MEMORY_CHECK_INTERVAL);
	}

	public boolean loadsField(String field) {
		return fields.contains(ALL_FIELDS) || fields.contains(Objects.requireNonNull(field));
	}
}
