package works.combex.attributes;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

import static java.util.Collections.unmodifiableList;
import static java.util.Comparator.comparing;

/**
 * An immutable list of {@link Attribute}s with unique keys, sorted by key.
 * <p>
 * Sorting is what lets two of these be {@link #merge merged} cheaply and deterministically.
 * Instances are only produced by {@link #sort} (and therefore by {@link AttributeCleaner}),
 * so the invariant always holds.
 */
public final class CleanAttributes implements Iterable<Attribute> {
	private final List<Attribute> attributes;

	private CleanAttributes(List<Attribute> alreadySorted) {
		this.attributes = unmodifiableList(alreadySorted);
	}

	public static CleanAttributes empty() {
		return EMPTY;
	}

	public static CleanAttributes of(Attribute... attributes) {
		return sort(List.of(attributes));
	}

	/**
	 * Sorts by key, keeping only the first-seen attribute for each key.
	 */
	public static CleanAttributes sort(Collection<Attribute> attributes) {
		List<Attribute> sorted = new ArrayList<>(attributes);
		sorted.sort(comparing(Attribute::key)); // Stable, so first-seen stays first
		List<Attribute> unique = new ArrayList<>(sorted.size());
		for (Attribute a: sorted) {
			if (unique.isEmpty() || !unique.get(unique.size() - 1).key().equals(a.key())) {
				unique.add(a);
			}
		}
		return new CleanAttributes(unique);
	}

	/**
	 * Merges two sorted lists in a single pass.
	 * Where both contain the same key, the attribute from {@code this} wins
	 * and the one from {@code other} is dropped.
	 */
	public CleanAttributes merge(CleanAttributes other) {
		if (other.attributes.isEmpty()) {
			return this;
		} else if (this.attributes.isEmpty()) {
			return other;
		}
		List<Attribute> result = new ArrayList<>(attributes.size() + other.attributes.size());
		int i = 0, j = 0;
		while (i < attributes.size() && j < other.attributes.size()) {
			Attribute mine = attributes.get(i);
			Attribute theirs = other.attributes.get(j);
			int cmp = mine.key().compareTo(theirs.key());
			if (cmp < 0) {
				result.add(mine);
				i++;
			} else if (cmp > 0) {
				result.add(theirs);
				j++;
			} else {
				result.add(mine);
				i++;
				j++;
			}
		}
		result.addAll(attributes.subList(i, attributes.size()));
		result.addAll(other.attributes.subList(j, other.attributes.size()));
		return new CleanAttributes(result);
	}

	public Optional<CleanValue> get(String key) {
		return attributes.stream()
			.filter(a -> a.key().equals(key))
			.map(Attribute::value)
			.findFirst();
	}

	public boolean containsKey(String key) {
		return get(key).isPresent();
	}

	public CleanAttributes without(String key) {
		return new CleanAttributes(attributes.stream()
			.filter(a -> !a.key().equals(key))
			.toList());
	}

	/**
	 * Applies {@code f} to every attribute's value, leaving keys (and therefore order) alone.
	 */
	public CleanAttributes mapValues(UnaryOperator<CleanValue> f) {
		return new CleanAttributes(attributes.stream()
			.map(a -> a.withValue(f.apply(a.value())))
			.toList());
	}

	public int size() {
		return attributes.size();
	}

	public boolean isEmpty() {
		return attributes.isEmpty();
	}

	public List<Attribute> asList() {
		return attributes;
	}

	public Stream<Attribute> stream() {
		return attributes.stream();
	}

	/**
	 * @return an insertion-ordered map from key to {@link CleanValue#asObject() plain value}
	 */
	public Map<String, Object> toMap() {
		Map<String, Object> result = new LinkedHashMap<>();
		attributes.forEach(a -> result.put(a.key(), a.value().asObject()));
		return result;
	}

	@Override
	public Iterator<Attribute> iterator() {
		return attributes.iterator();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof CleanAttributes other && attributes.equals(other.attributes);
	}

	@Override
	public int hashCode() {
		return attributes.hashCode();
	}

	@Override
	public String toString() {
		return "CleanAttributes" + attributes;
	}

	private static final CleanAttributes EMPTY = new CleanAttributes(List.of());
}
