package io.vena.probe;

import java.util.List;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;

import static java.util.Arrays.asList;

/**
 * The part of a command path after the object identifier:
 * one or more field names separated by <code>'.'</code>.
 *
 * <p>
 * Segments are not validated here; an empty or unknown segment
 * simply names no field.
 */
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class MemberPath {
	private final List<String> segments;

	public static MemberPath parse(String dotted) {
		return new MemberPath(asList(dotted.split("\\.", -1)));
	}

	public static MemberPath of(String... segments) {
		if (segments.length == 0) {
			throw new IllegalArgumentException("Member path needs at least one segment");
		}
		return new MemberPath(asList(segments.clone()));
	}

	public String head() {
		return segments.get(0);
	}

	/**
	 * @throws IllegalStateException if {@link #isLeaf()}
	 */
	public MemberPath rest() {
		if (isLeaf()) {
			throw new IllegalStateException("Member path \"" + this + "\" has no remainder");
		}
		return new MemberPath(segments.subList(1, segments.size()));
	}

	/**
	 * @return true if this path names a field directly, with no further navigation
	 */
	public boolean isLeaf() {
		return segments.size() == 1;
	}

	public int length() {
		return segments.size();
	}

	@Override
	public String toString() {
		return String.join(".", segments);
	}
}
