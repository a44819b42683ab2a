package io.vena.probe;

/**
 * Why a command produced no result.
 */
public enum FailureKind {
	/**
	 * Unknown operation keyword, too few tokens, no <code>'.'</code> in the path,
	 * or no <code>'='</code> in a <code>set</code>.
	 */
	MALFORMED_COMMAND,

	/**
	 * No object is registered under the path's leading identifier.
	 */
	OBJECT_NOT_FOUND,

	/**
	 * A path segment names no declared field.
	 */
	MEMBER_NOT_FOUND,

	/**
	 * The path continues past a leaf field.
	 */
	NON_NAVIGABLE_MEMBER,

	/**
	 * The path ends at a nested field that has no codec.
	 */
	NOT_A_LEAF,

	/**
	 * The field's codec rejected the text given to <code>set</code>.
	 */
	CONVERSION_FAILURE,

	/**
	 * Something unexpected went wrong, such as a codec throwing an unchecked exception.
	 */
	INTERNAL_ERROR,
}
