package io.vena.probe.exceptions;

import static io.vena.probe.FailureKind.NON_NAVIGABLE_MEMBER;

/**
 * The member path continues past a field that has no declared fields of its own.
 */
@SuppressWarnings("serial")
public class NonNavigableMemberException extends CommandException {
	public NonNavigableMemberException(String message) { super(NON_NAVIGABLE_MEMBER, message); }
	public NonNavigableMemberException(String message, Throwable cause) { super(NON_NAVIGABLE_MEMBER, message, cause); }
}
