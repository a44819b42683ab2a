package io.vena.probe.exceptions;

import static io.vena.probe.FailureKind.MEMBER_NOT_FOUND;

@SuppressWarnings("serial")
public class MemberNotFoundException extends CommandException {
	public MemberNotFoundException(String message) { super(MEMBER_NOT_FOUND, message); }
	public MemberNotFoundException(String message, Throwable cause) { super(MEMBER_NOT_FOUND, message, cause); }
}
