package io.vena.probe;

import io.vena.probe.exceptions.MalformedCommandException;
import java.util.Arrays;
import java.util.List;
import lombok.Value;
import lombok.experimental.Accessors;
import org.jetbrains.annotations.Nullable;

import static java.util.stream.Collectors.toList;

/**
 * A parsed command of the form <code>get id.member[.member...]</code>
 * or <code>set id.member[.member...]=value</code>.
 */
@Value
@Accessors(fluent = true)
public class Command {
	Operation operation;
	String objectId;
	MemberPath memberPath;

	/**
	 * The text to assign; null for {@link Operation#GET}.
	 * May be empty, which is a legitimate value.
	 */
	@Nullable String value;

	public enum Operation { GET, SET }

	public static Command parse(String text) {
		return parse(text, DispatcherSettings.defaults());
	}

	/**
	 * Tokens are separated by whitespace; empty tokens are skipped and any
	 * tokens after the path are ignored. There is no quoting, so neither the
	 * path nor the value can contain whitespace.
	 *
	 * @throws MalformedCommandException if the operation keyword is unknown,
	 * there is no path token, the path has no <code>'.'</code>, or a
	 * <code>set</code> has no <code>'='</code>.
	 */
	public static Command parse(String text, DispatcherSettings settings) {
		if (text == null) {
			throw new MalformedCommandException("Command can't be null");
		}
		List<String> tokens = Arrays.stream(text.split("\\s+"))
			.filter(s -> !s.isEmpty())
			.collect(toList());
		if (tokens.size() < 2) {
			throw new MalformedCommandException("Expected an operation and a path: \"" + text + "\"");
		}

		String keyword = tokens.get(0);
		Operation operation;
		if (keyword.equals(settings.getKeyword())) {
			operation = Operation.GET;
		} else if (keyword.equals(settings.setKeyword())) {
			operation = Operation.SET;
		} else {
			throw new MalformedCommandException("Unknown operation \"" + keyword + "\"");
		}

		String path = tokens.get(1);
		String value = null;
		if (operation == Operation.SET) {
			int eqPos = path.indexOf('=');
			if (eqPos < 0) {
				throw new MalformedCommandException("Expected '=' followed by a value: \"" + path + "\"");
			}
			value = path.substring(eqPos + 1);
			path = path.substring(0, eqPos);
		}

		int dotPos = path.indexOf('.');
		if (dotPos < 0) {
			throw new MalformedCommandException("Expected object.member: \"" + path + "\"");
		}
		return new Command(
			operation,
			path.substring(0, dotPos),
			MemberPath.parse(path.substring(dotPos + 1)),
			value);
	}

	@Override
	public String toString() {
		String base = operation.name().toLowerCase() + " " + objectId + "." + memberPath;
		return (value == null) ? base : base + "=" + value;
	}
}
