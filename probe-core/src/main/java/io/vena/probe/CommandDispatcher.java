package io.vena.probe;

import io.vena.probe.exceptions.CommandException;
import io.vena.probe.exceptions.ConversionFailedException;
import io.vena.probe.exceptions.MemberNotFoundException;
import io.vena.probe.exceptions.NonNavigableMemberException;
import io.vena.probe.exceptions.ObjectNotFoundException;
import java.util.Map;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Carries out text commands against the objects registered for one root type.
 *
 * <p>
 * A command names an object by its {@link Identifier}, then a field by a dotted
 * {@link MemberPath}. Every segment but the last must name a navigable field; the
 * dispatcher descends into that field's current value and reflects it in turn.
 * Nested objects are reached only through their containing object, never through
 * their own registry.
 *
 * <p>
 * No input makes the dispatcher throw. Bad commands, unknown objects or members,
 * and unparseable values all produce a failed {@link CommandResult}, and are
 * logged if {@link DispatcherSettings#logFailures()} is set.
 *
 * <p>
 * Like {@link ObjectRegistry}, not thread-safe.
 */
@Accessors(fluent = true)
public final class CommandDispatcher<R> {
	private final ObjectRegistry<R> registry;
	@Getter
	private final DispatcherSettings settings;

	private CommandDispatcher(ObjectRegistry<R> registry, DispatcherSettings settings) {
		settings.validate();
		this.registry = registry;
		this.settings = settings;
	}

	public static <R extends Reflectable<R>> CommandDispatcher<R> forRootType(Class<R> rootType) {
		return forRootType(rootType, DispatcherSettings.defaults());
	}

	public static <R extends Reflectable<R>> CommandDispatcher<R> forRootType(Class<R> rootType, DispatcherSettings settings) {
		return new CommandDispatcher<>(ObjectRegistry.forType(rootType), settings);
	}

	/**
	 * For root objects that are registered explicitly rather than by extending {@link Reflectable}.
	 */
	public static <R> CommandDispatcher<R> forRegistry(ObjectRegistry<R> registry, DispatcherSettings settings) {
		return new CommandDispatcher<>(registry, settings);
	}

	/**
	 * @return the text of the value that was read or written, or the
	 * empty string if the command failed for any reason.
	 * Use {@link #execute(String)} to tell failure apart from an empty value.
	 */
	public String parseAndExecute(String command) {
		return execute(command).textOrEmpty();
	}

	public CommandResult execute(String commandText) {
		try {
			Command command = Command.parse(commandText, settings);
			return CommandResult.success(execute(command));
		} catch (CommandException e) {
			logFailure(commandText, e);
			return CommandResult.failure(e.kind(), e.getMessage());
		} catch (RuntimeException e) {
			LOGGER.error("Unexpected exception executing \"{}\"", commandText, e);
			return CommandResult.failure(FailureKind.INTERNAL_ERROR, String.valueOf(e.getMessage()));
		}
	}

	/**
	 * @return the text of the value that was read or written
	 * @throws CommandException if the command could not be carried out
	 */
	public String execute(Command command) {
		if (!Identifier.isValid(command.objectId())) {
			throw new ObjectNotFoundException("Object not found: \"" + command.objectId() + "\"");
		}
		R root = registry.lookup(Identifier.from(command.objectId()))
			.orElseThrow(() -> new ObjectNotFoundException("Object not found: \"" + command.objectId() + "\""));
		FieldAccessor target = resolve(root, command.memberPath());
		switch (command.operation()) {
			case GET:
				return target.getText();
			case SET:
				String value = command.value();
				if (target.setText(value)) {
					return value;
				} else {
					throw new ConversionFailedException("Can't assign \"" + value + "\" to " + target.type().getSimpleName() + " member \"" + command.memberPath() + "\"");
				}
			default:
				throw new AssertionError("Unexpected operation: " + command.operation());
		}
	}

	/**
	 * Walks <code>path</code> from <code>root</code> to the accessor for its last segment.
	 *
	 * @throws MemberNotFoundException if a segment names no declared field,
	 * or an intermediate field holds null
	 * @throws NonNavigableMemberException if an intermediate field has no declared fields
	 */
	public static FieldAccessor resolve(Object root, MemberPath path) {
		Object current = root;
		MemberPath remaining = path;
		while (!remaining.isLeaf()) {
			FieldAccessor step = member(current, remaining.head());
			if (!step.isNavigable()) {
				throw new NonNavigableMemberException("Member \"" + remaining.head() + "\" of " + current.getClass().getSimpleName() + " has no members");
			}
			Object container = current;
			current = step.value().orElseThrow(() ->
				new MemberNotFoundException("Member \"" + step.name() + "\" of " + container.getClass().getSimpleName() + " is null"));
			remaining = remaining.rest();
		}
		return member(current, remaining.head());
	}

	private static FieldAccessor member(Object object, String name) {
		Map<String, FieldAccessor> members = Reflector.reflect(object);
		FieldAccessor result = members.get(name);
		if (result == null) {
			throw new MemberNotFoundException("Member not found: \"" + name + "\" in " + object.getClass().getSimpleName());
		}
		return result;
	}

	private void logFailure(String commandText, CommandException e) {
		if (!settings.logFailures()) {
			return;
		}
		switch (e.kind()) {
			case OBJECT_NOT_FOUND:
			case MEMBER_NOT_FOUND:
				LOGGER.warn("{}", e.getMessage());
				break;
			default:
				LOGGER.debug("Command \"{}\" failed: {}", commandText, e.getMessage());
				break;
		}
	}

	@Override
	public String toString() {
		return "CommandDispatcher(" + registry.type().getSimpleName() + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(CommandDispatcher.class);
}
