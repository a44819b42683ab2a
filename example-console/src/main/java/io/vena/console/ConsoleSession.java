package io.vena.console;

import io.vena.probe.CommandDispatcher;
import io.vena.probe.CommandResult;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads commands one per line and prints one line of output for each.
 * Successful commands print the value; failures print
 * <code>ERROR &lt;kind&gt;: &lt;message&gt;</code>.
 * Blank lines are skipped. Stops at end of input or a line reading <code>quit</code>.
 */
@RequiredArgsConstructor
public final class ConsoleSession {
	public static final String QUIT = "quit";

	private final CommandDispatcher<?> dispatcher;

	/**
	 * @return the number of commands executed
	 */
	public int run(BufferedReader in, PrintWriter out) throws IOException {
		int count = 0;
		String line;
		while ((line = in.readLine()) != null) {
			String command = line.strip();
			if (command.isEmpty()) {
				continue;
			} else if (command.equals(QUIT)) {
				LOGGER.debug("Quit after {} commands", count);
				break;
			}
			out.println(render(dispatcher.execute(command)));
			out.flush();
			++count;
		}
		return count;
	}

	static String render(CommandResult result) {
		if (result.isSuccess()) {
			return result.text();
		} else {
			return "ERROR " + result.failureKind() + ": " + result.message();
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ConsoleSession.class);
}
