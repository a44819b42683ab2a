package io.vena.console;

import io.vena.console.state.DemoObject;
import io.vena.probe.CommandDispatcher;
import io.vena.probe.DispatcherSettings;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Registers a demo object as <code>test_object</code> and runs a
 * {@link ConsoleSession} on stdin and stdout.
 *
 * <p>
 * The system properties <code>probe.get</code> and <code>probe.set</code>
 * replace the operation keywords.
 */
public final class ConsoleMain {
	public static final String DEMO_ID = "test_object";

	public static void main(String[] args) throws IOException {
		DispatcherSettings settings = settingsFromSystemProperties();
		CommandDispatcher<DemoObject> dispatcher = CommandDispatcher.forRootType(DemoObject.class, settings);
		try (DemoObject demo = new DemoObject(DEMO_ID)) {
			LOGGER.info("Registered {}; enter \"{} {}.a\" or \"{} {}.d.b=value\", or {} to exit",
				demo, settings.getKeyword(), DEMO_ID, settings.setKeyword(), DEMO_ID, ConsoleSession.QUIT);
			BufferedReader in = new BufferedReader(new InputStreamReader(System.in, UTF_8));
			PrintWriter out = new PrintWriter(System.out, true, UTF_8);
			int count = new ConsoleSession(dispatcher).run(in, out);
			LOGGER.info("Executed {} commands", count);
		}
	}

	static DispatcherSettings settingsFromSystemProperties() {
		DispatcherSettings.DispatcherSettingsBuilder builder = DispatcherSettings.builder();
		String getKeyword = System.getProperty("probe.get");
		if (getKeyword != null) {
			builder.getKeyword(getKeyword);
		}
		String setKeyword = System.getProperty("probe.set");
		if (setKeyword != null) {
			builder.setKeyword(setKeyword);
		}
		return builder.build();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ConsoleMain.class);
}
