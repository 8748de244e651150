package org.springaicommunity.timeline.collector;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

import java.util.Optional;

/**
 * Resolves collector credentials and settings by checking a {@code .env} file first,
 * then the system environment. The {@code .env} files are loaded once and cached for the
 * lifetime of the process.
 *
 * <p>
 * Lookup order:
 * <ol>
 * <li>{@code .env} file in the current working directory (if present)</li>
 * <li>System environment variable</li>
 * <li>{@code .env} file in the user's home directory (if present)</li>
 * </ol>
 */
public final class EnvironmentSupport {

	public static final String USERNAME = "TIMELINE_USERNAME";

	public static final String PASSWORD = "TIMELINE_PASSWORD";

	public static final String EMAIL = "TIMELINE_EMAIL";

	public static final String API_URL = "TIMELINE_API_URL";

	private static final Dotenv CWD_DOTENV = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().load();

	private static final Dotenv HOME_DOTENV = loadHomeDotenv();

	private static Dotenv loadHomeDotenv() {
		String home = System.getProperty("user.home");
		if (home != null) {
			return Dotenv.configure().directory(home).ignoreIfMissing().ignoreIfMalformed().load();
		}
		return CWD_DOTENV;
	}

	private EnvironmentSupport() {
	}

	/**
	 * Get an environment variable value.
	 * @param name the variable name
	 * @return the value, or {@code null} if not found or blank
	 */
	@Nullable
	public static String get(String name) {
		String value = CWD_DOTENV.get(name);
		if (value == null || value.isBlank()) {
			value = HOME_DOTENV.get(name);
		}
		return value == null || value.isBlank() ? null : value;
	}

	/**
	 * Resolve the login credentials. Username and password are required; the email is
	 * optional and only used when the source asks for an extra verification step.
	 * @return the credentials, or empty when username or password is missing
	 */
	public static Optional<Credentials> credentials() {
		String username = get(USERNAME);
		String password = get(PASSWORD);
		if (username == null || password == null) {
			return Optional.empty();
		}
		return Optional.of(new Credentials(username, password, get(EMAIL)));
	}

}
