package org.springaicommunity.timeline.collector;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command-line argument parser for the timeline collector. Pure Java with no framework
 * dependencies for testability.
 */
public class ArgumentParser {

	private final CollectorProperties defaultProperties;

	public ArgumentParser(CollectorProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);
		List<String> positional = new ArrayList<>();

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-o", "--output-dir":
					config.outputDir = getRequiredValue(args, i, "output-dir");
					i++;
					break;

				case "-b", "--batch-size":
					config.batchSize = parsePositiveInt(getRequiredValue(args, i, "batch-size"), "batch size");
					i++;
					break;

				case "-m", "--max-posts":
					config.maxPosts = parsePositiveInt(getRequiredValue(args, i, "max-posts"), "max posts");
					i++;
					break;

				case "--api-url":
					config.apiUrl = getRequiredValue(args, i, "api-url");
					i++;
					break;

				case "--no-replies":
					config.includeReplies = false;
					break;

				case "--no-fallback":
					config.fallbackEnabled = false;
					break;

				case "--coverage":
					String coverage = getRequiredValue(args, i, "coverage");
					try {
						config.coverageThreshold = Double.parseDouble(coverage);
					}
					catch (NumberFormatException e) {
						throw new IllegalArgumentException(
								"Invalid coverage '" + coverage + "': must be a number between 0 and 1");
					}
					i++;
					break;

				case "-t", "--types":
					config.postTypes = parsePostTypes(getRequiredValue(args, i, "types"));
					i++;
					break;

				case "--min-likes":
					config.minLikes = parseNonNegativeInt(getRequiredValue(args, i, "min-likes"), "min likes");
					i++;
					break;

				case "--min-reposts":
					config.minReposts = parseNonNegativeInt(getRequiredValue(args, i, "min-reposts"), "min reposts");
					i++;
					break;

				case "--start-date":
					config.startDate = parseDate(getRequiredValue(args, i, "start-date"));
					i++;
					break;

				case "--end-date":
					config.endDate = parseDate(getRequiredValue(args, i, "end-date"));
					i++;
					break;

				case "-x", "--exclude":
					config.excludedKeywords = Arrays.stream(getRequiredValue(args, i, "exclude").split(","))
						.map(String::trim)
						.filter(s -> !s.isEmpty())
						.collect(ArrayList::new, ArrayList::add, ArrayList::addAll);
					i++;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "--debug":
					config.debug = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					positional.add(arg);
					break;
			}
		}

		if (positional.size() > 1) {
			throw new IllegalArgumentException("Expected a single account, got: " + positional);
		}
		if (!positional.isEmpty()) {
			String account = positional.get(0);
			config.account = account.startsWith("@") ? account.substring(1) : account;
		}

		if (!config.helpRequested) {
			validateConfiguration(config);
		}
		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: timeline-collector [OPTIONS] <account>\n");
		help.append("\n");
		help.append("Incrementally collect the posts of an account. Repeated runs only add posts\n");
		help.append("that earlier runs have not collected.\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help              Show this help message\n");
		help.append("    -o, --output-dir DIR    Base directory for history and output (default: ")
			.append(defaultProperties.getOutputDir())
			.append(")\n");
		help.append("    -b, --batch-size SIZE   Records requested per batch (default: ")
			.append(defaultProperties.getBatchSize())
			.append(")\n");
		help.append("    -m, --max-posts COUNT   Maximum new posts per run (default: ")
			.append(defaultProperties.getMaxPosts())
			.append(")\n");
		help.append("    --api-url URL           Base URL of the timeline API (default: $")
			.append(EnvironmentSupport.API_URL)
			.append(")\n");
		help.append("    --no-replies            Skip the reply search pass\n");
		help.append("    --no-fallback           Never run the fallback session\n");
		help.append("    --coverage FRACTION     Run the fallback below this share of the expected posts (default: ")
			.append(defaultProperties.getCoverageThreshold())
			.append(")\n");
		help.append("    -v, --verbose           Enable verbose logging\n");
		help.append("    --debug                 Enable debug logging\n");
		help.append("\n");
		help.append("FILTERING OPTIONS:\n");
		help.append("    -t, --types <types>     Comma-separated post types: original, replies, quotes, reposts\n");
		help.append("                            (default: all)\n");
		help.append("    --min-likes <count>     Minimum likes\n");
		help.append("    --min-reposts <count>   Minimum reposts\n");
		help.append("    --start-date DATE       Only keep posts on or after DATE (YYYY-MM-DD, UTC)\n");
		help.append("    --end-date DATE         Only keep posts on or before DATE (YYYY-MM-DD, UTC)\n");
		help.append("    -x, --exclude <words>   Comma-separated keywords; matching posts are dropped\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES (or .env file):\n");
		help.append("    ").append(EnvironmentSupport.USERNAME).append("       Login username (required)\n");
		help.append("    ").append(EnvironmentSupport.PASSWORD).append("       Login password (required)\n");
		help.append("    ").append(EnvironmentSupport.EMAIL).append("          Email for login challenges\n");
		help.append("    ").append(EnvironmentSupport.API_URL).append("        Base URL of the timeline API\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    timeline-collector some_account\n");
		help.append("    timeline-collector --no-replies --max-posts 2000 some_account\n");
		help.append("    timeline-collector --types original,quotes --min-likes 10 some_account\n");
		help.append("    timeline-collector --start-date 2024-01-01 --exclude giveaway,promo some_account\n");
		help.append("\n");
		return help.toString();
	}

	/**
	 * Validate the environment: credentials and the API URL must be resolvable before
	 * any network activity.
	 * @param config parsed configuration
	 * @return resolved credentials
	 * @throws IllegalStateException if the environment is incomplete
	 */
	public Credentials validateEnvironment(ParsedConfiguration config) {
		Credentials credentials = EnvironmentSupport.credentials()
			.orElseThrow(() -> new IllegalStateException(EnvironmentSupport.USERNAME + " and "
					+ EnvironmentSupport.PASSWORD
					+ " are required. Set them in the environment or in a .env file in the working directory."));
		if (config.apiUrl == null) {
			config.apiUrl = EnvironmentSupport.get(EnvironmentSupport.API_URL);
		}
		if (config.apiUrl == null) {
			throw new IllegalStateException(
					"No API URL configured. Pass --api-url or set " + EnvironmentSupport.API_URL + ".");
		}
		return credentials;
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private static int parsePositiveInt(String value, String name) {
		int parsed = parseNonNegativeInt(value, name);
		if (parsed == 0) {
			throw new IllegalArgumentException("Invalid " + name + " '" + value + "': must be a positive integer");
		}
		return parsed;
	}

	private static int parseNonNegativeInt(String value, String name) {
		try {
			int parsed = Integer.parseInt(value);
			if (parsed < 0) {
				throw new IllegalArgumentException("Invalid " + name + " '" + value + "': must not be negative");
			}
			return parsed;
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid " + name + " '" + value + "': must be an integer");
		}
	}

	private static LocalDate parseDate(String value) {
		try {
			return LocalDate.parse(value);
		}
		catch (DateTimeParseException e) {
			throw new IllegalArgumentException("Invalid date '" + value + "': must be YYYY-MM-DD format");
		}
	}

	private static Set<PostFilterCriteria.PostType> parsePostTypes(String value) {
		Set<PostFilterCriteria.PostType> types = EnumSet.noneOf(PostFilterCriteria.PostType.class);
		for (String token : value.split(",")) {
			String name = token.trim().toUpperCase(Locale.ROOT);
			if (name.isEmpty()) {
				continue;
			}
			try {
				types.add(PostFilterCriteria.PostType.valueOf(name));
			}
			catch (IllegalArgumentException e) {
				throw new IllegalArgumentException("Invalid post type '" + token.trim()
						+ "': must be one of original, replies, quotes, reposts");
			}
		}
		if (types.isEmpty()) {
			throw new IllegalArgumentException("At least one post type is required");
		}
		return types;
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		if (config.account == null || config.account.isBlank()) {
			errors.add("An account is required");
		}
		else if (!config.account.matches("^[A-Za-z0-9_]{1,50}$")) {
			errors.add("Account may only contain letters, digits and underscores (got: " + config.account + ")");
		}

		if (config.batchSize > 1000) {
			errors.add("Batch size too large (got: " + config.batchSize + ", max: 1000)");
		}

		if (config.coverageThreshold < 0 || config.coverageThreshold > 1) {
			errors.add("Coverage must be between 0 and 1 (got: " + config.coverageThreshold + ")");
		}

		if (config.startDate != null && config.endDate != null && config.endDate.isBefore(config.startDate)) {
			errors.add("End date " + config.endDate + " is before start date " + config.startDate);
		}

		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

}
