package coincidence;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Downloads two Wikipedia articles and prints their longest common
 * substrings. Most of the wiki markup is filtered out first, the
 * substrings are more interesting without the boilerplate.
 */
public class Coincidence {
	@Parameter(names = {"-t", "--test"}, description = "Run the self test and exit", required = false)
	private boolean test = false;

	@Parameter(names = "-first", description = "Title of the first article, default = random", required = false)
	private String firstTitle;

	@Parameter(names = "-second", description = "Title of the second article, default = random", required = false)
	private String secondTitle;

	@Parameter(names = "-baseUrl", description = "Wiki root, default = https://en.wikipedia.org", required = false)
	private String baseUrl = ArticleFetcher.DEFAULT_BASE_URL;

	@Parameter(names = "-userAgent", description = "User-Agent header, default = coincidence/0.1", required = false)
	private String userAgent = ArticleFetcher.DEFAULT_USER_AGENT;

	@Parameter(names = "-timeout", description = "Connect and read timeout in ms, default = 20000", required = false)
	private int timeoutMs = ArticleFetcher.DEFAULT_TIMEOUT;

	@Parameter(names = "-raw", description = "Keep the wiki markup", required = false)
	private boolean raw = false;

	@Parameter(names = "--help", help = true)
	private boolean help = false;

	private static Logger logger = Logger.getLogger(Coincidence.class.getName());

	public static void main(String args[]) {
		configureLogging();
		System.exit(run(args, System.out, System.err));
	}

	/**
	 * Parses the arguments and does the work. Returns the exit status:
	 * 0 on success, 1 when articles cannot be retrieved or the self test
	 * fails, 2 on bad arguments.
	 */
	static int run(String[] args, PrintStream out, PrintStream err) {
		Coincidence settings = new Coincidence();
		JCommander jc = JCommander.newBuilder().addObject(settings).programName("coincidence").build();
		try {
			jc.parse(args);
		} catch (ParameterException e) {
			err.println("Error: " + e.getMessage());
			StringBuilder usage = new StringBuilder();
			jc.getUsageFormatter().usage(usage);
			err.print(usage);
			return 2;
		}
		if (settings.help) {
			StringBuilder usage = new StringBuilder();
			jc.getUsageFormatter().usage(usage);
			out.print(usage);
			return 0;
		}
		if (settings.test) {
			return settings.selfTest(out);
		}
		settings.timeoutMs = clampTimeout(settings.timeoutMs);
		return settings.compare(out, err);
	}

	// 0 would mean waiting forever on a stalled connection
	static int clampTimeout(int timeoutMs) {
		if (timeoutMs < 1) {
			logger.log(Level.WARNING, "Timeout sets to " + ArticleFetcher.DEFAULT_TIMEOUT + " ms.");
			return ArticleFetcher.DEFAULT_TIMEOUT;
		}
		return timeoutMs;
	}

	private int selfTest(PrintStream out) {
		SelfTest selfTest = new SelfTest();
		int failed = selfTest.run();
		for (String failure : selfTest.getFailures()) {
			out.println("FAILED " + failure);
		}
		if (failed > 0) {
			out.println(String.format("%d check(s) failed.", failed));
			return 1;
		}
		out.println("All checks passed.");
		return 0;
	}

	private int compare(PrintStream out, PrintStream err) {
		ArticleFetcher fetcher = new ArticleFetcher(baseUrl, userAgent, timeoutMs);
		if (firstTitle == null && secondTitle == null) {
			out.println("Requesting two random Wikipedia articles...");
		}
		else if (firstTitle == null || secondTitle == null) {
			out.println("Requesting one named and one random Wikipedia article...");
		}
		else {
			out.println("Requesting two Wikipedia articles...");
		}

		List<String> texts = new ArrayList<String>();
		try {
			for (String title : new String[] {firstTitle, secondTitle}) {
				Article article = title == null ? fetcher.fetchRandom() : fetcher.fetch(title);
				out.println("  Title: " + article.getTitle());
				texts.add(article.getText(raw));
			}
		} catch (ArticleRetrievalException e) {
			logger.log(Level.SEVERE, "Article retrieval failed", e);
			err.println();
			err.println("Error: Unable to retrieve articles, " + e.getMessage());
			return 1;
		}
		logger.log(Level.INFO, String.format("Article lengths: %d and %d characters",
				texts.get(0).length(), texts.get(1).length()));

		out.println("Computing longest common substring(s) in articles...");
		Set<String> found = LongestCommonSubstring.lcs(texts.get(0), texts.get(1));
		if (found.isEmpty()) {
			out.println("No common substring found.");
			return 0;
		}
		for (String s : found) {
			out.println("substring: \"" + escape(s) + "\"");
		}
		return 0;
	}

	static String escape(String s) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			switch (c) {
			case '\n':
				sb.append("\\n");
				break;
			case '\r':
				sb.append("\\r");
				break;
			case '\t':
				sb.append("\\t");
				break;
			case '"':
				sb.append("\\\"");
				break;
			case '\\':
				sb.append("\\\\");
				break;
			default:
				if (c < 0x20) {
					sb.append(String.format("\\u%04x", (int) c));
				}
				else {
					sb.append(c);
				}
			}
		}
		return sb.toString();
	}

	private static void configureLogging() {
		InputStream in = Coincidence.class.getResourceAsStream("/logging.properties");
		if (in == null) {
			return;
		}
		try {
			LogManager.getLogManager().readConfiguration(in);
			in.close();
		} catch (IOException e) {
			logger.log(Level.WARNING, "Unable to read logging.properties", e);
		}
	}
}
