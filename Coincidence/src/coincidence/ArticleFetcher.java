package coincidence;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.HttpURLConnection;
import java.net.URI;
import java.net.URL;
import java.net.URLDecoder;
import java.net.URLConnection;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Downloads articles from a MediaWiki site.
 *
 * <p>Special:Random redirects to a random article, the title is the last
 * segment of the URL after the redirect. Special:Export returns the article
 * as XML with less of the boilerplate of the rendered page.
 */
public class ArticleFetcher {
	public static final String DEFAULT_BASE_URL = "https://en.wikipedia.org";
	// Wikipedia rejects the default Java user agent to discourage crawlers
	public static final String DEFAULT_USER_AGENT = "coincidence/0.1";
	public static final int DEFAULT_TIMEOUT = 20000;

	private static final String RANDOM_PATH = "/wiki/Special:Random/";
	private static final String EXPORT_PATH = "/wiki/Special:Export/";

	private String baseUrl;
	private String userAgent;
	private int timeoutMs;
	private Logger logger = Logger.getLogger(ArticleFetcher.class.getName());

	public ArticleFetcher() {
		this(DEFAULT_BASE_URL, DEFAULT_USER_AGENT, DEFAULT_TIMEOUT);
	}

	public ArticleFetcher(String baseUrl, String userAgent, int timeoutMs) {
		if (baseUrl.endsWith("/")) {
			baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
		}
		this.baseUrl = baseUrl;
		this.userAgent = userAgent;
		this.timeoutMs = timeoutMs;
	}

	public Article fetchRandom() throws ArticleRetrievalException {
		String title = resolveRandomTitle();
		return fetch(title);
	}

	public Article fetch(String title) throws ArticleRetrievalException {
		String url = baseUrl + EXPORT_PATH + encodeTitle(title);
		logger.log(Level.FINE, "Exporting " + url);
		HttpURLConnection connection = open(url);
		try {
			checkStatus(connection, url);
			return new Article(title, readBody(connection));
		} catch (IOException e) {
			throw new ArticleRetrievalException(describe(e), e);
		} finally {
			connection.disconnect();
		}
	}

	private String resolveRandomTitle() throws ArticleRetrievalException {
		String url = baseUrl + RANDOM_PATH;
		HttpURLConnection connection = open(url);
		try {
			checkStatus(connection, url);
			String finalUrl = connection.getURL().toString();
			logger.log(Level.FINE, "Random article redirected to " + finalUrl);
			String title = titleFromUrl(finalUrl);
			if (title.isEmpty() || title.startsWith("Special:")) {
				throw new ArticleRetrievalException("no article title in " + finalUrl);
			}
			return title;
		} catch (IOException e) {
			throw new ArticleRetrievalException(describe(e), e);
		} finally {
			connection.disconnect();
		}
	}

	private HttpURLConnection open(String url) throws ArticleRetrievalException {
		URLConnection opened;
		try {
			URL u = URI.create(url).toURL();
			opened = u.openConnection();
		} catch (IOException e) {
			throw new ArticleRetrievalException("bad url " + url, e);
		} catch (IllegalArgumentException e) {
			throw new ArticleRetrievalException("bad url " + url, e);
		}
		if (!(opened instanceof HttpURLConnection)) {
			throw new ArticleRetrievalException("not an http url " + url);
		}
		HttpURLConnection connection = (HttpURLConnection) opened;
		connection.setConnectTimeout(timeoutMs);
		connection.setReadTimeout(timeoutMs);
		connection.setInstanceFollowRedirects(true);
		connection.setRequestProperty("User-Agent", userAgent);
		return connection;
	}

	private void checkStatus(HttpURLConnection connection, String url)
			throws IOException, ArticleRetrievalException {
		int code = connection.getResponseCode();
		if (code != HttpURLConnection.HTTP_OK) {
			throw new ArticleRetrievalException("HTTP " + code + " for " + url);
		}
	}

	private byte[] readBody(HttpURLConnection connection) throws IOException {
		BufferedInputStream in = new BufferedInputStream(connection.getInputStream());
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		try {
			byte[] buf = new byte[8192];
			int n;
			while ((n = in.read(buf)) >= 0) {
				out.write(buf, 0, n);
			}
			return out.toByteArray();
		} finally {
			in.close();
		}
	}

	private static String describe(IOException e) {
		if (e.getMessage() == null) {
			return e.getClass().getSimpleName();
		}
		return e.getMessage();
	}

	/**
	 * Last path segment of an article URL, percent escapes decoded.
	 */
	static String titleFromUrl(String url) throws ArticleRetrievalException {
		try {
			String path = URI.create(url).getRawPath();
			if (path == null) {
				return "";
			}
			String[] sp = path.split("/");
			if (sp.length == 0) {
				return "";
			}
			return URLDecoder.decode(sp[sp.length - 1], StandardCharsets.UTF_8);
		} catch (IllegalArgumentException e) {
			throw new ArticleRetrievalException("malformed article url " + url, e);
		}
	}

	static String encodeTitle(String title) {
		return URLEncoder.encode(title.replace(' ', '_'), StandardCharsets.UTF_8).replace("+", "%20");
	}
}
