package coincidence;

/**
 * An article could not be downloaded or its text could not be found.
 */
public class ArticleRetrievalException extends Exception {
	private static final long serialVersionUID = 1L;

	public ArticleRetrievalException(String message) {
		super(message);
	}

	public ArticleRetrievalException(String message, Throwable cause) {
		super(message, cause);
	}
}
