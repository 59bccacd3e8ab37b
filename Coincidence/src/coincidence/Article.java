package coincidence;

import java.io.ByteArrayInputStream;

public class Article {
	private String title;
	private byte[] export;

	public Article(String title, byte[] export) {
		this.title = title;
		this.export = export;
	}

	public String getTitle() {
		return title;
	}

	/**
	 * The wikitext of the export page. Markup is removed unless raw is set.
	 */
	public String getText(boolean raw) throws ArticleRetrievalException {
		String text = WikiText.extractText(new ByteArrayInputStream(export));
		if (text == null) {
			throw new ArticleRetrievalException("no text element in export of " + title);
		}
		if (raw) {
			return text;
		}
		return WikiText.stripMarkup(text);
	}

	public String getText() throws ArticleRetrievalException {
		return getText(false);
	}
}
