package coincidence;

import java.io.InputStream;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;

/**
 * Text extraction and clean up of MediaWiki export pages.
 */
public class WikiText {
	private static Logger logger = Logger.getLogger(WikiText.class.getName());
	private static final String BRACKETS = "\\[[^\\[\\]]*\\]";
	private static final String DOUBLE_BRACKETS = "\\[\\[[^\\[\\]]*\\]\\]";
	private static final String DOUBLE_BRACES = "\\{\\{[^{}]*\\}\\}";
	private static final String EQUAL_SIGNS = "==[^=]*==";

	private static final Pattern MARKUP = Pattern.compile(
			BRACKETS + "|" + DOUBLE_BRACKETS + "|" + DOUBLE_BRACES + "|" + EQUAL_SIGNS);

	private WikiText() {
	}

	/**
	 * Returns the text of the first element whose name ends with "text",
	 * or null when the document has no such element.
	 */
	public static String extractText(InputStream in) throws ArticleRetrievalException {
		XMLInputFactory factory = XMLInputFactory.newInstance();
		factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
		factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
		XMLStreamReader reader = null;
		try {
			reader = factory.createXMLStreamReader(in);
			while (reader.hasNext()) {
				if (reader.next() == XMLStreamConstants.START_ELEMENT
						&& reader.getLocalName().endsWith("text")) {
					return collectText(reader);
				}
			}
			return null;
		} catch (XMLStreamException e) {
			throw new ArticleRetrievalException("malformed export page: " + e.getMessage(), e);
		} finally {
			if (reader != null) {
				try {
					reader.close();
				} catch (XMLStreamException e) {
					logger.log(Level.FINE, "Failed to close export reader", e);
				}
			}
		}
	}

	// text of the current element up to its end or its first child element
	private static String collectText(XMLStreamReader reader) throws XMLStreamException {
		StringBuilder sb = new StringBuilder();
		while (true) {
			if (!reader.hasNext()) {
				throw new XMLStreamException("unexpected end of document");
			}
			switch (reader.next()) {
			case XMLStreamConstants.START_ELEMENT:
			case XMLStreamConstants.END_ELEMENT:
				return sb.toString();
			case XMLStreamConstants.CHARACTERS:
			case XMLStreamConstants.CDATA:
			case XMLStreamConstants.SPACE:
				sb.append(reader.getText());
				break;
			default:
				break;
			}
		}
	}

	/**
	 * Removes [this], [[that]], {{those}} and ==the other==. Their contents
	 * are mostly boilerplate and make for dull common substrings.
	 */
	public static String stripMarkup(String text) {
		return MARKUP.matcher(text).replaceAll("");
	}
}
