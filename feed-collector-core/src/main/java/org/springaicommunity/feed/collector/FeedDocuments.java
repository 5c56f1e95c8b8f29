package org.springaicommunity.feed.collector;

import org.jdom2.Document;
import org.jdom2.JDOMException;
import org.jdom2.input.SAXBuilder;
import org.xml.sax.InputSource;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringReader;

/**
 * Builds JDOM documents from untrusted feed content.
 *
 * <p>
 * DOCTYPE declarations are accepted (RSS 0.91 feeds commonly carry one) but nothing
 * outside the document is ever read: external DTDs and external entities are not
 * loaded, and any entity resolution yields empty content, as in Rome's
 * {@code WireFeedInput}. Internal entity references are left unexpanded.
 */
final class FeedDocuments {

	private FeedDocuments() {
	}

	static Document parse(InputStream content) throws JDOMException, IOException {
		return newBuilder().build(content);
	}

	static Document parse(Reader content) throws JDOMException, IOException {
		return newBuilder().build(content);
	}

	// SAXBuilder is not thread-safe; one per document
	private static SAXBuilder newBuilder() {
		SAXBuilder builder = new SAXBuilder();
		builder.setExpandEntities(false);
		builder.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
		builder.setFeature("http://xml.org/sax/features/external-general-entities", false);
		builder.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
		builder.setEntityResolver((publicId, systemId) -> new InputSource(new StringReader("")));
		return builder;
	}

}
