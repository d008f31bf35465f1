package org.proxml.xml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import org.apache.log4j.Logger;
import org.proxml.io.LineIndex;

/**
 * <p>
 * Parses XML into an element tree plus a normalized text, the concatenation of all character data in the document without the
 * whitespace used to lay out the markup. Every piece of the normalized text is mapped to the exact range of the source text it was copied
 * from, so that tools working on the normalized text can report positions in the original document.
 * </p>
 * <p>
 * Instances are immutable. Each parse owns all of its state, so one parser may be used for any number of documents, concurrently.
 * </p>
 */
public class ProvenanceXmlParser {
	private static final Logger log = Logger.getLogger(ProvenanceXmlParser.class);

	private static final char BYTE_ORDER_MARK = '\uFEFF';

	private final XmlParseConfig theConfig;

	/** Creates a parser with the {@link XmlParseConfig#DEFAULT default} configuration */
	public ProvenanceXmlParser() {
		this(XmlParseConfig.DEFAULT);
	}

	/** @param config The configuration for the parser */
	public ProvenanceXmlParser(XmlParseConfig config) {
		if (config == null)
			throw new NullPointerException("config");
		theConfig = config;
	}

	/** @return This parser's configuration */
	public XmlParseConfig getConfig() {
		return theConfig;
	}

	/**
	 * @param data The UTF-8-encoded XML to parse
	 * @return The parse result
	 */
	public XmlParseResult parse(byte[] data) {
		return parse(new String(data, StandardCharsets.UTF_8));
	}

	/**
	 * @param in The stream of UTF-8-encoded XML to parse. The stream is read to its end but not closed.
	 * @return The parse result
	 * @throws IOException If the stream could not be read
	 */
	public XmlParseResult parse(InputStream in) throws IOException {
		return parse(in.readAllBytes());
	}

	/**
	 * @param xml The XML text to parse. A leading byte order mark is not considered part of the text.
	 * @return The parse result
	 */
	public XmlParseResult parse(String xml) {
		String sourceText = !xml.isEmpty() && xml.charAt(0) == BYTE_ORDER_MARK ? xml.substring(1) : xml;
		LineIndex lineIndex = new LineIndex(sourceText);
		if (log.isDebugEnabled())
			log.debug("Parsing " + lineIndex + " with " + theConfig);
		ParseSession session = new ParseSession(sourceText, lineIndex, theConfig);
		new SaxEventSource(sourceText, lineIndex, session).scan();
		return session.finish();
	}
}
