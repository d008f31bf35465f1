package org.proxml.xml;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

import org.apache.log4j.Logger;
import org.jdom2.JDOMException;
import org.jdom2.input.sax.XMLReaderJDOMFactory;
import org.jdom2.input.sax.XMLReaderSAX2Factory;
import org.proxml.io.FilePosition;
import org.proxml.io.LineIndex;
import org.xml.sax.Attributes;
import org.xml.sax.InputSource;
import org.xml.sax.Locator;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;
import org.xml.sax.XMLReader;
import org.xml.sax.ext.DefaultHandler2;

/**
 * <p>
 * Scans an XML text with the platform's SAX parser and feeds the resulting {@link ScannerEvent events} to a consumer.
 * </p>
 * <p>
 * SAX reports positions through its {@link Locator}, which points just past the last character the parser has consumed. This class
 * translates those positions into the convention of {@link ScannerEvent}:
 * </p>
 * <ul>
 * <li>Markup events are reported at the final '&gt;' of the markup, one column before the locator.</li>
 * <li>SAX may deliver a single run of character data in several pieces, split at line breaks, entity references, or buffer boundaries.
 * The pieces are joined into one {@link ScannerEvent.Characters} event, emitted when the next markup is encountered. The parser may have
 * consumed the '&lt;' or '&lt;/' of that markup by the time it delivers the last piece; those characters are given back so that the event's
 * position is that of the first character after the run.</li>
 * <li>While an internal entity is expanded, the locator counts characters of the entity's replacement text rather than of the document.
 * Markup inside the expansion is reported at the ';' ending the entity reference, and character data inside it ends just after that
 * ';'. Text is thus never measured from a position in the replacement text, and the text that follows the expansion is measured from the
 * end of the reference.</li>
 * </ul>
 */
public class SaxEventSource extends DefaultHandler2 {
	private static final Logger log = Logger.getLogger(SaxEventSource.class);

	private static final XMLReaderJDOMFactory READER_FACTORY = new XMLReaderSAX2Factory(false);
	private static final String NAMESPACES_FEATURE = "http://xml.org/sax/features/namespaces";
	private static final String LEXICAL_HANDLER_PROPERTY = "http://xml.org/sax/properties/lexical-handler";
	private static final String[] DISABLED_FEATURES = { //
		"http://apache.org/xml/features/nonvalidating/load-external-dtd", //
		"http://xml.org/sax/features/external-general-entities", //
		"http://xml.org/sax/features/external-parameter-entities"//
	};

	private final String theSourceText;
	private final LineIndex theLineIndex;
	private final Consumer<? super ScannerEvent> theTarget;
	private final StringBuilder thePendingText;
	private Locator theLocator;
	private int thePendingLine;
	private int thePendingColumn;
	private StringBuilder theCdata;
	private boolean isInDtd;
	private int theEntityDepth;
	private int theDocumentOffset;
	private int theReferenceLine;
	private int theReferenceColumn;

	/**
	 * @param sourceText The XML text to scan
	 * @param lineIndex The line index of the text
	 * @param target The consumer for the scanner events
	 */
	public SaxEventSource(String sourceText, LineIndex lineIndex, Consumer<? super ScannerEvent> target) {
		theSourceText = sourceText;
		theLineIndex = lineIndex;
		theTarget = target;
		thePendingText = new StringBuilder();
	}

	/**
	 * Scans the text, feeding all events to the target. If the scan fails, the last event is a {@link ScannerEvent.ParseError parse
	 * error}.
	 */
	public void scan() {
		XMLReader reader = createReader();
		try {
			reader.parse(new InputSource(new StringReader(theSourceText)));
		} catch (SAXParseException e) {
			theTarget.accept(ScannerEvent.parseError(InterruptedParseException.from(e, theLineIndex)));
		} catch (SAXException | IOException e) {
			theTarget.accept(ScannerEvent.parseError(new InterruptedParseException(String.valueOf(e.getMessage()), null, e)));
		}
	}

	private XMLReader createReader() {
		XMLReader reader;
		try {
			reader = READER_FACTORY.createXMLReader();
		} catch (JDOMException e) {
			throw new IllegalStateException("Can't create SAX parser", e);
		}
		try {
			reader.setFeature(NAMESPACES_FEATURE, false);
			reader.setProperty(LEXICAL_HANDLER_PROPERTY, this);
		} catch (SAXException e) {
			throw new IllegalStateException("SAX parser " + reader.getClass().getName() + " cannot report lexical events", e);
		}
		for (String feature : DISABLED_FEATURES) {
			try {
				reader.setFeature(feature, false);
			} catch (SAXException e) {
				if (log.isDebugEnabled())
					log.debug("SAX parser " + reader.getClass().getName() + " does not support " + feature + ": " + e.getMessage());
			}
		}
		reader.setContentHandler(this);
		reader.setErrorHandler(this);
		return reader;
	}

	@Override
	public void setDocumentLocator(Locator locator) {
		theLocator = locator;
	}

	private int getLine() {
		if (theEntityDepth > 0)
			return theReferenceLine;
		return theLocator == null ? -1 : theLocator.getLineNumber();
	}

	/** @return The column of the last character the parser consumed, or of the ';' of the entity reference being expanded */
	private int getMarkupColumn() {
		if (theEntityDepth > 0)
			return theReferenceColumn;
		return theLocator == null ? -1 : theLocator.getColumnNumber() - 1;
	}

	/** Remembers how far the parser has read in the document itself, so that entity references can be located */
	private void trackDocumentOffset() {
		if (theEntityDepth > 0 || theLocator == null)
			return;
		int offset = theLineIndex.getOffset(theLocator.getLineNumber(), theLocator.getColumnNumber());
		if (offset >= 0)
			theDocumentOffset = offset;
	}

	@Override
	public void startElement(String uri, String localName, String qName, Attributes attributes) {
		flushText();
		Map<String, String> attrs = null;
		if (attributes.getLength() > 0) {
			attrs = new LinkedHashMap<>();
			for (int i = 0; i < attributes.getLength(); i++)
				attrs.put(attributes.getQName(i), attributes.getValue(i));
		}
		trackDocumentOffset();
		theTarget.accept(ScannerEvent.elementStart(qName, attrs, getLine(), getMarkupColumn()));
	}

	@Override
	public void endElement(String uri, String localName, String qName) {
		flushText();
		trackDocumentOffset();
		theTarget.accept(ScannerEvent.elementEnd(qName, getLine(), getMarkupColumn()));
	}

	@Override
	public void characters(char[] ch, int start, int length) {
		if (theCdata != null) {
			theCdata.append(ch, start, length);
			return;
		}
		thePendingText.append(ch, start, length);
		if (theEntityDepth > 0) {
			thePendingLine = theReferenceLine;
			thePendingColumn = theReferenceColumn < 0 ? -1 : theReferenceColumn + 1;
		} else {
			thePendingLine = getLine();
			thePendingColumn = theLocator == null ? -1 : theLocator.getColumnNumber();
			trackDocumentOffset();
		}
	}

	@Override
	public void ignorableWhitespace(char[] ch, int start, int length) {
		characters(ch, start, length);
	}

	@Override
	public void startCDATA() {
		flushText();
		theCdata = new StringBuilder();
	}

	@Override
	public void endCDATA() {
		byte[] data = theCdata.toString().getBytes(StandardCharsets.UTF_8);
		theCdata = null;
		trackDocumentOffset();
		theTarget.accept(ScannerEvent.cdata(data, getLine(), getMarkupColumn()));
	}

	@Override
	public void comment(char[] ch, int start, int length) {
		if (isInDtd)
			return;
		flushText();
		trackDocumentOffset();
		theTarget.accept(ScannerEvent.skippedMarkup(getLine(), getMarkupColumn()));
	}

	@Override
	public void processingInstruction(String target, String data) {
		flushText();
		trackDocumentOffset();
		theTarget.accept(ScannerEvent.skippedMarkup(getLine(), getMarkupColumn()));
	}

	@Override
	public void startEntity(String name) {
		if (isInDtd)
			return;
		if (theEntityDepth++ > 0)
			return;
		// The reference has been consumed, so it is the first one after the last position read in the document
		String reference = "&" + name + ";";
		int refStart = theSourceText.indexOf(reference, Math.max(0, theDocumentOffset - 1));
		if (refStart < 0) {
			if (log.isDebugEnabled())
				log.debug("Could not locate reference " + reference + " after offset " + theDocumentOffset + "; its expansion is not positioned");
			theReferenceLine = theReferenceColumn = -1;
			return;
		}
		FilePosition semicolon = theLineIndex.getPosition(refStart + reference.length() - 1);
		theReferenceLine = semicolon.getLineNumber() + 1;
		theReferenceColumn = semicolon.getCharNumber() + 1;
	}

	@Override
	public void endEntity(String name) {
		if (isInDtd || theEntityDepth == 0)
			return;
		theEntityDepth--;
	}

	@Override
	public void startDTD(String name, String publicId, String systemId) {
		isInDtd = true;
	}

	@Override
	public void endDTD() {
		isInDtd = false;
	}

	@Override
	public void endDocument() {
		flushText();
	}

	@Override
	public void warning(SAXParseException e) {
		log.warn("XML warning at " + e.getLineNumber() + ":" + e.getColumnNumber() + ": " + e.getMessage());
	}

	@Override
	public void error(SAXParseException e) {
		log.warn("Recoverable XML error at " + e.getLineNumber() + ":" + e.getColumnNumber() + ": " + e.getMessage());
	}

	@Override
	public void fatalError(SAXParseException e) throws SAXException {
		throw e;
	}

	private void flushText() {
		if (thePendingText.length() == 0)
			return;
		String text = thePendingText.toString();
		thePendingText.setLength(0);
		int line = thePendingLine;
		int column = thePendingColumn;
		int offset = theLineIndex.getOffset(line, column);
		if (offset >= 0) {
			int end = giveBackReadAhead(offset);
			if (end != offset) {
				FilePosition position = theLineIndex.getPosition(end);
				line = position.getLineNumber() + 1;
				column = position.getCharNumber() + 1;
			}
		}
		theTarget.accept(ScannerEvent.characters(text, line, column));
	}

	/**
	 * @param offset The offset just past the last character the parser consumed when it delivered character data
	 * @return The offset of the first character after the character data
	 */
	private int giveBackReadAhead(int offset) {
		if (offset >= 2 && theSourceText.charAt(offset - 1) == '/' && theSourceText.charAt(offset - 2) == '<')
			return offset - 2;
		else if (offset >= 1 && (theSourceText.charAt(offset - 1) == '<' || theSourceText.charAt(offset - 1) == '&'))
			return offset - 1;
		return offset;
	}
}
