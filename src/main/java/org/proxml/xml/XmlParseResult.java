package org.proxml.xml;

/** The outcome of a parse: either a {@link ParsedXmlDocument document} or the error that interrupted the parse, never both */
public class XmlParseResult {
	private final ParsedXmlDocument theDocument;
	private final InterruptedParseException theError;

	private XmlParseResult(ParsedXmlDocument document, InterruptedParseException error) {
		theDocument = document;
		theError = error;
	}

	static XmlParseResult success(ParsedXmlDocument document) {
		return new XmlParseResult(document, null);
	}

	static XmlParseResult interrupted(InterruptedParseException error) {
		return new XmlParseResult(null, error);
	}

	/** @return Whether the parse failed */
	public boolean isInterrupted() {
		return theError != null;
	}

	/** @return The error that interrupted the parse, or null if it succeeded */
	public InterruptedParseException getError() {
		return theError;
	}

	/**
	 * @return The parsed document
	 * @throws InterruptedParseException If the parse failed
	 */
	public ParsedXmlDocument getDocument() throws InterruptedParseException {
		if (theError != null)
			throw theError;
		return theDocument;
	}

	@Override
	public String toString() {
		return theError != null ? "Interrupted: " + theError.getMessage() : theDocument.toString();
	}
}
