package org.proxml.xml;

import org.proxml.io.FilePosition;
import org.proxml.io.LineIndex;
import org.proxml.io.TextParseException;
import org.xml.sax.SAXParseException;

/**
 * The only error a parse reports to its caller: the scanner could not get through the document, so no tree or text is available. The
 * scanner's own exception is the {@link #getCause() cause}.
 */
public class InterruptedParseException extends TextParseException {
	/**
	 * @param message The message describing the failure
	 * @param position The position in the source text where the failure was detected, or null if it is not known
	 * @param rawError The scanner's exception, if any
	 */
	public InterruptedParseException(String message, FilePosition position, Throwable rawError) {
		super(message, position, rawError);
	}

	/** @return The exception reported by the scanner, or null if the interruption did not come from the scanner */
	public Throwable getRawError() {
		return getCause();
	}

	/**
	 * @param e The scanner's parse exception
	 * @param lineIndex The line index of the source text, to resolve the exception's position
	 * @return The interrupted parse exception for the scanner error
	 */
	public static InterruptedParseException from(SAXParseException e, LineIndex lineIndex) {
		FilePosition position = null;
		if (e.getLineNumber() > 0 && e.getColumnNumber() > 0) {
			int lineStart = lineIndex.getLineStart(e.getLineNumber());
			if (lineStart >= 0) {
				int offset = Math.min(lineStart + e.getColumnNumber() - 1, lineIndex.length());
				position = lineIndex.getPosition(offset);
			}
		}
		return new InterruptedParseException(e.getMessage(), position, e);
	}
}
