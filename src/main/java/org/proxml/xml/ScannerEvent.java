package org.proxml.xml;

import java.util.Map;

/**
 * <p>
 * An event emitted by an XML scanner, in document order. Events are consumed by a {@link ParseSession}.
 * </p>
 * <p>
 * Positions are 1-based (line, column) coordinates into the source text:
 * </p>
 * <ul>
 * <li>For markup events ({@link Type#ELEMENT_START element start}, {@link Type#ELEMENT_END element end}, {@link Type#CDATA CDATA} and
 * {@link Type#SKIPPED_MARKUP skipped markup}) the position is that of the final '&gt;' of the markup.</li>
 * <li>For {@link Type#CHARACTERS character data} the position is that of the first source character after the data.</li>
 * </ul>
 */
public abstract class ScannerEvent {
	/** The types of scanner events */
	public enum Type {
		/** An element's start tag was scanned */
		ELEMENT_START,
		/** A run of character data was scanned */
		CHARACTERS,
		/** A CDATA section was scanned */
		CDATA,
		/** An element's end tag was scanned (also emitted after the start of an empty element) */
		ELEMENT_END,
		/** A comment or processing instruction was scanned. It contributes nothing to the document. */
		SKIPPED_MARKUP,
		/** The scanner failed */
		PARSE_ERROR
	}

	private final int theLine;
	private final int theColumn;

	ScannerEvent(int line, int column) {
		theLine = line;
		theColumn = column;
	}

	/** @return This event's type */
	public abstract Type getType();

	/** @return The line of this event's position, starting at 1, or -1 if unknown */
	public int getLine() {
		return theLine;
	}

	/** @return The column of this event's position, starting at 1, or -1 if unknown */
	public int getColumn() {
		return theColumn;
	}

	@Override
	public String toString() {
		return getType() + "@" + theLine + ":" + theColumn;
	}

	/**
	 * @param name The element's name as scanned
	 * @param attributes The element's attributes
	 * @param line The line of the start tag's final '&gt;'
	 * @param column The column of the start tag's final '&gt;'
	 * @return The event
	 */
	public static ElementStart elementStart(String name, Map<String, String> attributes, int line, int column) {
		return new ElementStart(name, attributes, line, column);
	}

	/**
	 * @param text The character data
	 * @param line The line of the first character after the data
	 * @param column The column of the first character after the data
	 * @return The event
	 */
	public static Characters characters(String text, int line, int column) {
		return new Characters(text, line, column);
	}

	/**
	 * @param data The content of the CDATA section
	 * @param line The line of the section's final '&gt;'
	 * @param column The column of the section's final '&gt;'
	 * @return The event
	 */
	public static Cdata cdata(byte[] data, int line, int column) {
		return new Cdata(data, line, column);
	}

	/**
	 * @param name The element's name as scanned
	 * @param line The line of the end tag's final '&gt;'
	 * @param column The column of the end tag's final '&gt;'
	 * @return The event
	 */
	public static ElementEnd elementEnd(String name, int line, int column) {
		return new ElementEnd(name, line, column);
	}

	/**
	 * @param line The line of the markup's final '&gt;'
	 * @param column The column of the markup's final '&gt;'
	 * @return The event
	 */
	public static SkippedMarkup skippedMarkup(int line, int column) {
		return new SkippedMarkup(line, column);
	}

	/**
	 * @param error The scanner failure
	 * @return The event
	 */
	public static ParseError parseError(InterruptedParseException error) {
		return new ParseError(error);
	}

	/** An element's start tag */
	public static class ElementStart extends ScannerEvent {
		private final String theName;
		private final Map<String, String> theAttributes;

		ElementStart(String name, Map<String, String> attributes, int line, int column) {
			super(line, column);
			theName = name;
			theAttributes = attributes;
		}

		@Override
		public Type getType() {
			return Type.ELEMENT_START;
		}

		/** @return The element's name as scanned */
		public String getName() {
			return theName;
		}

		/** @return The element's attributes (may be null if there are none) */
		public Map<String, String> getAttributes() {
			return theAttributes;
		}

		@Override
		public String toString() {
			return "<" + theName + ">@" + getLine() + ":" + getColumn();
		}
	}

	/** A run of character data */
	public static class Characters extends ScannerEvent {
		private final String theText;

		Characters(String text, int line, int column) {
			super(line, column);
			theText = text;
		}

		@Override
		public Type getType() {
			return Type.CHARACTERS;
		}

		/** @return The character data */
		public String getText() {
			return theText;
		}

		@Override
		public String toString() {
			return "\"" + theText + "\"@" + getLine() + ":" + getColumn();
		}
	}

	/** A CDATA section */
	public static class Cdata extends ScannerEvent {
		private final byte[] theData;

		Cdata(byte[] data, int line, int column) {
			super(line, column);
			theData = data;
		}

		@Override
		public Type getType() {
			return Type.CDATA;
		}

		/** @return The content of the CDATA section */
		public byte[] getData() {
			return theData;
		}
	}

	/** An element's end tag */
	public static class ElementEnd extends ScannerEvent {
		private final String theName;

		ElementEnd(String name, int line, int column) {
			super(line, column);
			theName = name;
		}

		@Override
		public Type getType() {
			return Type.ELEMENT_END;
		}

		/** @return The element's name as scanned */
		public String getName() {
			return theName;
		}

		@Override
		public String toString() {
			return "</" + theName + ">@" + getLine() + ":" + getColumn();
		}
	}

	/** A comment or processing instruction */
	public static class SkippedMarkup extends ScannerEvent {
		SkippedMarkup(int line, int column) {
			super(line, column);
		}

		@Override
		public Type getType() {
			return Type.SKIPPED_MARKUP;
		}
	}

	/** A scanner failure */
	public static class ParseError extends ScannerEvent {
		private final InterruptedParseException theError;

		ParseError(InterruptedParseException error) {
			super(-1, -1);
			theError = error;
		}

		@Override
		public Type getType() {
			return Type.PARSE_ERROR;
		}

		/** @return The scanner failure */
		public InterruptedParseException getError() {
			return theError;
		}

		@Override
		public String toString() {
			return "error: " + theError.getMessage();
		}
	}
}
