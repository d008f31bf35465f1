package org.proxml.io;

import java.text.ParseException;

/** A ParseException for multi-line character sequences */
public class TextParseException extends ParseException {
	private final FilePosition thePosition;

	/**
	 * @param s The message for the exception
	 * @param position The position of the error in the text, or null if it is not known
	 */
	public TextParseException(String s, FilePosition position) {
		super(s, position == null ? -1 : position.getPosition());
		thePosition = position;
	}

	/**
	 * @param s The message for the exception
	 * @param position The position of the error in the text, or null if it is not known
	 * @param cause The cause of the exception
	 */
	public TextParseException(String s, FilePosition position, Throwable cause) {
		this(s, position);
		initCause(cause);
	}

	/** @return The position of the source of the error in the text, or null if it is not known */
	public FilePosition getPosition() {
		return thePosition;
	}

	/** @return The line number of the error in the text, offset from zero, or -1 if it is not known */
	public int getLineNumber() {
		return thePosition == null ? -1 : thePosition.getLineNumber();
	}

	/** @return The character number of the error in the line, offset from zero, or -1 if it is not known */
	public int getColumnNumber() {
		return thePosition == null ? -1 : thePosition.getCharNumber();
	}

	@Override
	public String toString() {
		if (thePosition != null)
			return new StringBuilder().append(thePosition).append(":\n").append(super.toString()).toString();
		else
			return super.toString();
	}
}
