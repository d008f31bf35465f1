package org.proxml.io;

import java.util.Arrays;

/**
 * <p>
 * An index of the line breaks in a text, allowing conversion between the 1-based (line, column) coordinates reported by XML scanners and
 * absolute character offsets into the text.
 * </p>
 * <p>
 * Line ends are counted the way XML scanners count them: a '\n', a "\r\n" sequence (ending at its '\n') or a '\r' not followed by
 * '\n'. The offset of the last character of each line end is recorded.
 * </p>
 */
public class LineIndex {
	private final int theLength;
	private final int[] theBreaks;

	/** @param text The text to index */
	public LineIndex(CharSequence text) {
		theLength = text.length();
		int count = 0;
		for (int i = 0; i < theLength; i++) {
			if (isLineEnd(text, i))
				count++;
		}
		theBreaks = new int[count];
		count = 0;
		for (int i = 0; i < theLength; i++) {
			if (isLineEnd(text, i))
				theBreaks[count++] = i;
		}
	}

	private static boolean isLineEnd(CharSequence text, int index) {
		switch (text.charAt(index)) {
		case '\n':
			return true;
		case '\r':
			return index + 1 == text.length() || text.charAt(index + 1) != '\n';
		default:
			return false;
		}
	}

	/** @return The length of the indexed text */
	public int length() {
		return theLength;
	}

	/** @return The number of lines in the text. Text without any line break has one line. */
	public int getLineCount() {
		return theBreaks.length + 1;
	}

	/**
	 * @param line The line number, starting from 1
	 * @return The offset of the first character of the given line, or -1 if the text has no such line
	 */
	public int getLineStart(int line) {
		if (line < 1 || line > theBreaks.length + 1)
			return -1;
		return line == 1 ? 0 : theBreaks[line - 2] + 1;
	}

	/**
	 * @param line The line number, starting from 1
	 * @param column The column number within the line, starting from 1
	 * @return The offset of the character at the given coordinates, or -1 if the coordinates do not address a character in the text
	 */
	public int getOffset(int line, int column) {
		if (column < 1)
			return -1;
		int lineStart = getLineStart(line);
		if (lineStart < 0)
			return -1;
		int offset = lineStart + column - 1;
		if (offset >= theLength)
			return -1;
		return offset;
	}

	/**
	 * @param offset The character offset in the text, between zero and the text's length (inclusive)
	 * @return The position of the given offset
	 * @throws IndexOutOfBoundsException If the offset is outside the text
	 */
	public FilePosition getPosition(int offset) {
		if (offset < 0 || offset > theLength)
			throw new IndexOutOfBoundsException(offset + " of " + theLength);
		// Number of line breaks strictly before the offset
		int line = Arrays.binarySearch(theBreaks, offset);
		if (line < 0)
			line = -line - 1;
		int lineStart = line == 0 ? 0 : theBreaks[line - 1] + 1;
		return new FilePosition(offset, line, offset - lineStart);
	}

	@Override
	public String toString() {
		return theLength + " chars, " + getLineCount() + " lines";
	}
}
