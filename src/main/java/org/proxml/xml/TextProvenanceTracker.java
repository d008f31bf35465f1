package org.proxml.xml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;
import org.proxml.io.LineIndex;

import com.google.common.base.CharMatcher;

/**
 * <p>
 * Accumulates the normalized text of a document while it is being parsed, and records where in the source text each piece of it came
 * from.
 * </p>
 * <p>
 * Each piece of text is copied directly from the source between a markup boundary and the end of a run of character data, without the
 * structural whitespace (indentation and line breaks) at either end. Entity references are therefore retained as they appear in the source.
 * </p>
 */
public class TextProvenanceTracker {
	private static final Logger log = Logger.getLogger(TextProvenanceTracker.class);

	/** Whitespace that only serves to lay out the markup */
	public static final CharMatcher STRUCTURAL_WHITESPACE = CharMatcher.anyOf(" \t\r\n");

	private final String theSourceText;
	private final LineIndex theLineIndex;
	private final StringBuilder theText;
	private final List<RangeMapping> theMappings;

	/**
	 * @param sourceText The source text of the document
	 * @param lineIndex The line index of the source text
	 */
	public TextProvenanceTracker(String sourceText, LineIndex lineIndex) {
		theSourceText = sourceText;
		theLineIndex = lineIndex;
		theText = new StringBuilder();
		theMappings = new ArrayList<>();
	}

	/** @return The length of the normalized text so far */
	public int length() {
		return theText.length();
	}

	/** @return The normalized text so far */
	public String getText() {
		return theText.toString();
	}

	/** @return The mappings recorded so far, in order */
	public List<RangeMapping> getMappings() {
		return Collections.unmodifiableList(theMappings);
	}

	/** Appends a line break, which does not map to anything in the source, to the normalized text */
	public void appendLineBreak() {
		theText.append('\n');
	}

	/**
	 * Appends the text between a markup boundary and the end of some character data to the normalized text
	 *
	 * @param startLine The line of the final '&gt;' of the markup preceding the text
	 * @param startColumn The column of the final '&gt;' of the markup preceding the text
	 * @param endLine The line of the first character after the text
	 * @param endColumn The column of the first character after the text
	 * @return The mapping recorded for the text, or null if nothing was recorded
	 */
	public RangeMapping record(int startLine, int startColumn, int endLine, int endColumn) {
		int start = theLineIndex.getOffset(startLine, startColumn);
		int end = theLineIndex.getOffset(endLine, endColumn);
		if (start < 0 || end < 0) {
			if (log.isDebugEnabled())
				log.debug("Could not resolve text span " + startLine + ":" + startColumn + " to " + endLine + ":" + endColumn
					+ " in " + theLineIndex + "; provenance not recorded");
			return null;
		}

		start++; // Past the '>'
		while (start < theSourceText.length() && STRUCTURAL_WHITESPACE.matches(theSourceText.charAt(start)))
			start++;
		while (end - 1 > start && STRUCTURAL_WHITESPACE.matches(theSourceText.charAt(end - 1)))
			end--;
		if (start >= end) {
			if (log.isDebugEnabled())
				log.debug("Empty text span " + startLine + ":" + startColumn + " to " + endLine + ":" + endColumn);
			return null;
		}

		RangeMapping mapping = new RangeMapping(start, theText.length(), end - start);
		theText.append(theSourceText, start, end);
		theMappings.add(mapping);
		return mapping;
	}
}
