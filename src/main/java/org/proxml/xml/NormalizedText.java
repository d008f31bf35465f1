package org.proxml.xml;

import java.util.List;

import org.proxml.io.FilePosition;
import org.proxml.io.LineIndex;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;

/**
 * The normalized text of a parsed document, able to locate each of its characters in the source text. Characters inserted by the parser
 * (line breaks for paragraphs and breaks) have no source.
 */
public class NormalizedText implements CharSequence {
	private final String theText;
	private final ImmutableList<RangeMapping> theMappings;
	private final LineIndex theLineIndex;

	NormalizedText(String text, List<RangeMapping> mappings, LineIndex lineIndex) {
		theText = text;
		theMappings = ImmutableList.copyOf(mappings);
		theLineIndex = lineIndex;
	}

	@Override
	public int length() {
		return theText.length();
	}

	@Override
	public char charAt(int index) {
		return theText.charAt(index);
	}

	@Override
	public String subSequence(int start, int end) {
		return theText.substring(start, end);
	}

	/** @return The mappings of this text to its source, in order */
	public List<RangeMapping> getMappings() {
		return theMappings;
	}

	/**
	 * @param index The index of a character in this text
	 * @return The offset of the character in the source text, or -1 if the character was inserted by the parser
	 */
	public int getSourceOffset(int index) {
		if (index < 0 || index >= theText.length())
			throw new IndexOutOfBoundsException(index + " of " + theText.length());
		int mapping = findMapping(index);
		return mapping < 0 ? -1 : theMappings.get(mapping).toOriginal(index);
	}

	/**
	 * @param index The index of a character in this text
	 * @return The position of the character in the source text, or null if the character was inserted by the parser
	 */
	public FilePosition getSourcePosition(int index) {
		int offset = getSourceOffset(index);
		return offset < 0 ? null : theLineIndex.getPosition(offset);
	}

	/**
	 * @param from The start index (inclusive) of the range in this text
	 * @param to The end index (exclusive) of the range in this text
	 * @return All mappings covering any part of the given range, in order
	 */
	public List<RangeMapping> getMappings(int from, int to) {
		if (from < 0 || from > to || to > theText.length())
			throw new IndexOutOfBoundsException(from + " to " + to + " of " + theText.length());
		ImmutableList.Builder<RangeMapping> mappings = ImmutableList.builder();
		if (from == to)
			return mappings.build();
		int index = findMapping(from);
		if (index < 0)
			index = -index - 1;
		for (; index < theMappings.size(); index++) {
			RangeMapping mapping = theMappings.get(index);
			if (mapping.getNormalizedStart() >= to)
				break;
			mappings.add(mapping);
		}
		return mappings.build();
	}

	/**
	 * @param from The start index (inclusive) of the range in this text
	 * @param to The end index (exclusive) of the range in this text
	 * @return The smallest range of the source text containing every mapped character in the given range, or null if no character in the
	 *         range has a source
	 */
	public Range<Integer> getSourceRange(int from, int to) {
		List<RangeMapping> mappings = getMappings(from, to);
		if (mappings.isEmpty())
			return null;
		RangeMapping first = mappings.get(0);
		RangeMapping last = mappings.get(mappings.size() - 1);
		int start = first.getOriginalStart() + Math.max(0, from - first.getNormalizedStart());
		int end = last.getOriginalEnd() - Math.max(0, last.getNormalizedEnd() - to);
		return Range.closedOpen(start, end);
	}

	/**
	 * @param index The index of a character in this text
	 * @return The index of the mapping containing the character, or <code>-(insertion point) - 1</code> if no mapping contains it, where
	 *         the insertion point is the index of the first mapping after the character
	 */
	private int findMapping(int index) {
		int low = 0, high = theMappings.size() - 1;
		while (low <= high) {
			int mid = (low + high) >>> 1;
			RangeMapping mapping = theMappings.get(mid);
			if (index < mapping.getNormalizedStart())
				high = mid - 1;
			else if (index >= mapping.getNormalizedEnd())
				low = mid + 1;
			else
				return mid;
		}
		return -low - 1;
	}

	@Override
	public String toString() {
		return theText;
	}
}
