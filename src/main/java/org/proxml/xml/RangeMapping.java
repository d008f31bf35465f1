package org.proxml.xml;

import java.util.Objects;

import com.google.common.collect.Range;

/**
 * Ties a range of the normalized text of a parsed document to the range of the source text it was copied from. Both ranges are
 * half-open and have the same length.
 */
public class RangeMapping {
	private final Range<Integer> theOriginalRange;
	private final Range<Integer> theNormalizedRange;

	/**
	 * @param originalStart The offset in the source text of the first mapped character
	 * @param normalizedStart The offset in the normalized text of the first mapped character
	 * @param length The number of mapped characters
	 */
	public RangeMapping(int originalStart, int normalizedStart, int length) {
		if (originalStart < 0 || normalizedStart < 0 || length < 0)
			throw new IllegalArgumentException("Bad mapping: " + originalStart + "->" + normalizedStart + " x" + length);
		theOriginalRange = Range.closedOpen(originalStart, originalStart + length);
		theNormalizedRange = Range.closedOpen(normalizedStart, normalizedStart + length);
	}

	/** @return The range in the source text */
	public Range<Integer> getOriginalRange() {
		return theOriginalRange;
	}

	/** @return The range in the normalized text */
	public Range<Integer> getNormalizedRange() {
		return theNormalizedRange;
	}

	/** @return The offset in the source text of the first mapped character */
	public int getOriginalStart() {
		return theOriginalRange.lowerEndpoint();
	}

	/** @return The offset in the source text after the last mapped character */
	public int getOriginalEnd() {
		return theOriginalRange.upperEndpoint();
	}

	/** @return The offset in the normalized text of the first mapped character */
	public int getNormalizedStart() {
		return theNormalizedRange.lowerEndpoint();
	}

	/** @return The offset in the normalized text after the last mapped character */
	public int getNormalizedEnd() {
		return theNormalizedRange.upperEndpoint();
	}

	/** @return The number of mapped characters */
	public int length() {
		return getOriginalEnd() - getOriginalStart();
	}

	/**
	 * @param normalizedIndex The index of a character in the normalized text
	 * @return The index in the source text of the given character, or -1 if the character is not in this mapping
	 */
	public int toOriginal(int normalizedIndex) {
		if (!theNormalizedRange.contains(normalizedIndex))
			return -1;
		return getOriginalStart() + normalizedIndex - getNormalizedStart();
	}

	/**
	 * @param source The source text
	 * @param normalized The normalized text
	 * @return Whether the characters this mapping ties together are equal in the two texts
	 */
	public boolean isConsistent(CharSequence source, CharSequence normalized) {
		if (getOriginalEnd() > source.length() || getNormalizedEnd() > normalized.length())
			return false;
		int length = length();
		for (int i = 0; i < length; i++) {
			if (source.charAt(getOriginalStart() + i) != normalized.charAt(getNormalizedStart() + i))
				return false;
		}
		return true;
	}

	@Override
	public int hashCode() {
		return Objects.hash(theOriginalRange, theNormalizedRange);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this)
			return true;
		else if (!(obj instanceof RangeMapping))
			return false;
		RangeMapping other = (RangeMapping) obj;
		return theOriginalRange.equals(other.theOriginalRange) && theNormalizedRange.equals(other.theNormalizedRange);
	}

	@Override
	public String toString() {
		return theOriginalRange + "->" + theNormalizedRange;
	}
}
