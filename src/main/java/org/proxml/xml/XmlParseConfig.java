package org.proxml.xml;

import java.util.Collection;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableSet;

/**
 * Immutable configuration for a {@link ProvenanceXmlParser}. The <code>with*</code> methods return modified copies.
 */
public class XmlParseConfig {
	/** Trims all whitespace, including line breaks */
	public static final CharMatcher WHITESPACE_AND_NEWLINES = CharMatcher.whitespace();

	/** No trimming, namespace prefixes kept, paragraphs are &lt;p&gt; and line breaks are &lt;br&gt; */
	public static final XmlParseConfig DEFAULT = new XmlParseConfig(null, false, ImmutableSet.of("p"), ImmutableSet.of("br"));

	private final CharMatcher theTrimming;
	private final boolean isIgnoringNamespaces;
	private final ImmutableSet<String> theParagraphElements;
	private final ImmutableSet<String> theLineBreakElements;

	private XmlParseConfig(CharMatcher trimming, boolean ignoreNamespaces, ImmutableSet<String> paragraphElements,
		ImmutableSet<String> lineBreakElements) {
		theTrimming = trimming;
		isIgnoringNamespaces = ignoreNamespaces;
		theParagraphElements = paragraphElements;
		theLineBreakElements = lineBreakElements;
	}

	/** @return The characters trimmed from each element's text when the element is closed, or null if text is not trimmed */
	public CharMatcher getTrimming() {
		return theTrimming;
	}

	/** @return Whether namespace prefixes are removed from element names */
	public boolean isIgnoringNamespaces() {
		return isIgnoringNamespaces;
	}

	/** @return The names of elements that start a new line in the normalized text, unless they are at its very beginning */
	public ImmutableSet<String> getParagraphElements() {
		return theParagraphElements;
	}

	/** @return The names of elements that always insert a line break into the normalized text */
	public ImmutableSet<String> getLineBreakElements() {
		return theLineBreakElements;
	}

	/**
	 * @param trimming The characters to trim from each element's text when the element is closed, or null to not trim text
	 * @return A copy of this config with the given trimming
	 */
	public XmlParseConfig withTrimming(CharMatcher trimming) {
		return new XmlParseConfig(trimming, isIgnoringNamespaces, theParagraphElements, theLineBreakElements);
	}

	/**
	 * @param trimmedChars The characters to trim from each element's text when the element is closed
	 * @return A copy of this config with the given trimming
	 */
	public XmlParseConfig withTrimming(String trimmedChars) {
		return withTrimming(CharMatcher.anyOf(trimmedChars));
	}

	/** @return A copy of this config that does not trim element text */
	public XmlParseConfig withoutTrimming() {
		return withTrimming((CharMatcher) null);
	}

	/**
	 * @param ignoreNamespaces Whether namespace prefixes should be removed from element names
	 * @return A copy of this config with the given namespace handling
	 */
	public XmlParseConfig withIgnoreNamespaces(boolean ignoreNamespaces) {
		return new XmlParseConfig(theTrimming, ignoreNamespaces, theParagraphElements, theLineBreakElements);
	}

	/**
	 * @param names The names of elements that should start a new line in the normalized text
	 * @return A copy of this config with the given paragraph elements
	 */
	public XmlParseConfig withParagraphElements(Collection<String> names) {
		return new XmlParseConfig(theTrimming, isIgnoringNamespaces, ImmutableSet.copyOf(names), theLineBreakElements);
	}

	/**
	 * @param names The names of elements that should insert a line break into the normalized text
	 * @return A copy of this config with the given line break elements
	 */
	public XmlParseConfig withLineBreakElements(Collection<String> names) {
		return new XmlParseConfig(theTrimming, isIgnoringNamespaces, theParagraphElements, ImmutableSet.copyOf(names));
	}

	/**
	 * @param scannedName The element name as given by the scanner
	 * @return The name of the element as it will appear in the tree
	 */
	public String getElementName(String scannedName) {
		if (!isIgnoringNamespaces)
			return scannedName;
		int colon = scannedName.lastIndexOf(':');
		return colon < 0 ? scannedName : scannedName.substring(colon + 1);
	}

	@Override
	public String toString() {
		return "trimming=" + theTrimming + ", ignoreNamespaces=" + isIgnoringNamespaces + ", paragraphs=" + theParagraphElements
			+ ", breaks=" + theLineBreakElements;
	}
}
