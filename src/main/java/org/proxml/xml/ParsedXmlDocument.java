package org.proxml.xml;

import java.util.List;

import org.proxml.io.LineIndex;

import com.google.common.collect.ImmutableList;

/** A successfully parsed XML document: its element tree, its normalized text, and the provenance of that text */
public class ParsedXmlDocument {
	private final XmlElement theRoot;
	private final String theSourceText;
	private final LineIndex theLineIndex;
	private final NormalizedText theText;

	ParsedXmlDocument(XmlElement root, String sourceText, LineIndex lineIndex, String text, List<RangeMapping> mappings) {
		theRoot = root;
		theSourceText = sourceText;
		theLineIndex = lineIndex;
		theText = new NormalizedText(text, mappings, lineIndex);
	}

	/** @return The synthetic root of the element tree, whose only child is the document element */
	public XmlElement getRoot() {
		return theRoot;
	}

	/** @return The root element of the document */
	public XmlElement getDocumentElement() {
		List<XmlElement> children = theRoot.getChildren();
		return children.isEmpty() ? null : children.get(0);
	}

	/** @return The text that was parsed */
	public String getSourceText() {
		return theSourceText;
	}

	/** @return The line index of the {@link #getSourceText() source text} */
	public LineIndex getLineIndex() {
		return theLineIndex;
	}

	/** @return The normalized text of the document */
	public String getText() {
		return theText.toString();
	}

	/** @return The normalized text of the document, with access to the source of each character */
	public NormalizedText getNormalizedText() {
		return theText;
	}

	/** @return The mappings from the normalized text to the source text, in order */
	public List<RangeMapping> getMappings() {
		return theText.getMappings();
	}

	/** @return All mappings whose normalized characters do not equal their source characters. Empty unless there is a bug. */
	public List<RangeMapping> findMappingViolations() {
		ImmutableList.Builder<RangeMapping> violations = ImmutableList.builder();
		for (RangeMapping mapping : theText.getMappings()) {
			if (!mapping.isConsistent(theSourceText, theText))
				violations.add(mapping);
		}
		return violations.build();
	}

	@Override
	public String toString() {
		XmlElement docEl = getDocumentElement();
		return (docEl == null ? "(empty)" : docEl.getName()) + ": " + theText.length() + " chars, " + getMappings().size() + " mappings";
	}
}
