package org.proxml.xml;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.proxml.Sealable;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * <p>
 * An element in a parsed XML document, annotated with the lines it spans in the source.
 * </p>
 * <p>
 * Elements are populated by a {@link ParseSession} while they are open and {@link #isSealed() sealed} when they are closed. The parent
 * reference is for upward navigation only; the tree is owned from the {@link #isDocumentRoot() root} down.
 * </p>
 */
public class XmlElement implements Sealable {
	/** The name of the synthetic element at the root of every parsed tree */
	public static final String DOCUMENT_ROOT_NAME = "#document";

	private final XmlElement theParent;
	private final String theName;
	private final ImmutableMap<String, String> theAttributes;
	private List<XmlElement> theChildren;
	private StringBuilder theTextBuilder;
	private String theText;
	private byte[] theCdata;
	private final int theLineStart;
	private int theLineEnd;
	private boolean isSealed;

	XmlElement(XmlElement parent, String name, Map<String, String> attributes, int lineStart) {
		theParent = parent;
		theName = name;
		theAttributes = attributes == null ? ImmutableMap.of() : ImmutableMap.copyOf(attributes);
		theChildren = new ArrayList<>();
		theLineStart = lineStart;
		theLineEnd = -1;
	}

	static XmlElement createDocumentRoot() {
		return new XmlElement(null, DOCUMENT_ROOT_NAME, null, 0);
	}

	/** @return The element containing this element, or null if this is the document root */
	public XmlElement getParent() {
		return theParent;
	}

	/** @return Whether this is the synthetic root of the tree, as opposed to an element in the document */
	public boolean isDocumentRoot() {
		return theParent == null;
	}

	/** @return This element's tag name */
	public String getName() {
		return theName;
	}

	/** @return This element's attributes by name. Empty if the element has no attributes. */
	public Map<String, String> getAttributes() {
		return theAttributes;
	}

	/**
	 * @param name The name of the attribute to get
	 * @return The value of the given attribute on this element, or null if it is not specified
	 */
	public String getAttribute(String name) {
		return theAttributes.get(name);
	}

	/** @return This element's child elements, in document order */
	public List<XmlElement> getChildren() {
		return isSealed ? theChildren : Collections.unmodifiableList(theChildren);
	}

	/**
	 * @param name The name of the children to get
	 * @return All of this element's children with the given name, in document order
	 */
	public List<XmlElement> getChildren(String name) {
		ImmutableList.Builder<XmlElement> children = ImmutableList.builder();
		for (XmlElement child : theChildren) {
			if (child.getName().equals(name))
				children.add(child);
		}
		return children.build();
	}

	/**
	 * @param name The name of the child to get
	 * @return The first of this element's children with the given name, or null if there is none
	 */
	public XmlElement getChild(String name) {
		for (XmlElement child : theChildren) {
			if (child.getName().equals(name))
				return child;
		}
		return null;
	}

	/**
	 * @return All character data directly under this element (not under its children), concatenated as given by the scanner, or null if
	 *         the element had no direct character data. If the parser was configured with trimming, the trimmed characters are removed.
	 */
	public String getText() {
		if (theTextBuilder != null)
			return theTextBuilder.toString();
		return theText;
	}

	/** @return A copy of the content of the last CDATA section directly under this element, or null if there was none */
	public byte[] getCdata() {
		return theCdata == null ? null : theCdata.clone();
	}

	/** @return The content of the last CDATA section directly under this element decoded as UTF-8, or null if there was none */
	public String getCdataString() {
		return theCdata == null ? null : new String(theCdata, StandardCharsets.UTF_8);
	}

	/** @return The line (starting at 1) on which this element's start tag ended */
	public int getLineStart() {
		return theLineStart;
	}

	/** @return The line (starting at 1) on which this element's end tag ended, or -1 if the element has not been closed */
	public int getLineEnd() {
		return theLineEnd;
	}

	@Override
	public boolean isSealed() {
		return isSealed;
	}

	@Override
	public void seal() {
		if (isSealed)
			return;
		if (theTextBuilder != null) {
			theText = theTextBuilder.toString();
			theTextBuilder = null;
		}
		theChildren = ImmutableList.copyOf(theChildren);
		isSealed = true;
	}

	void addChild(XmlElement child) {
		assertUnsealed();
		theChildren.add(child);
	}

	void appendText(String text) {
		assertUnsealed();
		if (theTextBuilder == null)
			theTextBuilder = new StringBuilder();
		theTextBuilder.append(text);
	}

	void setCdata(byte[] cdata) {
		assertUnsealed();
		theCdata = cdata;
	}

	/**
	 * Records the end of this element and seals it
	 *
	 * @param lineEnd The line on which the element's end tag ended
	 * @param trimming The characters to trim from the element's text, or null to leave the text as given
	 */
	void close(int lineEnd, CharMatcher trimming) {
		assertUnsealed();
		theLineEnd = lineEnd;
		if (trimming != null && theTextBuilder != null) {
			theText = trimming.trimFrom(theTextBuilder);
			theTextBuilder = null;
		}
		seal();
	}

	private void assertUnsealed() {
		if (isSealed)
			throw new SealedException(this);
	}

	@Override
	public String toString() {
		StringBuilder str = new StringBuilder().append('<').append(theName);
		for (Map.Entry<String, String> attr : theAttributes.entrySet())
			str.append(' ').append(attr.getKey()).append("=\"").append(attr.getValue()).append('"');
		return str.append("> L").append(theLineStart).append('-').append(theLineEnd).toString();
	}
}
