package org.proxml.xml;

import java.util.Arrays;

import org.junit.Assert;
import org.junit.Test;
import org.proxml.io.FilePosition;

import com.google.common.collect.Range;

/** Tests {@link NormalizedText} */
public class NormalizedTextTest {
	private static final String SOURCE = "<root><p>Hello</p><p>World</p></root>";

	private static NormalizedText parse() throws InterruptedParseException {
		return new ProvenanceXmlParser().parse(SOURCE).getDocument().getNormalizedText();
	}

	/** Tests lookup of the source of single characters */
	@SuppressWarnings("static-method")
	@Test
	public void testSourceOffsets() throws InterruptedParseException {
		NormalizedText text = parse();
		Assert.assertEquals("Hello\nWorld", text.toString());
		Assert.assertEquals(11, text.length());
		Assert.assertEquals('W', text.charAt(6));
		Assert.assertEquals("lo\nWo", text.subSequence(3, 8));
		Assert.assertEquals(9, text.getSourceOffset(0));
		Assert.assertEquals(13, text.getSourceOffset(4));
		Assert.assertEquals(-1, text.getSourceOffset(5));
		Assert.assertEquals(21, text.getSourceOffset(6));
		Assert.assertEquals(25, text.getSourceOffset(10));
		for (int i = 0; i < text.length(); i++) {
			int offset = text.getSourceOffset(i);
			if (offset >= 0)
				Assert.assertEquals(SOURCE.charAt(offset), text.charAt(i));
		}

		FilePosition pos = text.getSourcePosition(6);
		Assert.assertEquals(0, pos.getLineNumber());
		Assert.assertEquals(21, pos.getCharNumber());
		Assert.assertEquals("L1,C22", pos.toString());
		Assert.assertNull(text.getSourcePosition(5));
	}

	/** Tests that indexes outside the text are rejected */
	@SuppressWarnings("static-method")
	@Test(expected = IndexOutOfBoundsException.class)
	public void testOutOfBounds() throws InterruptedParseException {
		parse().getSourceOffset(11);
	}

	/** Tests lookup of the source of ranges of characters */
	@SuppressWarnings("static-method")
	@Test
	public void testSourceRanges() throws InterruptedParseException {
		NormalizedText text = parse();
		Assert.assertEquals(2, text.getMappings(3, 8).size());
		Assert.assertEquals(Range.closedOpen(12, 23), text.getSourceRange(3, 8));
		Assert.assertEquals(Arrays.asList(new RangeMapping(9, 0, 5)), text.getMappings(0, 5));
		Assert.assertEquals(Range.closedOpen(9, 14), text.getSourceRange(0, 5));
		Assert.assertTrue(text.getMappings(5, 6).isEmpty());
		Assert.assertNull(text.getSourceRange(5, 6));
		Assert.assertTrue(text.getMappings(4, 4).isEmpty());
		Assert.assertEquals(Range.closedOpen(9, 26), text.getSourceRange(0, text.length()));
	}
}
