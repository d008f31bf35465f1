package org.proxml.xml;

import java.util.Arrays;

import org.junit.Assert;
import org.junit.Test;

import com.google.common.base.CharMatcher;

/** Tests {@link XmlParseConfig} */
public class XmlParseConfigTest {
	/** Tests the default configuration */
	@SuppressWarnings("static-method")
	@Test
	public void testDefault() {
		XmlParseConfig config = XmlParseConfig.DEFAULT;
		Assert.assertNull(config.getTrimming());
		Assert.assertFalse(config.isIgnoringNamespaces());
		Assert.assertEquals(Arrays.asList("p"), config.getParagraphElements().asList());
		Assert.assertEquals(Arrays.asList("br"), config.getLineBreakElements().asList());
		Assert.assertEquals("x:y", config.getElementName("x:y"));
		Assert.assertSame(CharMatcher.whitespace(), XmlParseConfig.WHITESPACE_AND_NEWLINES);
	}

	/** Tests that the copy methods change only what they name */
	@SuppressWarnings("static-method")
	@Test
	public void testCopies() {
		XmlParseConfig config = XmlParseConfig.DEFAULT;
		XmlParseConfig modified = config.withTrimming(" -").withIgnoreNamespaces(true);
		Assert.assertEquals("x", modified.getTrimming().trimFrom("- x -"));
		Assert.assertEquals("y", modified.getElementName("x:y"));
		Assert.assertEquals("y", modified.getElementName("y"));
		Assert.assertEquals("c", modified.getElementName("a:b:c"));
		Assert.assertNull(modified.withoutTrimming().getTrimming());
		Assert.assertTrue(modified.withoutTrimming().isIgnoringNamespaces());

		XmlParseConfig breaks = config.withParagraphElements(Arrays.asList("para", "div")).withLineBreakElements(Arrays.asList("lb"));
		Assert.assertTrue(breaks.getParagraphElements().contains("div"));
		Assert.assertFalse(breaks.getParagraphElements().contains("p"));
		Assert.assertTrue(breaks.getLineBreakElements().contains("lb"));

		// The original is unchanged
		Assert.assertNull(config.getTrimming());
		Assert.assertFalse(config.isIgnoringNamespaces());
		Assert.assertTrue(config.getParagraphElements().contains("p"));
	}
}
