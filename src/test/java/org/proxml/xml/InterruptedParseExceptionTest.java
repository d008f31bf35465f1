package org.proxml.xml;

import org.junit.Assert;
import org.junit.Test;
import org.proxml.io.LineIndex;
import org.xml.sax.SAXParseException;

/** Tests {@link InterruptedParseException} */
public class InterruptedParseExceptionTest {
	private final LineIndex theIndex = new LineIndex("<a>\n<b></a>");

	/** Tests conversion of a scanner error's position */
	@Test
	public void testFromScannerError() {
		SAXParseException sax = new SAXParseException("mismatch", null, null, 2, 8);
		InterruptedParseException error = InterruptedParseException.from(sax, theIndex);
		Assert.assertSame(sax, error.getRawError());
		Assert.assertSame(sax, error.getCause());
		Assert.assertEquals("mismatch", error.getMessage());
		Assert.assertEquals(1, error.getLineNumber());
		Assert.assertEquals(7, error.getColumnNumber());
		Assert.assertEquals(11, error.getErrorOffset());
	}

	/** Tests scanner errors whose position is unknown or outside the text */
	@Test
	public void testUnknownPosition() {
		InterruptedParseException unknown = InterruptedParseException.from(new SAXParseException("?", null, null, -1, -1), theIndex);
		Assert.assertNull(unknown.getPosition());
		Assert.assertEquals(-1, unknown.getErrorOffset());
		Assert.assertEquals(-1, unknown.getLineNumber());

		InterruptedParseException noLine = InterruptedParseException.from(new SAXParseException("?", null, null, 9, 1), theIndex);
		Assert.assertNull(noLine.getPosition());
	}
}
