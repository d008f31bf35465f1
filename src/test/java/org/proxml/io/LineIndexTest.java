package org.proxml.io;

import org.junit.Assert;
import org.junit.Test;

/** Tests {@link LineIndex} */
public class LineIndexTest {
	private final LineIndex theIndex = new LineIndex("ab\ncd\n\nef");

	/** Tests conversion of (line, column) coordinates to offsets */
	@Test
	public void testOffsets() {
		Assert.assertEquals(4, theIndex.getLineCount());
		Assert.assertEquals(0, theIndex.getOffset(1, 1));
		Assert.assertEquals(2, theIndex.getOffset(1, 3));
		Assert.assertEquals(3, theIndex.getOffset(2, 1));
		Assert.assertEquals(4, theIndex.getOffset(2, 2));
		Assert.assertEquals(6, theIndex.getOffset(3, 1));
		Assert.assertEquals(8, theIndex.getOffset(4, 2));
	}

	/** Tests coordinates that do not address a character */
	@Test
	public void testUnresolvable() {
		Assert.assertEquals(-1, theIndex.getOffset(4, 3));
		Assert.assertEquals(-1, theIndex.getOffset(5, 1));
		Assert.assertEquals(-1, theIndex.getOffset(0, 1));
		Assert.assertEquals(-1, theIndex.getOffset(1, 0));
		Assert.assertEquals(-1, new LineIndex("").getOffset(1, 1));
	}

	/** Tests conversion of offsets to positions */
	@Test
	public void testPositions() {
		assertPosition(theIndex.getPosition(0), 0, 0, 0);
		assertPosition(theIndex.getPosition(2), 2, 0, 2);
		assertPosition(theIndex.getPosition(3), 3, 1, 0);
		assertPosition(theIndex.getPosition(6), 6, 2, 0);
		assertPosition(theIndex.getPosition(9), 9, 3, 2);
		Assert.assertEquals("L4,C3", theIndex.getPosition(9).toString());
		assertPosition(new LineIndex("").getPosition(0), 0, 0, 0);

		for (int offset = 0; offset < theIndex.length(); offset++) {
			FilePosition pos = theIndex.getPosition(offset);
			Assert.assertEquals(offset, theIndex.getOffset(pos.getLineNumber() + 1, pos.getCharNumber() + 1));
		}
	}

	/** Tests that offsets outside the text are rejected */
	@Test(expected = IndexOutOfBoundsException.class)
	public void testPositionOutOfBounds() {
		theIndex.getPosition(10);
	}

	/** Tests the start offsets of lines */
	@Test
	public void testLineStarts() {
		Assert.assertEquals(0, theIndex.getLineStart(1));
		Assert.assertEquals(3, theIndex.getLineStart(2));
		Assert.assertEquals(7, theIndex.getLineStart(4));
		Assert.assertEquals(-1, theIndex.getLineStart(5));
	}

	/** Tests that lone carriage returns end lines and that a "\r\n" sequence ends only one */
	@SuppressWarnings("static-method")
	@Test
	public void testCarriageReturns() {
		LineIndex index = new LineIndex("a\rb\r\nc\r");
		Assert.assertEquals(4, index.getLineCount());
		Assert.assertEquals(0, index.getOffset(1, 1));
		Assert.assertEquals(2, index.getOffset(2, 1));
		Assert.assertEquals(3, index.getOffset(2, 2));
		Assert.assertEquals(5, index.getOffset(3, 1));
		Assert.assertEquals(6, index.getOffset(3, 2));
		Assert.assertEquals(-1, index.getOffset(4, 1));
		assertPosition(index.getPosition(3), 3, 1, 1);
		assertPosition(index.getPosition(5), 5, 2, 0);
		assertPosition(index.getPosition(7), 7, 3, 0);
	}

	private static void assertPosition(FilePosition pos, int offset, int line, int charNumber) {
		Assert.assertEquals(offset, pos.getPosition());
		Assert.assertEquals(line, pos.getLineNumber());
		Assert.assertEquals(charNumber, pos.getCharNumber());
	}
}
