package org.proxml.xml;

import org.junit.Assert;
import org.junit.Test;

import com.google.common.collect.Range;

/** Tests {@link RangeMapping} */
public class RangeMappingTest {
	/** Tests translation of normalized indexes and comparison of mapped characters */
	@SuppressWarnings("static-method")
	@Test
	public void testRangeMapping() {
		String source = "<root><p>Hello</p></root>";
		RangeMapping mapping = new RangeMapping(9, 0, 5);
		Assert.assertEquals(Range.closedOpen(9, 14), mapping.getOriginalRange());
		Assert.assertEquals(Range.closedOpen(0, 5), mapping.getNormalizedRange());
		Assert.assertEquals(14, mapping.getOriginalEnd());
		Assert.assertEquals(5, mapping.getNormalizedEnd());
		Assert.assertEquals(5, mapping.length());
		Assert.assertEquals(11, mapping.toOriginal(2));
		Assert.assertEquals(-1, mapping.toOriginal(5));
		Assert.assertTrue(mapping.isConsistent(source, "Hello"));
		Assert.assertFalse(mapping.isConsistent(source, "Hallo"));
		Assert.assertFalse(mapping.isConsistent(source, "Hell"));
		Assert.assertFalse(new RangeMapping(20, 0, 10).isConsistent(source, "0123456789"));
	}

	/** Tests equality of mappings */
	@SuppressWarnings("static-method")
	@Test
	public void testEquality() {
		RangeMapping mapping = new RangeMapping(9, 0, 5);
		Assert.assertEquals(new RangeMapping(9, 0, 5), mapping);
		Assert.assertEquals(mapping.hashCode(), new RangeMapping(9, 0, 5).hashCode());
		Assert.assertNotEquals(mapping, new RangeMapping(9, 1, 5));
		Assert.assertNotEquals(mapping, new RangeMapping(8, 0, 5));
		Assert.assertNotEquals(mapping, new RangeMapping(9, 0, 4));
	}
}
