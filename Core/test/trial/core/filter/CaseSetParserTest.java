package trial.core.filter;

import org.junit.Assert;
import org.junit.Test;
import trial.core.exception.ParseException;
import trial.core.helper.AssertHelper;

import java.util.Arrays;

public class CaseSetParserTest {

    @Test
    public void testSingleIndex() throws Exception {
        Assert.assertEquals(CaseSelection.ofIndices(5), CaseSetParser.parse("5"));
    }

    @Test
    public void testMixedListAndRanges() throws Exception {
        CaseSelection selection = CaseSetParser.parse("4,6-10,19");

        Assert.assertEquals(Arrays.asList(CaseSelection.Range.of(4, 4), CaseSelection.Range.of(6, 10), CaseSelection.Range.of(19, 19)), selection.getRanges());
        for (int index : new int[]{ 4, 6, 7, 8, 9, 10, 19 }) {
            Assert.assertTrue(selection.contains(index));
        }
        for (int index : new int[]{ 0, 3, 5, 11, 18, 20 }) {
            Assert.assertFalse(selection.contains(index));
        }
    }

    @Test
    public void testDottedRange() throws Exception {
        Assert.assertEquals(CaseSelection.of(Arrays.asList(CaseSelection.Range.of(1, 3))), CaseSetParser.parse("1..3"));
    }

    @Test
    public void testOverlappingRanges() throws Exception {
        CaseSelection selection = CaseSetParser.parse("0-2,1-3,2");
        for (int index = 0; index <= 3; index++) {
            Assert.assertTrue(selection.contains(index));
        }
        Assert.assertFalse(selection.contains(4));
    }

    @Test
    public void testSingletonRange() throws Exception {
        Assert.assertEquals(CaseSelection.ofIndices(7), CaseSetParser.parse("7-7"));
    }

    @Test(timeout = 5_000)
    public void testRangeEndingAtTheLargestIndex() throws Exception {
        CaseSelection selection = CaseSetParser.parse("2147483646-2147483647");

        Assert.assertTrue(selection.contains(Integer.MAX_VALUE));
        Assert.assertTrue(selection.contains(Integer.MAX_VALUE - 1));
        Assert.assertFalse(selection.contains(0));
    }

    @Test(timeout = 5_000)
    public void testWideRange() throws Exception {
        CaseSelection selection = CaseSetParser.parse("0-100000000");

        Assert.assertTrue(selection.contains(0));
        Assert.assertTrue(selection.contains(100_000_000));
        Assert.assertFalse(selection.contains(100_000_001));
    }

    @Test
    public void testMalformedSelections() {
        for (String selection : Arrays.asList("", "a", "1,,2", "1-", "-3", "5-2", "1-2-3", "1..2..3", "1.5", "2147483648")) {
            ParseException e = AssertHelper.assertThrows(ParseException.class, () -> CaseSetParser.parse(selection));
            Assert.assertEquals("must be a comma-separated list of integers / integer ranges", e.getMessage());
        }
    }
}
