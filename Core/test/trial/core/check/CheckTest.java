package trial.core.check;

import org.hamcrest.Matchers;
import org.junit.Assert;
import org.junit.Test;
import trial.core.helper.AssertHelper;

public class CheckTest {

    @Test
    public void testEqualValuesPass() {
        Check.equal("sum", 2, 1 + 1);
        Check.equal("nothing", null, null);
    }

    @Test
    public void testUnequalValuesFail() {
        CheckFailedException e = AssertHelper.assertThrows(CheckFailedException.class, () -> Check.equal("sum", 3, 1 + 1));
        Assert.assertEquals("Error sum: expecting 3, got 2.", e.getMessage());
    }

    @Test
    public void testCheckFailuresAreAssertionErrors() {
        CheckFailedException e = AssertHelper.assertThrows(CheckFailedException.class, () -> Check.fail("nope"));
        Assert.assertTrue(e instanceof AssertionError);
        Assert.assertEquals("nope", e.getMessage());
    }

    @Test
    public void testMatcherPasses() {
        Check.that("greeting", "hello world", Matchers.startsWith("hello"));
    }

    @Test
    public void testMatcherFailureDescribesMismatch() {
        CheckFailedException e = AssertHelper.assertThrows(CheckFailedException.class, () -> Check.that("size", 4, Matchers.greaterThan(10)));
        Assert.assertTrue(e.getMessage().startsWith("Error size: expecting a value greater than <10>, but "));
        Assert.assertTrue(e.getMessage().endsWith("."));
    }

    @Test
    public void testTodoAndSkip() {
        PendingTestException pending = AssertHelper.assertThrows(PendingTestException.class, () -> Check.todo("write it"));
        Assert.assertEquals("write it", pending.getMessage());
        AssertHelper.assertThrows(SkippedTestException.class, Check::skip);
    }
}
