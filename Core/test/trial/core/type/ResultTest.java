package trial.core.type;

import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;

public class ResultTest {

    @Test
    public void testSuccessfulResultHoldsData() {
        Result<String> result = Result.successful("data");
        Assert.assertTrue(result.isSuccess());
        Assert.assertEquals("data", result.getData());
        Assert.assertNull(result.getError());
        Assert.assertTrue(result.getErrors().isEmpty());
    }

    @Test
    public void testErrorsAccumulateInOrder() {
        Result<String> result = Result.successful("data").withError("first").withError("second");
        Assert.assertFalse(result.isSuccess());
        Assert.assertNull(result.getData());
        Assert.assertEquals("first", result.getError());
        Assert.assertEquals(Arrays.asList("first", "second"), result.getErrors());
    }

    @Test
    public void testAccumulatingDoesNotAlterTheOriginal() {
        Result<String> original = Result.error("first");
        original.withError("second");
        Assert.assertEquals(Arrays.asList("first"), original.getErrors());
    }
}
