package trial.core.filter;

import trial.core.exception.ParseException;
import trial.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses a selection of test case indices such as {@code 4,6-10,19}: a comma-separated list of integers and inclusive
 * ranges. A range may be written {@code a-b} or {@code a..b}, and its lower bound must not exceed its upper bound.
 */
public final class CaseSetParser {
    private static final String FORMAT_ERROR = "must be a comma-separated list of integers / integer ranges";

    private CaseSetParser() {}

    /**
     * Parses the specified selection.
     *
     * @param selection The selection.
     * @return the selected indices.
     * @throws ParseException If the selection is malformed.
     */
    public static CaseSelection parse(String selection) throws ParseException {
        ObjectChecker.assertNonNull(selection);

        List<CaseSelection.Range> ranges = new ArrayList<>();
        for (String range : selection.split(",", -1)) {
            String[] bounds = splitRange(range.trim());
            int lower = parseBound(bounds[0]);
            int upper = (bounds.length == 1) ? lower : parseBound(bounds[1]);
            if (lower > upper) {
                throw new ParseException(FORMAT_ERROR);
            }
            ranges.add(CaseSelection.Range.of(lower, upper));
        }
        return CaseSelection.of(ranges);
    }

    private static String[] splitRange(String range) throws ParseException {
        String[] bounds = range.contains("..") ? range.split("\\.\\.", -1) : range.split("-", -1);
        if (bounds.length > 2) {
            throw new ParseException(FORMAT_ERROR);
        }
        return bounds;
    }

    private static int parseBound(String bound) throws ParseException {
        try {
            int value = Integer.parseInt(bound.trim());
            if (value < 0) {
                throw new ParseException(FORMAT_ERROR);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new ParseException(FORMAT_ERROR);
        }
    }
}
