package com.govledger.domain;

/**
 * Yes/no shares of a tally in basis points: 10000 == 100.00%.
 *
 * Both values are floored independently, so their sum may fall short of
 * 10000. That loss is kept as-is and never redistributed.
 */
public record VotePercentages(long yesPct, long noPct) {

    public static final long SCALE = 10_000L;

    public static final VotePercentages NONE = new VotePercentages(0, 0);

    /**
     * @param yesCount yes votes, non-negative
     * @param noCount  no votes, non-negative
     * @return (0, 0) when nobody voted, otherwise floor(count * 10000 / total) for each side
     */
    public static VotePercentages of(long yesCount, long noCount) {
        if (yesCount < 0 || noCount < 0) {
            throw new IllegalArgumentException("Vote counts cannot be negative");
        }
        long total = yesCount + noCount;
        if (total == 0) {
            return NONE;
        }
        return new VotePercentages(yesCount * SCALE / total, noCount * SCALE / total);
    }
}
