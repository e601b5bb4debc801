package com.jay.fundrater.model;

/**
 * Share-count change in percent.
 * {@code changeYoY} is null when a split or reverse split makes the raw figure meaningless.
 */
public record ShareChange(Double changeQoQ,
                          Double changeYoY,
                          Double rawYoY,
                          SplitSignal split,
                          SplitSignal reverseSplit) {

    public static ShareChange none() {
        return new ShareChange(null, null, null, null, null);
    }

    public boolean likelySplit()        { return split != null; }
    public boolean likelyReverseSplit() { return reverseSplit != null; }
}
