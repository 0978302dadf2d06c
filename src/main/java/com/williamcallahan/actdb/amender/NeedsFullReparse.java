package com.williamcallahan.actdb.amender;

/**
 * Whether an applied modification invalidated the semantic info of the whole act.
 */
public enum NeedsFullReparse {
    NO,
    YES;

    public static NeedsFullReparse of(boolean abbreviationsChanged) {
        return abbreviationsChanged ? YES : NO;
    }

    public NeedsFullReparse or(NeedsFullReparse other) {
        return this == YES || other == YES ? YES : NO;
    }
}
