package com.missionforge.core.reconcile;

/**
 * DriftError: how far the property's task count is from the mission's.
 *
 * moreOrFewer is stated from the property's side: MORE means the property
 * describes more tasks than the mission does.
 */
public class DriftError {

    public enum Direction {
        MORE,
        FEWER
    }

    private final Direction moreOrFewer;
    private final int       delta;
    private final int       missionTaskCount;
    private final int       propertyTaskCount;

    public DriftError(int missionTaskCount, int propertyTaskCount) {
        this.missionTaskCount  = missionTaskCount;
        this.propertyTaskCount = propertyTaskCount;
        this.moreOrFewer       = propertyTaskCount > missionTaskCount ? Direction.MORE : Direction.FEWER;
        this.delta             = Math.abs(missionTaskCount - propertyTaskCount);
    }

    public Direction getMoreOrFewer() {
        return moreOrFewer;
    }

    public int getDelta() {
        return delta;
    }

    public int getMissionTaskCount() {
        return missionTaskCount;
    }

    public int getPropertyTaskCount() {
        return propertyTaskCount;
    }

    /** Drift explanation handed to the property generator. */
    public String describe() {
        return String.format(
                "The property describes %d %s task(s) than the mission plan (property: %d, mission: %d).",
                delta, moreOrFewer == Direction.MORE ? "more" : "fewer",
                propertyTaskCount, missionTaskCount);
    }

    @Override
    public String toString() {
        return "DriftError{moreOrFewer=" + moreOrFewer + ", delta=" + delta + "}";
    }
}
