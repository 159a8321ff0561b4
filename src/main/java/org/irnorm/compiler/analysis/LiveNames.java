package org.irnorm.compiler.analysis;

/**
 * Liveness threaded outward across nested blocks. Each link pairs a block's {@link UsageIndex}
 * with the index of the first statement after the current point.
 *
 * @param index The usage index of the block.
 * @param position The first statement index after the current point.
 * @param outer The enclosing block's link, or {@code null} at function level.
 */
public record LiveNames(UsageIndex index, int position, LiveNames outer) {

    /**
     * @param index The block's index.
     * @param position The first statement index after the current point.
     * @return A link with no enclosing block.
     */
    public static LiveNames root(UsageIndex index, int position) {
        return new LiveNames(index, position, null);
    }

    /**
     * @param inner The nested block's index.
     * @param innerPosition The first statement index after the current point in the nested block.
     * @return A link for the nested block whose outer link is this one.
     */
    public LiveNames enter(UsageIndex inner, int innerPosition) {
        return new LiveNames(inner, innerPosition, this);
    }

    /**
     * @param newPosition The new position in the same block.
     * @return This link moved to another statement.
     */
    public LiveNames at(int newPosition) {
        return new LiveNames(index, newPosition, outer);
    }

    /**
     * A name is live if this block reads it before rebinding it, or if this block never rebinds it
     * and an enclosing block reads it after the current point.
     * @param name A variable name.
     * @return {@code true} if the current binding may still be read.
     */
    public boolean isLive(String name) {
        if (index.readBeforeRebind(position, name)) {
            return true;
        }
        if (index.reboundFrom(position, name)) {
            return false;
        }
        return outer != null && outer.isLive(name);
    }
}
