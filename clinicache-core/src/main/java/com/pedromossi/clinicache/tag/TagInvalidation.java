package com.pedromossi.clinicache.tag;

/**
 * Outcome of invalidating one tag: either deferred by an active batch or applied
 * with the number of entries it removed.
 *
 * @since 1.0.0
 */
public final class TagInvalidation {

    private final String tag;
    private final int removedCount;
    private final boolean deferred;

    private TagInvalidation(String tag, int removedCount, boolean deferred) {
        this.tag = tag;
        this.removedCount = removedCount;
        this.deferred = deferred;
    }

    public static TagInvalidation deferred(String tag) {
        return new TagInvalidation(tag, 0, true);
    }

    public static TagInvalidation applied(String tag, int removedCount) {
        return new TagInvalidation(tag, removedCount, false);
    }

    public String getTag() {
        return tag;
    }

    public int getRemovedCount() {
        return removedCount;
    }

    public boolean isDeferred() {
        return deferred;
    }

    @Override
    public String toString() {
        return deferred ? "TagInvalidation{" + tag + ", deferred}" : "TagInvalidation{" + tag + ", removed=" + removedCount + "}";
    }
}
