package com.repo.quality.git;

/**
 * Window of history between an older and a newer revision. Either end may be null.
 */
public record CommitRange(String olderRevision, String newerRevision) {

    public static final String HEAD = "HEAD";

    public CommitRange {
        olderRevision = blankToNull(olderRevision);
        newerRevision = blankToNull(newerRevision);
    }

    /**
     * All history reachable from HEAD.
     */
    public static CommitRange all() {
        return new CommitRange(null, null);
    }

    public boolean hasOlder() {
        return olderRevision != null;
    }

    /**
     * Revision the walk starts from, HEAD when no newer end is given.
     */
    public String newerOrHead() {
        return newerRevision != null ? newerRevision : HEAD;
    }

    /**
     * Git revision expression for this range: "older..newer", "older..HEAD", "newer" or "HEAD".
     */
    public String describe() {
        if (olderRevision != null)
            return olderRevision + ".." + newerOrHead();
        return newerOrHead();
    }

    private static String blankToNull(String revision) {
        if (revision == null || revision.trim().isEmpty())
            return null;
        return revision.trim();
    }
}
