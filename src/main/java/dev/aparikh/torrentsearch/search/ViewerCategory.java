package dev.aparikh.torrentsearch.search;

/**
 * How a viewer relates to the listing being requested.
 */
public enum ViewerCategory {
    ANONYMOUS,
    /** Logged-in viewer looking at their own uploads. */
    OWNER,
    /** Logged-in viewer looking at someone else's uploads, or at the general listing. */
    OTHER_USER,
    ADMINISTRATOR;

    public static ViewerCategory of(Viewer viewer, Long targetUserId) {
        if (viewer.administrator()) {
            return ADMINISTRATOR;
        }
        if (!viewer.isLoggedIn()) {
            return ANONYMOUS;
        }
        return targetUserId != null && viewer.is(targetUserId) ? OWNER : OTHER_USER;
    }
}
