package dev.aparikh.torrentsearch.search;

/**
 * The deleted/hidden/anonymous visibility matrix. Both backends derive their visibility
 * predicates from this class only.
 * <ul>
 *     <li>Administrators see everything.</li>
 *     <li>Everybody else never sees deleted torrents.</li>
 *     <li>On a user's listing, the owner sees their hidden and anonymous uploads outside of feeds;
 *     anybody else, and every feed, only sees uploads that are neither hidden nor anonymous.</li>
 *     <li>On the general listing, logged-in viewers outside of feeds see torrents that are not hidden
 *     or that they uploaded; anonymous viewers and feeds see non-hidden torrents only.</li>
 * </ul>
 */
public final class VisibilityPolicy {

    private static final Visibility EVERYTHING = new Visibility(true, true, true, false);

    private VisibilityPolicy() {
    }

    public static Visibility resolve(ViewerCategory category, boolean targetUserView, boolean feedView) {
        if (category == ViewerCategory.ADMINISTRATOR) {
            return EVERYTHING;
        }
        if (targetUserView) {
            boolean ownListing = category == ViewerCategory.OWNER && !feedView;
            return new Visibility(false, ownListing, ownListing, false);
        }
        if (category != ViewerCategory.ANONYMOUS && !feedView) {
            return new Visibility(false, false, true, true);
        }
        return new Visibility(false, false, true, false);
    }

    public static Visibility resolve(Viewer viewer, SearchRequest request) {
        return resolve(request.viewerCategory(viewer), request.targetUserId() != null, request.feedView());
    }
}
