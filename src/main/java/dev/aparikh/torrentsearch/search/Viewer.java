package dev.aparikh.torrentsearch.search;

/**
 * Identity of whoever is looking at a listing, as supplied by the authentication layer.
 */
public record Viewer(Long userId, boolean administrator) {

    public static final Viewer ANONYMOUS = new Viewer(null, false);

    public Viewer {
        if (administrator && userId == null) {
            throw new IllegalArgumentException("administrator must have a user id");
        }
    }

    public static Viewer user(long userId) {
        return new Viewer(userId, false);
    }

    public static Viewer administrator(long userId) {
        return new Viewer(userId, true);
    }

    public boolean isLoggedIn() {
        return userId != null;
    }

    public boolean is(Long otherUserId) {
        return userId != null && userId.equals(otherUserId);
    }
}
