package dev.aparikh.torrentsearch.search;

/**
 * Which otherwise suppressed torrents a listing may contain.
 *
 * @param restrictToOwnerOrVisible hidden torrents are excluded unless uploaded by the viewer
 */
public record Visibility(
        boolean includeDeleted,
        boolean includeHidden,
        boolean includeAnonymous,
        boolean restrictToOwnerOrVisible
) {
}
