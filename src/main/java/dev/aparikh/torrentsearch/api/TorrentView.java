package dev.aparikh.torrentsearch.api;

import dev.aparikh.torrentsearch.model.Torrent;
import dev.aparikh.torrentsearch.model.TorrentFlag;
import dev.aparikh.torrentsearch.search.Viewer;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * A torrent as shown to one viewer. The uploader of an anonymous upload is only
 * revealed to administrators and to the uploader.
 */
@Schema(description = "Torrent listing entry")
public record TorrentView(
        @Schema(description = "Torrent id", example = "1")
        long id,

        @Schema(description = "Display name", example = "Hello World 1080p")
        String displayName,

        @Schema(description = "Uploader user id, absent for anonymous uploads", example = "5")
        Long uploaderId,

        @Schema(description = "Flag bitmask", example = "0")
        int flags,

        @Schema(description = "Main category id", example = "1")
        int mainCategoryId,

        @Schema(description = "Sub category id", example = "2")
        int subCategoryId,

        @Schema(description = "Size in bytes", example = "1048576")
        long filesize,

        @Schema(description = "Number of comments", example = "0")
        int commentCount,

        @Schema(description = "Seeders", example = "10")
        long seeders,

        @Schema(description = "Leechers", example = "2")
        long leechers,

        @Schema(description = "Completed downloads", example = "100")
        long downloads,

        @Schema(description = "Display name with matched terms highlighted, when available")
        String highlightedName
) {
    public static TorrentView of(Torrent torrent, Viewer viewer) {
        Long uploader = torrent.uploaderId();
        if (torrent.has(TorrentFlag.ANONYMOUS) && !viewer.administrator() && !viewer.is(uploader)) {
            uploader = null;
        }
        return new TorrentView(
                torrent.id(),
                torrent.displayName(),
                uploader,
                torrent.flags(),
                torrent.mainCategoryId(),
                torrent.subCategoryId(),
                torrent.filesize(),
                torrent.commentCount(),
                torrent.seeders(),
                torrent.leechers(),
                torrent.downloads(),
                torrent.highlightedName()
        );
    }
}
