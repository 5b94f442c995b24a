package com.songbook.domain.dto;

import com.songbook.domain.entity.SongEntity;
import com.songbook.domain.enums.ContentType;

import java.util.List;

public record SongSnapshot(
        String title,
        String artist,
        List<String> themes,
        String copyright,
        String lyrics
) implements ContentSnapshot {

    public static SongSnapshot of(SongEntity s) {
        return new SongSnapshot(s.getTitle(), s.getArtist(), copy(s.getThemes()), s.getCopyright(), s.getLyrics());
    }

    /**
     * 以当前快照为底，patch 中非 null 的字段覆盖上来。
     */
    public SongSnapshot merge(SongSnapshot patch) {
        if (patch == null) {
            return this;
        }
        return new SongSnapshot(
                patch.title != null ? patch.title : title,
                patch.artist != null ? patch.artist : artist,
                patch.themes != null ? copy(patch.themes) : themes,
                patch.copyright != null ? patch.copyright : copyright,
                patch.lyrics != null ? patch.lyrics : lyrics
        );
    }

    public void applyTo(SongEntity s) {
        s.setTitle(title);
        s.setArtist(artist);
        s.setThemes(copy(themes));
        s.setCopyright(copyright);
        s.setLyrics(lyrics);
    }

    @Override
    public ContentType contentType() {
        return ContentType.SONG;
    }

    private static List<String> copy(List<String> list) {
        return list == null ? null : List.copyOf(list);
    }
}
