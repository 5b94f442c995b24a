package com.songbook.domain.service;

import com.songbook.domain.dto.ArrangementSnapshot;
import com.songbook.domain.dto.ContentSnapshot;
import com.songbook.domain.dto.SongSnapshot;
import com.songbook.domain.entity.ArrangementEntity;
import com.songbook.domain.entity.SongEntity;
import com.songbook.domain.enums.ContentType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContentSnapshotCodecTest {

    private final ContentSnapshotCodec codec = new ContentSnapshotCodec();

    private static SongEntity song(String lyrics) {
        SongEntity s = new SongEntity();
        s.setId(1L);
        s.setTitle("Amazing Grace");
        s.setArtist("John Newton");
        s.setThemes(List.of("grace", "hymn"));
        s.setLyrics(lyrics);
        s.setSlug("amazing-grace");
        s.setCreatedBy(5L);
        return s;
    }

    @Test
    void encode_ShouldBeStableAndIgnoreNonVersionedFields() {
        SongEntity a = song("Amazing grace, how sweet the sound");
        SongEntity b = song("Amazing grace, how sweet the sound");
        b.setId(2L);
        b.setSlug("other-slug");
        b.setCreatedBy(9L);

        assertThat(codec.encode(codec.snapshotOf(a))).isEqualTo(codec.encode(codec.snapshotOf(b)));
        assertThat(codec.encode(codec.snapshotOf(a))).isNotEqualTo(codec.encode(codec.snapshotOf(song("changed"))));
    }

    @Test
    void encode_ShouldOmitNullFields() {
        String json = codec.encode(codec.snapshotOf(song(null)));

        assertThat(json).contains("\"title\":\"Amazing Grace\"");
        assertThat(json).doesNotContain("lyrics");
        assertThat(json).doesNotContain("copyright");
        assertThat(json).doesNotContain("contentType");
    }

    @Test
    void decode_ShouldRestoreSnapshotAndApplyToEntity() {
        SongSnapshot original = SongSnapshot.of(song("verse one"));
        ContentSnapshot decoded = codec.decode(ContentType.SONG, codec.encode(original));
        assertThat(decoded).isEqualTo(original);

        SongEntity target = song("something else");
        target.setArtist(null);
        codec.apply(decoded, target);
        assertThat(target.getLyrics()).isEqualTo("verse one");
        assertThat(target.getArtist()).isEqualTo("John Newton");
        assertThat(target.getSlug()).isEqualTo("amazing-grace");
    }

    @Test
    void arrangementSnapshot_ShouldMapKeyToMusicalKey() {
        ArrangementEntity a = new ArrangementEntity();
        a.setName("Acoustic");
        a.setMusicalKey("G");
        a.setTempo(72);
        a.setTags(List.of("acoustic"));

        ArrangementSnapshot snap = (ArrangementSnapshot) codec.decode(ContentType.ARRANGEMENT,
                codec.encode(codec.snapshotOf(a)));
        assertThat(snap.key()).isEqualTo("G");

        ArrangementEntity target = new ArrangementEntity();
        codec.apply(snap.merge(new ArrangementSnapshot(null, "A", null, 2, null, null, null)), target);
        assertThat(target.getMusicalKey()).isEqualTo("A");
        assertThat(target.getCapo()).isEqualTo(2);
        assertThat(target.getTempo()).isEqualTo(72);
        assertThat(target.getName()).isEqualTo("Acoustic");
    }

    @Test
    void apply_ShouldRejectMismatchedTypes() {
        SongSnapshot snap = SongSnapshot.of(song("x"));
        assertThatThrownBy(() -> codec.apply(snap, new ArrangementEntity()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("snapshot_type_mismatch");
    }
}
