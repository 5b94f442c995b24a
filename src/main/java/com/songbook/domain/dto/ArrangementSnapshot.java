package com.songbook.domain.dto;

import com.songbook.domain.entity.ArrangementEntity;
import com.songbook.domain.enums.ContentType;

import java.util.List;

public record ArrangementSnapshot(
        String name,
        String key,
        Integer tempo,
        Integer capo,
        String timeSignature,
        String chordProContent,
        List<String> tags
) implements ContentSnapshot {

    public static ArrangementSnapshot of(ArrangementEntity a) {
        return new ArrangementSnapshot(a.getName(), a.getMusicalKey(), a.getTempo(), a.getCapo(),
                a.getTimeSignature(), a.getChordProContent(), copy(a.getTags()));
    }

    public ArrangementSnapshot merge(ArrangementSnapshot patch) {
        if (patch == null) {
            return this;
        }
        return new ArrangementSnapshot(
                patch.name != null ? patch.name : name,
                patch.key != null ? patch.key : key,
                patch.tempo != null ? patch.tempo : tempo,
                patch.capo != null ? patch.capo : capo,
                patch.timeSignature != null ? patch.timeSignature : timeSignature,
                patch.chordProContent != null ? patch.chordProContent : chordProContent,
                patch.tags != null ? copy(patch.tags) : tags
        );
    }

    public void applyTo(ArrangementEntity a) {
        a.setName(name);
        a.setMusicalKey(key);
        a.setTempo(tempo);
        a.setCapo(capo);
        a.setTimeSignature(timeSignature);
        a.setChordProContent(chordProContent);
        a.setTags(copy(tags));
    }

    @Override
    public ContentType contentType() {
        return ContentType.ARRANGEMENT;
    }

    private static List<String> copy(List<String> list) {
        return list == null ? null : List.copyOf(list);
    }
}
