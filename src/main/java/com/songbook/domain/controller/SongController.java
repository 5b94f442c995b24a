package com.songbook.domain.controller;

import com.songbook.auth.web.AuthContext;
import com.songbook.common.api.Result;
import com.songbook.common.ratelimit.RateLimit;
import com.songbook.common.ratelimit.RateLimitKey;
import com.songbook.domain.dto.SongSnapshot;
import com.songbook.domain.entity.ContentCollaboratorEntity;
import com.songbook.domain.entity.SongEntity;
import com.songbook.domain.enums.ContentType;
import com.songbook.domain.enums.OwnerType;
import com.songbook.domain.service.ContentOwnershipService;
import com.songbook.domain.service.SongService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RequiredArgsConstructor
@RestController
@RequestMapping("/song")
public class SongController {

    private final SongService songService;
    private final ContentOwnershipService ownershipService;

    public record CreateSongRequest(
            @NotBlank(message = "missing_title") @Size(max = 200, message = "title_too_long") String title,
            String artist,
            List<@NotBlank String> themes,
            String copyright,
            String lyrics,
            String slug,
            String ownerType,
            String ownerId
    ) {
    }

    public record UpdateSongRequest(
            @NotNull(message = "missing_song_id") Long songId,
            @Size(max = 200, message = "title_too_long") String title,
            String artist,
            List<@NotBlank String> themes,
            String copyright,
            String lyrics
    ) {
    }

    public record SongIdRequest(
            @NotNull(message = "missing_song_id") Long songId
    ) {
    }

    public record CollaboratorRequest(
            @NotNull(message = "missing_song_id") Long songId,
            @NotNull(message = "missing_user_id") Long userId
    ) {
    }

    @GetMapping("/get")
    public Result<SongEntity> get(@RequestParam long songId) {
        return Result.ok(songService.requireSong(songId));
    }

    @GetMapping("/by-slug")
    public Result<SongEntity> bySlug(@RequestParam String slug) {
        return Result.ok(songService.getBySlug(slug));
    }

    @PostMapping("/create")
    @RateLimit(name = "song_create", windowSeconds = 60, max = 10, key = RateLimitKey.USER)
    public Result<SongEntity> create(@Valid @RequestBody CreateSongRequest req) {
        SongSnapshot fields = new SongSnapshot(req.title(), req.artist(), req.themes() == null ? List.of() : req.themes(),
                req.copyright(), req.lyrics());
        return Result.ok(songService.create(AuthContext.currentActor(), fields, req.slug(),
                OwnerTypes.parse(req.ownerType()), req.ownerId()));
    }

    @PostMapping("/update")
    public Result<SongEntity> update(@Valid @RequestBody UpdateSongRequest req) {
        SongSnapshot patch = new SongSnapshot(req.title(), req.artist(), req.themes(), req.copyright(), req.lyrics());
        return Result.ok(songService.update(AuthContext.currentActor(), req.songId(), patch));
    }

    @PostMapping("/transfer-to-community")
    public Result<SongEntity> transferToCommunity(@Valid @RequestBody SongIdRequest req) {
        return Result.ok(songService.transferToCommunity(AuthContext.currentActor(), req.songId()));
    }

    @PostMapping("/reclaim")
    public Result<SongEntity> reclaim(@Valid @RequestBody SongIdRequest req) {
        return Result.ok(songService.reclaimFromCommunity(AuthContext.currentActor(), req.songId()));
    }

    @GetMapping("/edit-access")
    public Result<ContentOwnershipService.EditAccess> editAccess(@RequestParam long songId) {
        return Result.ok(songService.editAccess(AuthContext.currentActor(), songId));
    }

    @GetMapping("/collaborators")
    public Result<List<ContentCollaboratorEntity>> collaborators(@RequestParam long songId) {
        songService.requireSong(songId);
        return Result.ok(ownershipService.listCollaborators(ContentType.SONG, songId));
    }

    @PostMapping("/collaborator/add")
    public Result<ContentCollaboratorEntity> addCollaborator(@Valid @RequestBody CollaboratorRequest req) {
        SongEntity song = songService.requireSong(req.songId());
        return Result.ok(ownershipService.addCollaborator(AuthContext.currentActor(), song, req.userId()));
    }

    @PostMapping("/collaborator/remove")
    public Result<Void> removeCollaborator(@Valid @RequestBody CollaboratorRequest req) {
        SongEntity song = songService.requireSong(req.songId());
        ownershipService.removeCollaborator(AuthContext.currentActor(), song, req.userId());
        return Result.okVoid();
    }
}
