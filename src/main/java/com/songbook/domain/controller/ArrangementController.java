package com.songbook.domain.controller;

import com.songbook.auth.web.AuthContext;
import com.songbook.common.api.Result;
import com.songbook.common.ratelimit.RateLimit;
import com.songbook.common.ratelimit.RateLimitKey;
import com.songbook.domain.dto.ArrangementSnapshot;
import com.songbook.domain.entity.ArrangementEntity;
import com.songbook.domain.entity.ContentCollaboratorEntity;
import com.songbook.domain.enums.ContentType;
import com.songbook.domain.service.ArrangementService;
import com.songbook.domain.service.ContentOwnershipService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
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
@RequestMapping("/arrangement")
public class ArrangementController {

    private final ArrangementService arrangementService;
    private final ContentOwnershipService ownershipService;

    public record CreateArrangementRequest(
            @NotNull(message = "missing_song_id") Long songId,
            @NotBlank(message = "missing_name") @Size(max = 200, message = "name_too_long") String name,
            String key,
            @Min(value = 1, message = "bad_tempo") @Max(value = 400, message = "bad_tempo") Integer tempo,
            @Min(value = 0, message = "bad_capo") @Max(value = 12, message = "bad_capo") Integer capo,
            String timeSignature,
            String chordProContent,
            List<@NotBlank String> tags,
            String slug,
            String ownerType,
            String ownerId
    ) {
    }

    public record UpdateArrangementRequest(
            @NotNull(message = "missing_arrangement_id") Long arrangementId,
            @Size(max = 200, message = "name_too_long") String name,
            String key,
            @Min(value = 1, message = "bad_tempo") @Max(value = 400, message = "bad_tempo") Integer tempo,
            @Min(value = 0, message = "bad_capo") @Max(value = 12, message = "bad_capo") Integer capo,
            String timeSignature,
            String chordProContent,
            List<@NotBlank String> tags
    ) {
    }

    public record ArrangementIdRequest(
            @NotNull(message = "missing_arrangement_id") Long arrangementId
    ) {
    }

    public record CollaboratorRequest(
            @NotNull(message = "missing_arrangement_id") Long arrangementId,
            @NotNull(message = "missing_user_id") Long userId
    ) {
    }

    @GetMapping("/get")
    public Result<ArrangementEntity> get(@RequestParam long arrangementId) {
        return Result.ok(arrangementService.requireArrangement(arrangementId));
    }

    @GetMapping("/by-slug")
    public Result<ArrangementEntity> bySlug(@RequestParam String slug) {
        return Result.ok(arrangementService.getBySlug(slug));
    }

    @GetMapping("/by-song")
    public Result<List<ArrangementEntity>> bySong(@RequestParam long songId) {
        return Result.ok(arrangementService.listBySong(songId));
    }

    @PostMapping("/create")
    @RateLimit(name = "arrangement_create", windowSeconds = 60, max = 10, key = RateLimitKey.USER)
    public Result<ArrangementEntity> create(@Valid @RequestBody CreateArrangementRequest req) {
        ArrangementSnapshot fields = new ArrangementSnapshot(req.name(), req.key(), req.tempo(), req.capo(),
                req.timeSignature(), req.chordProContent(), req.tags() == null ? List.of() : req.tags());
        return Result.ok(arrangementService.create(AuthContext.currentActor(), req.songId(), fields, req.slug(),
                OwnerTypes.parse(req.ownerType()), req.ownerId()));
    }

    @PostMapping("/update")
    public Result<ArrangementEntity> update(@Valid @RequestBody UpdateArrangementRequest req) {
        ArrangementSnapshot patch = new ArrangementSnapshot(req.name(), req.key(), req.tempo(), req.capo(),
                req.timeSignature(), req.chordProContent(), req.tags());
        return Result.ok(arrangementService.update(AuthContext.currentActor(), req.arrangementId(), patch));
    }

    @PostMapping("/transfer-to-community")
    public Result<ArrangementEntity> transferToCommunity(@Valid @RequestBody ArrangementIdRequest req) {
        return Result.ok(arrangementService.transferToCommunity(AuthContext.currentActor(), req.arrangementId()));
    }

    @PostMapping("/reclaim")
    public Result<ArrangementEntity> reclaim(@Valid @RequestBody ArrangementIdRequest req) {
        return Result.ok(arrangementService.reclaimFromCommunity(AuthContext.currentActor(), req.arrangementId()));
    }

    @GetMapping("/edit-access")
    public Result<ContentOwnershipService.EditAccess> editAccess(@RequestParam long arrangementId) {
        return Result.ok(arrangementService.editAccess(AuthContext.currentActor(), arrangementId));
    }

    @GetMapping("/collaborators")
    public Result<List<ContentCollaboratorEntity>> collaborators(@RequestParam long arrangementId) {
        arrangementService.requireArrangement(arrangementId);
        return Result.ok(ownershipService.listCollaborators(ContentType.ARRANGEMENT, arrangementId));
    }

    @PostMapping("/collaborator/add")
    public Result<ContentCollaboratorEntity> addCollaborator(@Valid @RequestBody CollaboratorRequest req) {
        ArrangementEntity a = arrangementService.requireArrangement(req.arrangementId());
        return Result.ok(ownershipService.addCollaborator(AuthContext.currentActor(), a, req.userId()));
    }

    @PostMapping("/collaborator/remove")
    public Result<Void> removeCollaborator(@Valid @RequestBody CollaboratorRequest req) {
        ArrangementEntity a = arrangementService.requireArrangement(req.arrangementId());
        ownershipService.removeCollaborator(AuthContext.currentActor(), a, req.userId());
        return Result.okVoid();
    }
}
