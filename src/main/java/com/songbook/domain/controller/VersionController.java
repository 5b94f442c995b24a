package com.songbook.domain.controller;

import com.songbook.auth.web.AuthContext;
import com.songbook.common.api.Result;
import com.songbook.domain.entity.ContentVersionEntity;
import com.songbook.domain.enums.ContentType;
import com.songbook.domain.service.ContentVersionService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
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
@RequestMapping("/version")
public class VersionController {

    private final ContentVersionService versionService;

    public record RollbackRequest(
            @NotBlank(message = "missing_content_type") String contentType,
            @NotNull(message = "missing_content_id") Long contentId,
            @NotNull(message = "missing_version") @Min(value = 1, message = "bad_version") Integer version
    ) {
    }

    @GetMapping("/history")
    public Result<List<ContentVersionEntity>> history(@RequestParam String contentType,
                                                      @RequestParam long contentId,
                                                      @RequestParam(required = false) Integer limit) {
        return Result.ok(versionService.history(AuthContext.currentActor(), parseType(contentType), contentId, limit));
    }

    @GetMapping("/get")
    public Result<ContentVersionEntity> get(@RequestParam String contentType,
                                            @RequestParam long contentId,
                                            @RequestParam int version) {
        return Result.ok(versionService.getVersion(AuthContext.currentActor(), parseType(contentType), contentId, version));
    }

    @GetMapping("/can-access")
    public Result<Boolean> canAccess(@RequestParam String contentType, @RequestParam long contentId) {
        return Result.ok(versionService.canAccessHistory(AuthContext.currentActor(), parseType(contentType), contentId));
    }

    @PostMapping("/rollback")
    public Result<ContentVersionService.RollbackResult> rollback(@Valid @RequestBody RollbackRequest req) {
        return Result.ok(versionService.rollback(AuthContext.currentActor(), parseType(req.contentType()),
                req.contentId(), req.version()));
    }

    private static ContentType parseType(String raw) {
        ContentType t = ContentType.fromString(raw);
        if (t == null) {
            throw new IllegalArgumentException("bad_content_type");
        }
        return t;
    }
}
