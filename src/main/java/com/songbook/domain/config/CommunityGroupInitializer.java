package com.songbook.domain.config;

import com.songbook.domain.service.GroupService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * 启动时确保社区群存在（配置了 bootstrap-owner-id 才生效）。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommunityGroupInitializer implements ApplicationRunner {

    private final CommunityProperties props;
    private final GroupService groupService;

    @Override
    public void run(ApplicationArguments args) {
        long ownerId = props.getBootstrapOwnerId();
        if (ownerId <= 0) {
            log.info("community group bootstrap skipped: songbook.community.bootstrap-owner-id not set");
            return;
        }
        Long groupId = groupService.ensureSystemGroup(ownerId).getId();
        log.info("community group ready: groupId={}, slug={}", groupId, props.getSlug());
    }
}
