package com.rebenew.watchParty.syncserver.controller;

import com.rebenew.watchParty.syncserver.core.PlaybackClock;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class StatusController {

    private final PlaybackClock clock;

    public StatusController(PlaybackClock clock) {
        this.clock = clock;
    }

    @GetMapping("/")
    public Map<String, Object> root() {
        return Map.of("ok", true, "service", "watch-party-sync", "ts_ms", clock.currentTimeMillis());
    }
}
