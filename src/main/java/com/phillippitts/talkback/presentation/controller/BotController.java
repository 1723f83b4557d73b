package com.phillippitts.talkback.presentation.controller;

import com.phillippitts.talkback.config.properties.BotProperties;
import com.phillippitts.talkback.service.bot.BotPersonalityRepository;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only view of the bot personalities on disk.
 */
@RestController
@RequestMapping("/api/bots")
class BotController {

    private final BotPersonalityRepository repository;
    private final BotProperties botProperties;

    BotController(BotPersonalityRepository repository, BotProperties botProperties) {
        this.repository = repository;
        this.botProperties = botProperties;
    }

    @GetMapping
    ResponseEntity<Map<String, Object>> list() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("active", botProperties.name());
        body.put("bots", repository.listAvailable());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/{name}")
    ResponseEntity<Map<String, Object>> get(@PathVariable String name) {
        String prompt = repository.loadPrompt(name);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", name);
        body.put("prompt", prompt);
        return ResponseEntity.ok(body);
    }
}
