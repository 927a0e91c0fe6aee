package quest.gekko.seo.web.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;
import quest.gekko.seo.service.core.SearchConsoleSyncService;
import quest.gekko.seo.service.core.TokenService;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/google")
@RequiredArgsConstructor
public class GoogleController {
    private final TokenService tokenService;
    private final SearchConsoleSyncService searchConsoleSyncService;

    @GetMapping("/auth-url")
    public Map<String, String> authUrl(@RequestParam String redirectUri) {
        return Map.of("authUrl", tokenService.buildAuthorizationUrl(redirectUri));
    }

    @PostMapping("/{userId}/connect")
    public Map<String, Boolean> connect(@PathVariable Long userId,
                                        @RequestParam String code,
                                        @RequestParam String redirectUri) {
        tokenService.connect(userId, code, redirectUri);
        return Map.of("success", true);
    }

    @GetMapping("/{userId}/sites")
    public List<String> sites(@PathVariable Long userId) {
        return searchConsoleSyncService.listSites(userId);
    }
}
