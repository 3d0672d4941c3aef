package com.beapvault.tools;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping("/api/tools")
public class ToolController {

    private final ToolRegistry registry;

    public ToolController(ToolRegistry registry) {
        this.registry = registry;
    }

    @GetMapping("/diagnostics")
    public Mono<ToolDiagnosticReport> diagnostics() {
        return Mono.fromCallable(registry::generateDiagnosticReport).subscribeOn(Schedulers.boundedElastic());
    }

    /** Re-runs verification and returns the resulting report. */
    @PostMapping("/verify")
    public Mono<ToolDiagnosticReport> verify() {
        return Mono.fromCallable(() -> {
            registry.verifyAllTools();
            return registry.generateDiagnosticReport();
        }).subscribeOn(Schedulers.boundedElastic());
    }
}
