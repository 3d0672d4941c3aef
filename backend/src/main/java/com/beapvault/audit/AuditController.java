package com.beapvault.audit;

import java.util.concurrent.Callable;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import com.beapvault.export.AuditLogExport;
import com.beapvault.export.ExportResult;
import com.beapvault.export.ExportService;
import com.beapvault.export.ProofBundle;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping("/api/audit")
public class AuditController {

    private final AuditLedger ledger;
    private final ExportService exportService;

    public AuditController(AuditLedger ledger, ExportService exportService) {
        this.ledger = ledger;
        this.exportService = exportService;
    }

    @GetMapping("/{messageId}/events")
    public Flux<AuditEvent> getEvents(@PathVariable String messageId) {
        return blocking(() -> ledger.getEvents(messageId)).flatMapMany(Flux::fromIterable);
    }

    @GetMapping("/{messageId}/chain")
    public Mono<AuditChain> getChain(@PathVariable String messageId) {
        return blocking(() -> ledger.getChain(messageId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "No audit events for message " + messageId)));
    }

    @GetMapping("/{messageId}/integrity")
    public Mono<IntegrityReport> verifyIntegrity(@PathVariable String messageId) {
        return blocking(() -> new IntegrityReport(messageId, ledger.getEvents(messageId).size(),
                ledger.verifyChainIntegrity(messageId)));
    }

    @PostMapping("/{messageId}/export")
    public Mono<ExportResult<AuditLogExport>> exportAuditLog(@PathVariable String messageId) {
        return blocking(() -> exportService.exportAuditLog(messageId));
    }

    @PostMapping("/{messageId}/proof-bundle")
    public Mono<ExportResult<ProofBundle>> buildProofBundle(@PathVariable String messageId) {
        return blocking(() -> exportService.buildProofBundle(messageId));
    }

    @PostMapping("/{messageId}/rejected-proof")
    public Mono<ExportResult<ProofBundle>> exportRejectedProof(@PathVariable String messageId) {
        return blocking(() -> exportService.exportRejectedProof(messageId));
    }

    public record IntegrityReport(String messageId, int eventCount, boolean verified) {
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }
}
