package com.beapvault.message;

import java.util.concurrent.Callable;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.beapvault.archive.ArchivalService;
import com.beapvault.archive.ArchiveEligibility;
import com.beapvault.archive.ArchiveOutcome;
import com.beapvault.evaluation.EvaluationResult;
import com.beapvault.evaluation.IncomingMessage;
import com.beapvault.reconstruction.ReconstructionRecord;
import com.beapvault.reconstruction.ReconstructionService;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * HTTP surface for the message lifecycle. The vault core is blocking, so every call
 * is moved off the event loop onto the bounded-elastic scheduler.
 */
@RestController
@RequestMapping("/api/messages")
public class MessageController {

    private final BeapMessageStore messageStore;
    private final MessageVerificationService verificationService;
    private final ReconstructionService reconstructionService;
    private final ArchivalService archivalService;

    public MessageController(BeapMessageStore messageStore, MessageVerificationService verificationService,
                             ReconstructionService reconstructionService, ArchivalService archivalService) {
        this.messageStore = messageStore;
        this.verificationService = verificationService;
        this.reconstructionService = reconstructionService;
        this.archivalService = archivalService;
    }

    /** Imports a package and evaluates it right away. */
    @PostMapping("/import")
    public Mono<EvaluationResult> importMessage(@RequestBody IncomingMessage message) {
        return blocking(() -> verificationService.importAndVerify(message));
    }

    @GetMapping("/{id}")
    public Mono<BeapMessage> getMessage(@PathVariable String id) {
        return blocking(() -> messageStore.getMessageById(id).orElseThrow(() -> new MessageNotFoundException(id)));
    }

    @PostMapping("/{id}/verify")
    public Mono<EvaluationResult> verify(@PathVariable String id) {
        return blocking(() -> verificationService.verify(id));
    }

    @PostMapping("/{id}/dispatch")
    public Mono<Void> dispatch(@PathVariable String id, @RequestParam String method) {
        return blocking(() -> {
            verificationService.recordDispatch(id, method);
            return null;
        }).then();
    }

    @PostMapping("/{id}/delivery")
    public Mono<Void> delivery(@PathVariable String id, @RequestParam boolean confirmed,
                               @RequestParam String method) {
        return blocking(() -> {
            verificationService.recordDelivery(id, confirmed, method);
            return null;
        }).then();
    }

    @PostMapping("/{id}/reconstruct")
    public Mono<ReconstructionRecord> reconstruct(@PathVariable String id) {
        return blocking(() -> reconstructionService.reconstruct(id));
    }

    @GetMapping("/{id}/archive-eligibility")
    public Mono<ArchiveEligibility> archiveEligibility(@PathVariable String id) {
        return blocking(() -> archivalService.checkEligibility(id));
    }

    @PostMapping("/{id}/archive")
    public Mono<ArchiveOutcome> archive(@PathVariable String id) {
        return blocking(() -> archivalService.archive(id));
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }
}
