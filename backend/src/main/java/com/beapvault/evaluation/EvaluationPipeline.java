package com.beapvault.evaluation;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.beapvault.config.BeapProperties;
import com.beapvault.policy.EmailProvider;
import com.beapvault.policy.LocalPolicyStore;
import com.beapvault.policy.PolicyOverview;
import com.beapvault.policy.PolicyPosture;
import com.beapvault.policy.ProtectedSite;

/**
 * Fail-closed evaluation of an incoming BEAP package. Nothing is decrypted and
 * nothing is rendered until this pipeline has accepted the message.
 *
 * <p>Three steps run in a fixed order, and the first failure stops the pipeline:
 * <ol>
 *   <li><b>Envelope verification</b>: hash present, signature valid, not expired.</li>
 *   <li><b>Boundary check</b>: ingress and egress declarations present and well formed.</li>
 *   <li><b>Policy intersection</b>: the declared boundaries fit the local policy
 *       (connected email providers, protected sites, ingress posture).</li>
 * </ol>
 *
 * <p>Any unexpected exception, including a policy lookup that times out, rejects the
 * message with {@link RejectionCode#EVALUATION_ERROR}. The pipeline has no side
 * effects; recording the outcome in the audit ledger is the caller's job.
 */
@Service
public class EvaluationPipeline {

    private static final Logger log = LoggerFactory.getLogger(EvaluationPipeline.class);

    private final LocalPolicyStore policyStore;
    private final SignatureVerifier signatureVerifier;
    private final Duration policyLookupTimeout;
    private final Executor policyLookupExecutor;
    private final Clock clock;

    @Autowired
    public EvaluationPipeline(LocalPolicyStore policyStore, SignatureVerifier signatureVerifier,
                              BeapProperties properties,
                              @Qualifier("policyLookupExecutor") Executor policyLookupExecutor, Clock clock) {
        this(policyStore, signatureVerifier, properties.policy().lookupTimeout(), policyLookupExecutor, clock);
    }

    public EvaluationPipeline(LocalPolicyStore policyStore, SignatureVerifier signatureVerifier,
                              Duration policyLookupTimeout, Executor policyLookupExecutor, Clock clock) {
        this.policyStore = policyStore;
        this.signatureVerifier = signatureVerifier;
        this.policyLookupTimeout = policyLookupTimeout;
        this.policyLookupExecutor = policyLookupExecutor;
        this.clock = clock;
    }

    public EvaluationResult evaluate(IncomingMessage message) {
        StepsCompleted steps = StepsCompleted.NONE;
        EvaluationStep current = EvaluationStep.ENVELOPE_VERIFICATION;
        EnvelopeSummary summary = null;
        try {
            BeapEnvelope envelope = message.envelope();
            if (envelope == null) {
                return reject(rejection(RejectionCode.ENVELOPE_MISSING,
                        "Envelope is missing. Cannot process message.",
                        "The incoming message does not contain an envelope.",
                        current), null, steps, message);
            }
            summary = EnvelopeSummary.of(envelope, clock.millis());

            RejectionReason failure = verifyEnvelope(envelope);
            if (failure != null) return reject(failure, summary, steps, message);
            steps = steps.withEnvelopeVerification();

            current = EvaluationStep.BOUNDARY_CHECK;
            failure = checkBoundaries(envelope);
            if (failure != null) return reject(failure, summary, steps, message);
            steps = steps.withBoundaryCheck();

            current = EvaluationStep.WRGUARD_INTERSECTION;
            failure = intersectWithPolicy(envelope);
            if (failure != null) return reject(failure, summary, steps, message);

            log.info("Message {} accepted", message.id());
            return EvaluationResult.accepted(summary, message.capsuleMetadata(), clock.millis());
        } catch (RuntimeException e) {
            log.warn("Evaluation of message {} failed during {}: {}",
                    message == null ? null : message.id(), current.code(), e.toString());
            RejectionReason reason = rejection(RejectionCode.EVALUATION_ERROR,
                    "An error occurred during envelope evaluation.",
                    e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage(),
                    current);
            return EvaluationResult.rejected(reason, summary, steps, clock.millis());
        }
    }

    // ── Step 1: envelope verification ────────────────────────────────────────

    private RejectionReason verifyEnvelope(BeapEnvelope envelope) {
        EvaluationStep step = EvaluationStep.ENVELOPE_VERIFICATION;
        if (envelope.envelopeHash() == null || envelope.envelopeHash().isBlank()) {
            return rejection(RejectionCode.ENVELOPE_HASH_MISSING,
                    "Envelope hash is missing. Message integrity cannot be verified.",
                    "The envelope does not contain a hash field required for integrity verification.",
                    step);
        }

        SignatureStatus signature = signatureVerifier.verify(envelope);
        if (signature == null || signature == SignatureStatus.MISSING) {
            return rejection(RejectionCode.SIGNATURE_MISSING,
                    "Envelope signature is missing. Message authenticity cannot be verified.",
                    "Signature status: not present",
                    step);
        }
        if (signature != SignatureStatus.VALID) {
            return rejection(RejectionCode.SIGNATURE_INVALID,
                    "Envelope signature is invalid. Message authenticity cannot be verified.",
                    "Signature status: " + signature.name().toLowerCase(Locale.ROOT),
                    step);
        }

        if (envelope.expiresAt() != null && envelope.expiresAt() < clock.millis()) {
            return rejection(RejectionCode.ENVELOPE_EXPIRED,
                    "Envelope has expired. Message is no longer valid.",
                    "Expired at: " + Instant.ofEpochMilli(envelope.expiresAt()),
                    step);
        }
        return null;
    }

    // ── Step 2: boundary check ───────────────────────────────────────────────

    private RejectionReason checkBoundaries(BeapEnvelope envelope) {
        EvaluationStep step = EvaluationStep.BOUNDARY_CHECK;
        List<IngressDeclaration> ingress = envelope.ingressDeclarations();
        if (ingress == null || ingress.isEmpty()) {
            return rejection(RejectionCode.INGRESS_MISSING,
                    "Ingress declarations are missing. Cannot determine message origin.",
                    "The envelope does not declare any ingress sources.",
                    step);
        }
        List<EgressDeclaration> egress = envelope.egressDeclarations();
        if (egress == null || egress.isEmpty()) {
            return rejection(RejectionCode.EGRESS_MISSING,
                    "Egress declarations are missing. Cannot determine execution boundaries.",
                    "The envelope does not declare any egress destinations.",
                    step);
        }

        for (IngressDeclaration declaration : ingress) {
            if (declaration == null || declaration.type() == null || isBlank(declaration.source())) {
                return rejection(RejectionCode.INGRESS_MISSING,
                        "Invalid ingress declaration structure.",
                        "Ingress declaration missing type or source: " + declaration,
                        step);
            }
        }
        for (EgressDeclaration declaration : egress) {
            if (declaration == null || declaration.type() == null || isBlank(declaration.target())) {
                return rejection(RejectionCode.EGRESS_MISSING,
                        "Invalid egress declaration structure.",
                        "Egress declaration missing type or target: " + declaration,
                        step);
            }
        }
        return null;
    }

    // ── Step 3: policy intersection ──────────────────────────────────────────

    private RejectionReason intersectWithPolicy(BeapEnvelope envelope) {
        EvaluationStep step = EvaluationStep.WRGUARD_INTERSECTION;
        PolicySnapshot policy = lookupPolicy();

        if (envelope.ingressChannel() == IngressChannel.EMAIL) {
            List<EmailProvider> connected = policy.providers().stream()
                    .filter(EmailProvider::isConnected)
                    .toList();
            if (connected.isEmpty()) {
                return rejection(RejectionCode.PROVIDER_NOT_CONFIGURED,
                        "No email provider is configured.",
                        "Message arrived via email channel but no email provider is connected.",
                        step);
            }
            String providerId = envelope.emailProviderId();
            if (!isBlank(providerId)) {
                boolean known = connected.stream()
                        .anyMatch(p -> providerId.equals(p.id()) || providerId.equalsIgnoreCase(p.email()));
                if (!known) {
                    return rejection(RejectionCode.PROVIDER_NOT_CONFIGURED,
                            "Email provider \"" + providerId + "\" is not configured.",
                            "The specified email provider is not connected.",
                            step);
                }
            }
        }

        if (policy.overview().egressPosture() == PolicyPosture.RESTRICTIVE) {
            for (EgressDeclaration egress : envelope.egressDeclarations()) {
                if (egress.type() != EgressType.WEB) continue;
                String domain = extractDomain(egress.target());
                if (!isProtected(domain, policy.sites())) {
                    return rejection(RejectionCode.EGRESS_NOT_ALLOWED_BY_WRGUARD,
                            "Egress destination \"" + domain + "\" is not in Protected Sites.",
                            "The envelope declares egress to \"" + egress.target()
                                    + "\" which is not in the Protected Sites allowlist.",
                            step);
                }
            }
        }

        if (policy.overview().ingressPosture() == PolicyPosture.RESTRICTIVE) {
            List<IngressDeclaration> ingress = envelope.ingressDeclarations();
            boolean hasVerifiedTrustedSource = ingress.stream()
                    .anyMatch(d -> d.verified()
                            && (d.type() == IngressType.HANDSHAKE || d.type() == IngressType.ALLOWLIST));
            boolean hasPublicOrUnverified = ingress.stream()
                    .anyMatch(d -> d.type() == IngressType.PUBLIC || !d.verified());
            if (!hasVerifiedTrustedSource && hasPublicOrUnverified) {
                return rejection(RejectionCode.INGRESS_NOT_ALLOWED_BY_WRGUARD,
                        "Ingress from unverified source not allowed under restrictive policy.",
                        "Local ingress policy is restrictive. Only verified handshake or allowlist sources are permitted.",
                        step);
            }
        }
        return null;
    }

    private PolicySnapshot lookupPolicy() {
        CompletableFuture<PolicySnapshot> lookup;
        try {
            lookup = CompletableFuture.supplyAsync(() -> new PolicySnapshot(
                    policyStore.getProviders(),
                    policyStore.getEnabledSites(),
                    policyStore.getPolicyOverview()), policyLookupExecutor);
        } catch (RejectedExecutionException e) {
            throw new PolicyLookupException("Local policy lookup rejected: too many lookups in flight", e);
        }
        try {
            PolicySnapshot snapshot = lookup.get(policyLookupTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (snapshot.providers() == null || snapshot.sites() == null || snapshot.overview() == null) {
                throw new PolicyLookupException("Local policy store returned an incomplete policy");
            }
            return snapshot;
        } catch (TimeoutException e) {
            lookup.cancel(true);
            throw new PolicyLookupException("Local policy lookup timed out after " + policyLookupTimeout.toMillis() + " ms");
        } catch (ExecutionException e) {
            throw new PolicyLookupException("Local policy lookup failed: " + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PolicyLookupException("Interrupted while looking up local policy", e);
        }
    }

    /**
     * Host of an http(s) URL, otherwise the lower-cased target with a leading
     * {@code www.} removed.
     */
    static String extractDomain(String target) {
        String lower = target.trim().toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            try {
                String host = URI.create(lower).getHost();
                if (host != null) return host;
            } catch (IllegalArgumentException e) {
                log.debug("Egress target {} is not a valid URL, matching it as a bare domain", target);
            }
        }
        return lower.startsWith("www.") ? lower.substring(4) : lower;
    }

    static boolean isProtected(String domain, List<ProtectedSite> sites) {
        return sites.stream()
                .map(site -> site.domain().toLowerCase(Locale.ROOT))
                .anyMatch(site -> domain.equals(site) || domain.endsWith("." + site));
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private EvaluationResult reject(RejectionReason reason, EnvelopeSummary summary,
                                    StepsCompleted steps, IncomingMessage message) {
        log.info("Message {} rejected at {}: {}", message.id(), reason.failedStep().code(), reason.code().code());
        return EvaluationResult.rejected(reason, summary, steps, clock.millis());
    }

    private RejectionReason rejection(RejectionCode code, String summary, String details, EvaluationStep step) {
        return new RejectionReason(code, summary, details, clock.millis(), step);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record PolicySnapshot(List<EmailProvider> providers, List<ProtectedSite> sites, PolicyOverview overview) {
    }
}
