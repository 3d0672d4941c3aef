package com.beapvault.evaluation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.beapvault.BeapTestFixtures;
import com.beapvault.policy.EmailProvider;
import com.beapvault.policy.LocalPolicyStore;
import com.beapvault.policy.PolicyOverview;
import com.beapvault.policy.PolicyPosture;
import com.beapvault.policy.ProtectedSite;
import com.beapvault.policy.ProviderConnectionStatus;

@ExtendWith(MockitoExtension.class)
class EvaluationPipelineTest {

    @Mock
    private LocalPolicyStore policyStore;

    private EvaluationPipeline pipeline;
    private ExecutorService lookups;

    private static final EmailProvider GMAIL = new EmailProvider("prov-1", "gmail", "Work mail",
            "alice@example.com", ProviderConnectionStatus.CONNECTED, true);
    private static final EmailProvider STALE = new EmailProvider("prov-2", "imap", "Old mail",
            "old@example.com", ProviderConnectionStatus.EXPIRED, false);
    private static final List<ProtectedSite> SITES = List.of(
            new ProtectedSite("mail.google.com", "default", "Gmail", true),
            new ProtectedSite("example.org", "user", "Partner portal", true));

    @BeforeEach
    void setup() {
        lookups = Executors.newSingleThreadExecutor(r -> new Thread(r, "policy-lookup-test"));
        pipeline = new EvaluationPipeline(policyStore, new DeclaredSignatureVerifier(), Duration.ofSeconds(1),
                lookups, BeapTestFixtures.fixedClock());
    }

    @AfterEach
    void tearDown() {
        lookups.shutdownNow();
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private void givenPolicy(List<EmailProvider> providers, PolicyPosture ingress, PolicyPosture egress) {
        when(policyStore.getProviders()).thenReturn(providers);
        when(policyStore.getEnabledSites()).thenReturn(SITES);
        when(policyStore.getPolicyOverview()).thenReturn(new PolicyOverview(ingress, egress));
    }

    private void givenRestrictivePolicy() {
        givenPolicy(List.of(GMAIL), PolicyPosture.RESTRICTIVE, PolicyPosture.RESTRICTIVE);
    }

    private EvaluationResult evaluate(BeapEnvelope envelope) {
        return pipeline.evaluate(BeapTestFixtures.incoming("m1", envelope));
    }

    private static void assertRejected(EvaluationResult result, RejectionCode code, EvaluationStep step) {
        assertFalse(result.passed(), "Message should be rejected");
        assertEquals(EvaluationStatus.REJECTED, result.status());
        assertNotNull(result.rejectionReason());
        assertEquals(code, result.rejectionReason().code());
        assertEquals(step, result.rejectionReason().failedStep());
        assertNull(result.capsuleMetadata(), "Rejected results must not expose capsule metadata");
    }

    private static List<EgressDeclaration> webEgress(String target) {
        return List.of(new EgressDeclaration(EgressType.WEB, target, true));
    }

    // ── Acceptance ────────────────────────────────────────────────────────────

    @Test
    void wellFormedEnvelope_shouldBeAccepted() {
        givenRestrictivePolicy();
        EvaluationResult result = evaluate(BeapTestFixtures.envelope().build());

        assertTrue(result.passed());
        assertEquals(EvaluationStatus.ACCEPTED, result.status());
        assertNull(result.rejectionReason());
        assertEquals(StepsCompleted.ALL, result.stepsCompleted());
        assertNotNull(result.capsuleMetadata());
        assertEquals("Download", result.envelopeSummary().channelDisplay());
        assertEquals(ExpiryStatus.VALID, result.envelopeSummary().expiryStatus());
        assertEquals(BeapTestFixtures.NOW.toEpochMilli(), result.evaluatedAt());
    }

    @Test
    void envelopeWithoutExpiry_shouldBeAccepted() {
        givenRestrictivePolicy();
        EvaluationResult result = evaluate(BeapTestFixtures.envelope().expiresAt(null).build());

        assertTrue(result.passed());
        assertEquals(ExpiryStatus.NO_EXPIRY, result.envelopeSummary().expiryStatus());
    }

    // ── Step 1: envelope verification ─────────────────────────────────────────

    @Test
    void missingEnvelope_shouldBeRejected() {
        EvaluationResult result = evaluate(null);

        assertRejected(result, RejectionCode.ENVELOPE_MISSING, EvaluationStep.ENVELOPE_VERIFICATION);
        assertNull(result.envelopeSummary());
        assertEquals(StepsCompleted.NONE, result.stepsCompleted());
        verifyNoInteractions(policyStore);
    }

    @Test
    void blankHash_shouldBeRejected() {
        EvaluationResult result = evaluate(BeapTestFixtures.envelope().envelopeHash("  ").build());

        assertRejected(result, RejectionCode.ENVELOPE_HASH_MISSING, EvaluationStep.ENVELOPE_VERIFICATION);
        assertEquals("Hash missing", result.envelopeSummary().hashVerificationDisplay());
    }

    @Test
    void missingSignature_shouldBeRejected() {
        EvaluationResult result = evaluate(BeapTestFixtures.envelope().signatureStatus(null).build());

        assertRejected(result, RejectionCode.SIGNATURE_MISSING, EvaluationStep.ENVELOPE_VERIFICATION);
        assertFalse(result.stepsCompleted().envelopeVerification());
    }

    @Test
    void invalidSignature_shouldBeRejected() {
        EvaluationResult result = evaluate(BeapTestFixtures.envelope()
                .signatureStatus(SignatureStatus.INVALID).build());

        assertRejected(result, RejectionCode.SIGNATURE_INVALID, EvaluationStep.ENVELOPE_VERIFICATION);
        assertEquals("Signature status: invalid", result.rejectionReason().details());
    }

    @Test
    void unknownSignature_shouldBeRejectedAsInvalid() {
        EvaluationResult result = evaluate(BeapTestFixtures.envelope()
                .signatureStatus(SignatureStatus.UNKNOWN).build());

        assertRejected(result, RejectionCode.SIGNATURE_INVALID, EvaluationStep.ENVELOPE_VERIFICATION);
    }

    @Test
    void expiredEnvelope_shouldBeRejected() {
        long oneMsAgo = BeapTestFixtures.NOW.toEpochMilli() - 1;
        EvaluationResult result = evaluate(BeapTestFixtures.envelope().expiresAt(oneMsAgo).build());

        assertRejected(result, RejectionCode.ENVELOPE_EXPIRED, EvaluationStep.ENVELOPE_VERIFICATION);
        assertEquals(ExpiryStatus.EXPIRED, result.envelopeSummary().expiryStatus());
        verifyNoInteractions(policyStore);
    }

    // ── Step 2: boundary check ────────────────────────────────────────────────

    @Test
    void missingEgress_shouldStopAtBoundaryCheck() {
        EvaluationResult result = evaluate(BeapTestFixtures.envelope().egress(null).build());

        assertRejected(result, RejectionCode.EGRESS_MISSING, EvaluationStep.BOUNDARY_CHECK);
        assertEquals(new StepsCompleted(true, false, false), result.stepsCompleted());
        verifyNoInteractions(policyStore);
    }

    @Test
    void emptyEgress_shouldBeRejected() {
        EvaluationResult result = evaluate(BeapTestFixtures.envelope().egress(List.of()).build());

        assertRejected(result, RejectionCode.EGRESS_MISSING, EvaluationStep.BOUNDARY_CHECK);
    }

    @Test
    void egressWithBlankTarget_shouldBeRejected() {
        EvaluationResult result = evaluate(BeapTestFixtures.envelope()
                .egress(List.of(new EgressDeclaration(EgressType.WEB, " ", false))).build());

        assertRejected(result, RejectionCode.EGRESS_MISSING, EvaluationStep.BOUNDARY_CHECK);
        assertEquals("Invalid egress declaration structure.", result.rejectionReason().humanSummary());
    }

    @Test
    void nullEgressEntry_shouldBeRejected() {
        EvaluationResult result = evaluate(BeapTestFixtures.envelope()
                .egress(Arrays.asList(new EgressDeclaration(EgressType.EMAIL, "bob@example.com", false), null))
                .build());

        assertRejected(result, RejectionCode.EGRESS_MISSING, EvaluationStep.BOUNDARY_CHECK);
    }

    @Test
    void missingIngress_shouldBeRejected() {
        EvaluationResult result = evaluate(BeapTestFixtures.envelope().ingress(List.of()).build());

        assertRejected(result, RejectionCode.INGRESS_MISSING, EvaluationStep.BOUNDARY_CHECK);
        assertEquals(new StepsCompleted(true, false, false), result.stepsCompleted());
    }

    @Test
    void ingressWithoutType_shouldBeRejected() {
        EvaluationResult result = evaluate(BeapTestFixtures.envelope()
                .ingress(List.of(new IngressDeclaration(null, "hs-alice", true))).build());

        assertRejected(result, RejectionCode.INGRESS_MISSING, EvaluationStep.BOUNDARY_CHECK);
    }

    // ── Step 3: policy intersection ───────────────────────────────────────────

    @Test
    void emailChannelWithoutConnectedProvider_shouldBeRejected() {
        givenPolicy(List.of(STALE), PolicyPosture.RESTRICTIVE, PolicyPosture.RESTRICTIVE);
        EvaluationResult result = evaluate(BeapTestFixtures.envelope().channel(IngressChannel.EMAIL).build());

        assertRejected(result, RejectionCode.PROVIDER_NOT_CONFIGURED, EvaluationStep.WRGUARD_INTERSECTION);
        assertEquals(new StepsCompleted(true, true, false), result.stepsCompleted());
    }

    @Test
    void emailChannelWithUnknownProviderId_shouldBeRejected() {
        givenRestrictivePolicy();
        EvaluationResult result = evaluate(BeapTestFixtures.envelope()
                .channel(IngressChannel.EMAIL).emailProviderId("prov-9").build());

        assertRejected(result, RejectionCode.PROVIDER_NOT_CONFIGURED, EvaluationStep.WRGUARD_INTERSECTION);
        assertEquals("Email provider \"prov-9\" is not configured.", result.rejectionReason().humanSummary());
    }

    @Test
    void emailChannelWithConnectedProvider_shouldBeAccepted() {
        givenRestrictivePolicy();

        assertTrue(evaluate(BeapTestFixtures.envelope()
                .channel(IngressChannel.EMAIL).emailProviderId("prov-1").build()).passed());
        assertTrue(evaluate(BeapTestFixtures.envelope()
                .channel(IngressChannel.EMAIL).emailProviderId("ALICE@example.com").build()).passed(),
                "Provider may be referenced by its email address");
    }

    @Test
    void webEgressToProtectedSubdomain_shouldBeAccepted() {
        givenRestrictivePolicy();
        EvaluationResult result = evaluate(BeapTestFixtures.envelope()
                .egress(webEgress("https://portal.example.org/upload")).build());

        assertTrue(result.passed());
    }

    @Test
    void webEgressToUnprotectedDomain_shouldBeRejectedWhenRestrictive() {
        givenRestrictivePolicy();
        EvaluationResult result = evaluate(BeapTestFixtures.envelope()
                .egress(webEgress("https://evil.example.net/collect")).build());

        assertRejected(result, RejectionCode.EGRESS_NOT_ALLOWED_BY_WRGUARD, EvaluationStep.WRGUARD_INTERSECTION);
        assertEquals("Egress destination \"evil.example.net\" is not in Protected Sites.",
                result.rejectionReason().humanSummary());
    }

    @Test
    void webEgressToUnprotectedDomain_shouldBeAcceptedWhenPermissive() {
        givenPolicy(List.of(GMAIL), PolicyPosture.RESTRICTIVE, PolicyPosture.PERMISSIVE);
        EvaluationResult result = evaluate(BeapTestFixtures.envelope()
                .egress(webEgress("https://evil.example.net/collect")).build());

        assertTrue(result.passed());
    }

    @Test
    void publicIngress_shouldBeRejectedWhenRestrictive() {
        givenRestrictivePolicy();
        EvaluationResult result = evaluate(BeapTestFixtures.envelope()
                .ingress(List.of(new IngressDeclaration(IngressType.PUBLIC, "forum", false))).build());

        assertRejected(result, RejectionCode.INGRESS_NOT_ALLOWED_BY_WRGUARD, EvaluationStep.WRGUARD_INTERSECTION);
    }

    @Test
    void publicIngressAlongsideVerifiedHandshake_shouldBeAccepted() {
        givenRestrictivePolicy();
        EvaluationResult result = evaluate(BeapTestFixtures.envelope()
                .ingress(List.of(new IngressDeclaration(IngressType.PUBLIC, "forum", false),
                        new IngressDeclaration(IngressType.ALLOWLIST, "alice", true)))
                .build());

        assertTrue(result.passed());
    }

    @Test
    void publicIngress_shouldBeAcceptedWhenBalanced() {
        givenPolicy(List.of(GMAIL), PolicyPosture.BALANCED, PolicyPosture.RESTRICTIVE);
        EvaluationResult result = evaluate(BeapTestFixtures.envelope()
                .ingress(List.of(new IngressDeclaration(IngressType.PUBLIC, "forum", false))).build());

        assertTrue(result.passed());
    }

    // ── Failure handling ──────────────────────────────────────────────────────

    @Test
    void slowPolicyStore_shouldFailClosed() {
        pipeline = new EvaluationPipeline(policyStore, new DeclaredSignatureVerifier(), Duration.ofMillis(100),
                lookups, BeapTestFixtures.fixedClock());
        when(policyStore.getProviders()).thenAnswer(invocation -> {
            Thread.sleep(500);
            return List.of(GMAIL);
        });

        EvaluationResult result = evaluate(BeapTestFixtures.envelope().build());

        assertRejected(result, RejectionCode.EVALUATION_ERROR, EvaluationStep.WRGUARD_INTERSECTION);
        assertEquals(new StepsCompleted(true, true, false), result.stepsCompleted());
        assertTrue(result.rejectionReason().details().contains("timed out"));
    }

    @Test
    void failingPolicyStore_shouldFailClosed() {
        when(policyStore.getProviders()).thenThrow(new IllegalStateException("keychain locked"));

        EvaluationResult result = evaluate(BeapTestFixtures.envelope().build());

        assertRejected(result, RejectionCode.EVALUATION_ERROR, EvaluationStep.WRGUARD_INTERSECTION);
        assertTrue(result.rejectionReason().details().contains("keychain locked"));
    }

    @Test
    void policyLookup_shouldRunOnLookupExecutor() {
        AtomicReference<String> lookupThread = new AtomicReference<>();
        when(policyStore.getProviders()).thenAnswer(invocation -> {
            lookupThread.set(Thread.currentThread().getName());
            return List.of(GMAIL);
        });
        when(policyStore.getEnabledSites()).thenReturn(SITES);
        when(policyStore.getPolicyOverview())
                .thenReturn(new PolicyOverview(PolicyPosture.RESTRICTIVE, PolicyPosture.RESTRICTIVE));

        EvaluationResult result = evaluate(BeapTestFixtures.envelope().build());

        assertTrue(result.passed());
        assertEquals("policy-lookup-test", lookupThread.get());
    }

    @Test
    void saturatedLookupExecutor_shouldFailClosed() {
        pipeline = new EvaluationPipeline(policyStore, new DeclaredSignatureVerifier(), Duration.ofSeconds(1),
                task -> {
                    throw new RejectedExecutionException("pool full");
                }, BeapTestFixtures.fixedClock());

        EvaluationResult result = evaluate(BeapTestFixtures.envelope().build());

        assertRejected(result, RejectionCode.EVALUATION_ERROR, EvaluationStep.WRGUARD_INTERSECTION);
        assertTrue(result.rejectionReason().details().contains("too many lookups"));
        verifyNoInteractions(policyStore);
    }

    @Test
    void failingSignatureVerifier_shouldFailClosed() {
        pipeline = new EvaluationPipeline(policyStore, envelope -> {
            throw new IllegalArgumentException("malformed signature block");
        }, Duration.ofSeconds(1), lookups, BeapTestFixtures.fixedClock());

        EvaluationResult result = evaluate(BeapTestFixtures.envelope().build());

        assertRejected(result, RejectionCode.EVALUATION_ERROR, EvaluationStep.ENVELOPE_VERIFICATION);
        assertEquals(StepsCompleted.NONE, result.stepsCompleted());
    }

    // ── Domain matching ───────────────────────────────────────────────────────

    @Test
    void extractDomain_shouldHandleUrlsAndBareDomains() {
        assertEquals("portal.example.org", EvaluationPipeline.extractDomain("https://Portal.Example.org/x?y=1"));
        assertEquals("example.org", EvaluationPipeline.extractDomain("www.example.org"));
        assertEquals("example.org", EvaluationPipeline.extractDomain(" Example.ORG "));
    }

    @Test
    void isProtected_shouldMatchExactAndSubdomainsOnly() {
        assertTrue(EvaluationPipeline.isProtected("example.org", SITES));
        assertTrue(EvaluationPipeline.isProtected("a.b.example.org", SITES));
        assertFalse(EvaluationPipeline.isProtected("notexample.org", SITES));
        assertFalse(EvaluationPipeline.isProtected("google.com", SITES));
    }
}
