package com.identity.matching.api;

import com.identity.matching.audit.AuditService;
import com.identity.matching.core.model.CandidateRecord;
import com.identity.matching.core.model.LocalRecord;
import com.identity.matching.health.HealthStatus;
import com.identity.matching.nickname.NicknameIndex;
import com.identity.matching.review.MatchWorkflow;
import com.identity.matching.review.WorkflowState;
import com.identity.matching.selection.SelectionResult;
import com.identity.matching.store.InMemoryRecordStore;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IdentityMatcherTest {

    @Test
    void loadsBundledNicknamesByDefault() {
        try (IdentityMatcher matcher = IdentityMatcher.builder().build()) {
            assertFalse(matcher.getNicknameIndex().isDegraded());
            assertTrue(matcher.getNicknameIndex().areLinked("bob", "robert"));
            assertTrue(matcher.health().isUp());
        }
    }

    @Test
    void degradedNicknamesAreReportedByHealth() {
        try (IdentityMatcher matcher = IdentityMatcher.builder()
                .nicknameIndex(NicknameIndex.degraded("missing file"))
                .build()) {
            HealthStatus health = matcher.health();

            assertEquals(HealthStatus.Status.DEGRADED, health.status());
            assertTrue(health.details().containsKey("nickname-index"));
        }
    }

    @Test
    void workflowsShareTheAuditTrail() {
        AuditService audit = new AuditService();
        InMemoryRecordStore store = new InMemoryRecordStore();
        store.save("list-1", LocalRecord.builder().id("L1").firstName("Ann").lastName("Lee").build());
        try (IdentityMatcher matcher = IdentityMatcher.builder().auditService(audit).build()) {
            MatchWorkflow workflow = matcher.newWorkflow("list-1", store, (scope, refresh) -> List.of());

            workflow.start();

            assertEquals(WorkflowState.IDLE, workflow.getState());
            assertEquals("list-1", workflow.getScopeId());
            assertEquals(1, audit.size());
            assertSame(audit, matcher.getAuditService());
        }
    }

    @Test
    void parallelMatchingKeepsOrder() {
        List<LocalRecord> locals = new ArrayList<>();
        List<CandidateRecord> directory = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            locals.add(LocalRecord.builder().id("L" + i).firstName("Person" + i).lastName("Doe").build());
            directory.add(CandidateRecord.builder().externalId("P" + i).name("Person" + i + " Doe").build());
        }
        try (IdentityMatcher matcher = IdentityMatcher.builder()
                .options(MatchingOptions.builder().parallelism(3).build())
                .nicknameIndex(NicknameIndex.empty())
                .build()) {
            SelectionResult result = matcher.getSelector().select(locals, directory);

            for (int i = 0; i < 20; i++) {
                assertEquals("P" + i, result.candidates().get(i).chosen().getExternalId());
            }
        }
    }
}
