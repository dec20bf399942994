package com.identity.matching.health;

import com.identity.matching.nickname.NicknameIndex;
import com.identity.matching.nickname.NicknameRelation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HealthCheckTest {

    private static HealthCheck check(String name, HealthStatus status) {
        return new HealthCheck() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public HealthStatus check() {
                return status;
            }
        };
    }

    @Test
    void loadedIndexIsUp() {
        NicknameIndex index = NicknameIndex.load(List.of(new NicknameRelation("robert", "has_nickname", "bob")));

        HealthStatus status = new NicknameIndexHealthCheck(index).check();

        assertTrue(status.isUp());
        assertEquals(2, status.details().get("names"));
    }

    @Test
    void degradedIndexIsDegraded() {
        HealthStatus status = new NicknameIndexHealthCheck(NicknameIndex.degraded("file missing")).check();

        assertTrue(status.isDegraded());
        assertTrue(status.message().contains("file missing"));
    }

    @Test
    void emptyIndexIsDegraded() {
        assertTrue(new NicknameIndexHealthCheck(NicknameIndex.empty()).check().isDegraded());
    }

    @Test
    void registryReportsWorstStatus() {
        HealthCheckRegistry registry = new HealthCheckRegistry();
        assertTrue(registry.checkAll().isUp());

        registry.register(check("a", HealthStatus.up()));
        registry.register(check("b", HealthStatus.degraded("slow")));
        assertEquals(HealthStatus.Status.DEGRADED, registry.checkAll().status());

        registry.register(check("c", HealthStatus.down("gone")));
        HealthStatus all = registry.checkAll();
        assertEquals(HealthStatus.Status.DOWN, all.status());
        assertEquals("c: gone", all.message());
        assertEquals(3, all.details().size());
    }

    @Test
    void throwingCheckCountsAsDown() {
        HealthCheckRegistry registry = new HealthCheckRegistry();
        registry.register(new HealthCheck() {
            @Override
            public String getName() {
                return "directory";
            }

            @Override
            public HealthStatus check() {
                throw new IllegalStateException("unreachable");
            }
        });

        HealthStatus all = registry.checkAll();

        assertEquals(HealthStatus.Status.DOWN, all.status());
        assertTrue(all.message().startsWith("directory: "));
    }

    @Test
    void sameNameReplacesEarlierCheck() {
        HealthCheckRegistry registry = new HealthCheckRegistry();
        registry.register(check("nicknames", HealthStatus.down("missing")));
        registry.register(check("nicknames", HealthStatus.up()));

        assertEquals(1, registry.size());
        assertTrue(registry.checkAll().isUp());
    }
}
