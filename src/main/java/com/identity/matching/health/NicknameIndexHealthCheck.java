package com.identity.matching.health;

import com.identity.matching.nickname.NicknameIndex;

/**
 * Reports DEGRADED when the nickname dataset failed to load or produced no links.
 * Matching still works in that state, but nicknames are no longer recognized.
 */
public class NicknameIndexHealthCheck implements HealthCheck {

    private final NicknameIndex index;

    public NicknameIndexHealthCheck(NicknameIndex index) {
        this.index = index;
    }

    @Override
    public String getName() {
        return "nickname-index";
    }

    @Override
    public HealthStatus check() {
        HealthStatus base;
        if (index.isDegraded()) {
            base = HealthStatus.degraded("Nickname dataset unavailable: " + index.getDegradedReason());
        } else if (index.isEmpty()) {
            base = HealthStatus.degraded("Nickname index is empty");
        } else {
            base = HealthStatus.up();
        }
        return base.withDetail("names", index.size());
    }
}
