package com.agentgate.orchestrator.policy;

/**
 * Standing "always allow" exemptions. Matching is exact: an entry for
 * {@code npm install} does not cover {@code npm install lodash}.
 */
public interface AllowListStore {

    boolean isAllowed(String text);

    void allow(String text);
}
