package com.agentverse.authz.domain.cache;

/**
 * What a cached permission value answers.
 */
public enum CheckKind {
    /** Subject's role in one group. */
    ROLE,
    /** Decision for one action on one agent. */
    AGENT_ACTION,
    /** Ids of every agent the subject can see. */
    VISIBLE_AGENTS,
    /** Ids of every group where the subject is admin. */
    ADMIN_GROUPS
}
