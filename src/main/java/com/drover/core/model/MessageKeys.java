package com.drover.core.model;

/**
 * Payload keys shared by the scheduler and agents.
 */
public final class MessageKeys {

    public static final String ACTION = "action";
    public static final String TASK_ID = "task_id";
    public static final String TOOLS_NEEDED = "tools_needed";
    public static final String DEPENDS_ON = "depends_on";
    public static final String CAPABILITY = "capability";
    public static final String ERROR = "error";
    public static final String FINDINGS = "findings";

    public static final String ACTION_EXECUTION = "execution";
    public static final String ACTION_SECURITY = "security_consultation";

    private MessageKeys() {}
}
