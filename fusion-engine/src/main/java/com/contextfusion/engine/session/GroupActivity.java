package com.contextfusion.engine.session;

/** Group with the most recorded sessions. */
public record GroupActivity(String groupName, long sessionCount) {}
