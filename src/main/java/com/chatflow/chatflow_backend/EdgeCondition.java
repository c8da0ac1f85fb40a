package com.chatflow.chatflow_backend;

public enum EdgeCondition {
    DEFAULT,   // followed when the node does not pick a branch
    BRANCH     // followed when the node selects this edge's branchKey (condition, question "invalid")
}
