package com.chatflow.chatflow_backend.model.domain;

public enum NodeType {
    MESSAGE,        // free-form text or template message, then continue
    QUESTION,       // prompt and pause until the contact answers
    CONDITION,      // pick a branch from an expression over the variables
    ASSIGNMENT,     // set variables, no output
    EXTERNAL_CALL,  // call an outside capability (HTTP by default) and map the response
    JUMP,           // switch to another flow's start node, keeping the variables
    END;            // terminal, optional final message

    public boolean isTerminal() {
        return this == END;
    }
}
