package com.tasksync.command.domain;

public enum CommandType {
    CREATE,
    UPDATE,
    ASSIGN,
    COMPLETE,
    REOPEN,
    DELETE
}
