package com.mergeline.backend.command;

public enum CommandResult {
    /** the comment held no command */
    OK,
    APPLIED,
    /** at least one command was refused, nothing was applied */
    REJECTED,
    /** the commenter has no rights at all on the PR */
    IGNORED
}
