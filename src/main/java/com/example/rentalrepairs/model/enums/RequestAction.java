package com.example.rentalrepairs.model.enums;

/** Things a principal may attempt on a tenant request. */
public enum RequestAction {
    SUBMIT,
    VIEW,
    REVIEW,
    ASSIGN,
    START_WORK,
    COMPLETE_WORK,
    DECLINE,
    ESCALATE,
    RESOLVE_ESCALATION
}
