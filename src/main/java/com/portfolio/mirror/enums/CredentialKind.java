package com.portfolio.mirror.enums;

public enum CredentialKind {
    ACCESS,
    REFRESH
}
