package com.lbg.markets.turbosort.domain;

public enum SourceKind {
    LOCAL,
    S3
}
