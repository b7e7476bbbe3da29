package com.libragraph.datasink.core.graph;

public enum TxnMode {
    READ,
    WRITE
}
