package com.adlanda.knowledgesync.model;

public enum RunMode {
    CONTINUOUS,
    SINGLE
}
