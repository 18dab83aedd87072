package com.voicemaster.sync.coordinator;

/** Which configured platform object {@code edit.rename} acts on. */
public enum EditTarget {
    INCUBATOR,
    CATEGORY
}
