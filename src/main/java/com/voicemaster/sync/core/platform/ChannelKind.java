package com.voicemaster.sync.core.platform;

public enum ChannelKind {
    VOICE,
    CATEGORY,
    OTHER
}
