package com.sparta.cinema.infrastructure.aop.logtrace;

import java.util.UUID;

public class TraceId {

    private final String id;
    private final int level;

    public TraceId() {
        this(createId(), 0);
    }

    private TraceId(String id, int level) {
        this.id = id;
        this.level = level;
    }

    private static String createId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public TraceId createNextId() {
        return new TraceId(id, level + 1);
    }

    public TraceId createPreviousId() {
        return new TraceId(id, level - 1);
    }

    public boolean isFirstLevel() {
        return level == 0;
    }

    public String getId() {
        return id;
    }

    public int getLevel() {
        return level;
    }
}
