package com.sitewalker.core.crawler;

/** 알 수 없는 전략 이름. 순회 시작 전에 던져진다. */
public class UnknownStrategyException extends IllegalArgumentException {

    private final String name;

    public UnknownStrategyException(String name) {
        super("Unknown traversal strategy: '" + name + "' (expected depth-first or breadth-first)");
        this.name = name;
    }

    public String getName() { return name; }
}
