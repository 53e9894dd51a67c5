package com.sitewalker.core.crawler;

public enum TraversalState { INIT, RUNNING, DONE }
