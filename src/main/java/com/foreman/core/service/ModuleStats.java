package com.foreman.core.service;

public record ModuleStats(String module, ProgressStats progress) {}
