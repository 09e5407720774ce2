package com.foreman.core.model;

import java.util.regex.Pattern;

/**
 * Syntax of task identifiers: dot-separated segments such as {@code auth.signup.ui}.
 */
public final class TaskIds {

    private static final Pattern TASK_ID = Pattern.compile("[A-Za-z0-9_-]+(\\.[A-Za-z0-9_-]+)*");

    private TaskIds() {}

    public static boolean isValid(String id) {
        return id != null && TASK_ID.matcher(id).matches();
    }

    public static String requireValid(String id) {
        if (!isValid(id)) {
            throw new IllegalArgumentException("Invalid task id: " + id);
        }
        return id;
    }
}
