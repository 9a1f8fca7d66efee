package com.phillippitts.voicenav.service.command;

/**
 * Priority levels for {@link Command#priority()}. Higher values are tried first, so a more
 * specific phrase ("right click") must rank above a more general one ("click").
 */
public final class CommandPriority {

    public static final int CRITICAL = 1000;
    public static final int HIGH = 500;
    public static final int MEDIUM = 200;
    public static final int NORMAL = 100;
    public static final int LOW = 50;
    public static final int DEFAULT = 0;

    private CommandPriority() {
    }
}
