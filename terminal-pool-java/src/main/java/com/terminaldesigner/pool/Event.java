package com.terminaldesigner.pool;

/**
 * Object lifecycle events a macro can be bound to (ISO 11783-6 event ids).
 */
public enum Event {
    RESERVED(0),
    ON_ACTIVATE(1),
    ON_DEACTIVATE(2),
    ON_SHOW(3),
    ON_HIDE(4),
    ON_ENABLE(5),
    ON_DISABLE(6),
    ON_CHANGE_ACTIVE_MASK(7),
    ON_CHANGE_SOFT_KEY_MASK(8),
    ON_CHANGE_ATTRIBUTE(9),
    ON_CHANGE_BACKGROUND_COLOUR(10),
    ON_CHANGE_FONT_ATTRIBUTES(11),
    ON_CHANGE_LINE_ATTRIBUTES(12),
    ON_CHANGE_FILL_ATTRIBUTES(13),
    ON_CHANGE_CHILD_LOCATION(14),
    ON_CHANGE_SIZE(15),
    ON_CHANGE_VALUE(16),
    ON_CHANGE_PRIORITY(17),
    ON_CHANGE_END_POINT(18),
    ON_INPUT_FIELD_SELECTION(19),
    ON_INPUT_FIELD_DESELECTION(20),
    ON_ESC(21),
    ON_ENTRY_OF_VALUE(22),
    ON_ENTRY_OF_NEW_VALUE(23),
    ON_KEY_PRESS(24),
    ON_KEY_RELEASE(25),
    ON_CHANGE_CHILD_POSITION(26),
    ON_POINTING_EVENT_PRESS(27),
    ON_POINTING_EVENT_RELEASE(28);

    private final int id;

    Event(int id) {
        this.id = id;
    }

    public int id() { return id; }
}
