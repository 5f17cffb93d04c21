package org.abitware.newsfinder.command;

import java.util.Optional;

import org.abitware.newsfinder.present.Keyboard;

/** Transport-neutral answer to a command or callback. */
public class Reply {
    public final String text;
    public final boolean alert;
    /** The message the callback came from should lose its keyboard */
    public final boolean removeKeyboard;
    private final Keyboard keyboard;

    private Reply(String text, Keyboard keyboard, boolean alert, boolean removeKeyboard) {
        this.text = text;
        this.keyboard = keyboard;
        this.alert = alert;
        this.removeKeyboard = removeKeyboard;
    }

    public static Reply text(String text) {
        return new Reply(text, null, false, false);
    }

    public static Reply withKeyboard(String text, Keyboard keyboard) {
        return new Reply(text, keyboard, false, false);
    }

    /** Short toast-style answer to a callback. */
    public static Reply alert(String text) {
        return new Reply(text, null, true, false);
    }

    public static Reply closed() {
        return new Reply("", null, false, true);
    }

    public Optional<Keyboard> keyboard() {
        return Optional.ofNullable(keyboard);
    }

    @Override
    public String toString() {
        return "Reply{alert=" + alert + ", removeKeyboard=" + removeKeyboard + ", text=" + text + "}";
    }
}
