package org.linecalc.compiler.internal.i18n;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Internal i18n facade for interpreter messages.
 * Uses ResourceBundles with the base name "interpreter_messages".
 */
public final class Messages {

    private static final String BUNDLE_BASE_NAME = "interpreter_messages";
    private static final ResourceBundle BUNDLE = loadBundle(Locale.getDefault());

    private Messages() {}

    /**
     * Gets a formatted message for the given key. Arguments are formatted with
     * {@link Locale#ROOT}, so numbers always use ASCII digits.
     * @param key The key of the message.
     * @param args The arguments for the message format.
     * @return The formatted message, or "!key!" if the key is unknown.
     */
    public static String get(String key, Object... args) {
        try {
            return new MessageFormat(BUNDLE.getString(key), Locale.ROOT).format(args);
        } catch (MissingResourceException e) {
            return "!" + key + "!";
        }
    }

    private static ResourceBundle loadBundle(Locale locale) {
        try {
            return ResourceBundle.getBundle(BUNDLE_BASE_NAME, locale);
        } catch (MissingResourceException e) {
            // Fallback to English if the locale is not found.
            return ResourceBundle.getBundle(BUNDLE_BASE_NAME, Locale.ENGLISH);
        }
    }
}
