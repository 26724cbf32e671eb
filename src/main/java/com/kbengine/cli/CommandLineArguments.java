package com.kbengine.cli;

import com.kbengine.exception.ValidationException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Positional words plus {@code --name value}, {@code --name=value} and bare {@code --flag} options.
 * Known flags never consume the following word.
 */
public class CommandLineArguments {

    static final Set<String> FLAGS = Set.of("json", "force", "help");

    private final List<String> positional = new ArrayList<>();
    private final Map<String, String> options = new HashMap<>();

    public CommandLineArguments(String[] arguments) {
        for (int p = 0; p < arguments.length; p++) {
            String argument = arguments[p];
            if (!argument.startsWith("--") || argument.length() == 2) {
                positional.add(argument);
                continue;
            }

            String name = argument.substring(2);
            String value = "true";
            int equals = name.indexOf('=');
            if (equals >= 0) {
                value = name.substring(equals + 1);
                name = name.substring(0, equals);
            } else if (!FLAGS.contains(name) && p < arguments.length - 1 && !arguments[p + 1].startsWith("--")) {
                value = arguments[p + 1];
                p++;
            }
            options.put(name, value);
        }
    }

    public List<String> positional() {
        return List.copyOf(positional);
    }

    public String positional(int index, String name) {
        if (index >= positional.size()) {
            throw new ValidationException("Missing argument: <" + name + ">");
        }
        return positional.get(index);
    }

    /**
     * Positional words from {@code index} on, joined with spaces.
     */
    public String remainder(int index, String name) {
        if (index >= positional.size()) {
            throw new ValidationException("Missing argument: <" + name + ">");
        }
        return String.join(" ", positional.subList(index, positional.size()));
    }

    public Optional<String> option(String name) {
        return Optional.ofNullable(options.get(name));
    }

    public Integer intOption(String name) {
        String value = options.get(name);
        if (value == null) {
            return null;
        }
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("Option --" + name + " expects an integer, got '" + value + "'");
        }
    }

    public Double doubleOption(String name) {
        String value = options.get(name);
        if (value == null) {
            return null;
        }
        try {
            return Double.valueOf(value.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("Option --" + name + " expects a number, got '" + value + "'");
        }
    }

    public boolean flag(String name) {
        String value = options.get(name);
        if (value == null) {
            return false;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return normalized.equals("true") || normalized.equals("1") || normalized.equals("yes") || normalized.equals("y");
    }
}
