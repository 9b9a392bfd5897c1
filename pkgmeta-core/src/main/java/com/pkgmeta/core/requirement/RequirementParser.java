package com.pkgmeta.core.requirement;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cursor-based parser for PEP 508 requirement strings.
 *
 * <p>Accepts {@code name[extras] specifiers ; marker}, the parenthesised legacy
 * form {@code name (>=1.0)} found in {@code Requires-Dist}, and direct
 * references {@code name @ url ; marker}.
 */
public final class RequirementParser {

    private static final Pattern NAME = Pattern.compile("[A-Za-z0-9](?:[A-Za-z0-9._-]*[A-Za-z0-9])?");
    private static final Pattern SPECIFIER = Pattern.compile("(===|==|!=|<=|>=|~=|<|>)\\s*([A-Za-z0-9*][A-Za-z0-9.*+!_-]*)");

    private final String input;
    private int pos;

    private RequirementParser(String input) {
        this.input = input;
    }

    /**
     * Parses one requirement.
     *
     * @param requirement requirement text
     * @return parsed expression
     * @throws RequirementSyntaxException if the text is not a valid requirement
     */
    public static RequirementExpression parse(String requirement) {
        if (requirement == null || requirement.isBlank()) {
            throw new RequirementSyntaxException("Empty requirement", String.valueOf(requirement), 0);
        }
        return new RequirementParser(requirement.trim()).parseRequirement();
    }

    private RequirementExpression parseRequirement() {
        String name = matchName();
        skipWhitespace();

        List<String> extras = List.of();
        if (peek() == '[') {
            extras = parseExtras();
            skipWhitespace();
        }

        String url = null;
        SpecifierSet specifiers = SpecifierSet.empty();
        if (peek() == '@') {
            pos++;
            url = parseUrl();
        } else if (peek() == '(') {
            int close = input.indexOf(')', pos);
            if (close < 0) {
                throw error("Missing ')'");
            }
            specifiers = parseSpecifiers(input.substring(pos + 1, close), pos + 1);
            pos = close + 1;
        } else {
            int end = indexOrEnd(';');
            specifiers = parseSpecifiers(input.substring(pos, end), pos);
            pos = end;
        }
        skipWhitespace();

        MarkerExpression marker = null;
        if (peek() == ';') {
            marker = MarkerParser.parse(input.substring(pos + 1));
            pos = input.length();
        }
        if (pos < input.length()) {
            throw error("Unexpected trailing text");
        }
        return new RequirementExpression(name, extras, specifiers, url, marker, input);
    }

    private String matchName() {
        Matcher matcher = NAME.matcher(input);
        matcher.region(pos, input.length());
        if (!matcher.lookingAt()) {
            throw error("Expected project name");
        }
        pos = matcher.end();
        return matcher.group();
    }

    private List<String> parseExtras() {
        int close = input.indexOf(']', pos);
        if (close < 0) {
            throw error("Missing ']'");
        }
        List<String> extras = new ArrayList<>();
        for (String extra : input.substring(pos + 1, close).split(",")) {
            String trimmed = extra.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (!NAME.matcher(trimmed).matches()) {
                throw error("Invalid extra '" + trimmed + "'");
            }
            extras.add(trimmed);
        }
        pos = close + 1;
        return extras;
    }

    private String parseUrl() {
        skipWhitespace();
        int start = pos;
        while (pos < input.length()) {
            // a marker after a URL must be separated by whitespace
            if (input.charAt(pos) == ';' && pos > start && Character.isWhitespace(input.charAt(pos - 1))) {
                break;
            }
            pos++;
        }
        String url = input.substring(start, pos).trim();
        if (url.isEmpty()) {
            throw error("Expected URL after '@'");
        }
        return url;
    }

    private SpecifierSet parseSpecifiers(String text, int offset) {
        if (text.isBlank()) {
            return SpecifierSet.empty();
        }
        List<Specifier> specifiers = new ArrayList<>();
        for (String part : text.split(",")) {
            Matcher matcher = SPECIFIER.matcher(part.trim());
            if (!matcher.matches()) {
                throw new RequirementSyntaxException("Invalid version specifier '" + part.trim() + "'", input, offset);
            }
            specifiers.add(new Specifier(matcher.group(1), matcher.group(2)));
        }
        return SpecifierSet.of(specifiers);
    }

    private int indexOrEnd(char c) {
        int index = input.indexOf(c, pos);
        return index < 0 ? input.length() : index;
    }

    private char peek() {
        return pos < input.length() ? input.charAt(pos) : '\0';
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }

    private RequirementSyntaxException error(String message) {
        return new RequirementSyntaxException(message, input, pos);
    }
}
