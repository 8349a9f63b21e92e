package FAST.Ast;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import FAST.Model.InvalidInputException;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;

/**
 * Catalogue of named character patterns (numbers, addresses, blanks...) used to tokenize raw strings.
 * Every pattern is compiled to a {@link CompactDFA} over {@link #CHARACTERS}.
 */
public final class Patterns {
    /**
     * Tab to tilde: blanks and printable ASCII.
     */
    public static final Alphabet<Character> CHARACTERS = Alphabets.characters('\t', '~');

    private static final String BLANKS = " \t\n\u000b\f\r";

    private static final Map<String, Regex<Character>> REGEXES = catalogue();

    private Patterns() {}

    private static Map<String, Regex<Character>> catalogue() {
        final Regex<Character> digit = range('0', '9');
        final Regex<Character> letter = Regexes.union(range('a', 'z'), range('A', 'Z'));
        final Regex<Character> sign = optional(Regexes.union(Regexes.literal('-'), Regexes.literal('+')));
        final Regex<Character> uint = plus(digit);

        final Map<String, Regex<Character>> result = new LinkedHashMap<>();
        result.put("alnum", plus(Regexes.union(letter, digit)));
        result.put("bool", Regexes.union(Regexes.literal('0'), Regexes.literal('1')));
        result.put("delimiter", Regexes.union(List.of(
            plus(Regexes.literal('-')), plus(Regexes.literal('+')), plus(Regexes.literal('=')),
            plus(Regexes.literal('@')), plus(Regexes.literal('~')), plus(Regexes.literal('#')))));
        result.put("float", Regexes.concat(Regexes.concat(sign, uint),
            optional(Regexes.concat(Regexes.literal('.'), uint))));
        result.put("hexa", plus(Regexes.union(List.of(digit, range('a', 'f'), range('A', 'F')))));
        result.put("int", Regexes.concat(sign, uint));
        result.put("ipv4", ipv4(digit));
        result.put("letters", plus(letter));
        result.put("path", Regexes.concat(Regexes.literal('/'),
            plus(Regexes.union(List.of(letter, digit, anyOf("-/:._"))))));
        result.put("spaces", plus(anyOf(BLANKS)));
        result.put("uint", uint);
        result.put("word", plus(noneOf(BLANKS)));
        return Collections.unmodifiableMap(result);
    }

    /**
     * (octet.){3}octet where octet is 25[0-5] | (2[0-4] | [0-1]?[0-9])?[0-9]
     */
    private static Regex<Character> ipv4(Regex<Character> digit) {
        final Regex<Character> octet = Regexes.union(
            Regexes.concat(Regexes.word(List.of('2', '5')), range('0', '5')),
            Regexes.concat(optional(Regexes.union(
                Regexes.concat(Regexes.literal('2'), range('0', '4')),
                Regexes.concat(optional(range('0', '1')), digit))), digit));
        Regex<Character> result = Regexes.epsilon();
        for (int i = 0; i < 3; i++) {
            result = Regexes.concat(result, Regexes.concat(octet, Regexes.literal('.')));
        }
        return Regexes.concat(result, octet);
    }

    public static List<String> names() {
        return new ArrayList<>(REGEXES.keySet());
    }

    /**
     * @throws InvalidInputException if name is not part of the catalogue
     */
    public static Regex<Character> regex(String name) {
        final Regex<Character> regex = REGEXES.get(name);
        if (regex == null) {
            throw new InvalidInputException("Unknown pattern '" + name + "', known patterns are " + names());
        }
        return regex;
    }

    /**
     * @return every pattern of the catalogue, compiled
     */
    public static Map<String, CompactDFA<Character>> defaults() {
        return of(names());
    }

    /**
     * @param names - pattern names; the order is kept
     * @return compiled patterns
     * @throws InvalidInputException if a name is not part of the catalogue
     */
    public static Map<String, CompactDFA<Character>> of(Collection<String> names) {
        final Map<String, CompactDFA<Character>> result = new LinkedHashMap<>();
        for (String name : names) {
            result.put(name, Glushkov.toDFA(regex(name), CHARACTERS));
        }
        return result;
    }

    private static Regex<Character> range(char from, char to) {
        final List<Regex<Character>> alternatives = new ArrayList<>();
        for (char c = from; c <= to; c++) {
            alternatives.add(Regexes.literal(c));
        }
        return Regexes.union(alternatives);
    }

    private static Regex<Character> anyOf(String chars) {
        final List<Regex<Character>> alternatives = new ArrayList<>();
        for (int i = 0; i < chars.length(); i++) {
            alternatives.add(Regexes.literal(chars.charAt(i)));
        }
        return Regexes.union(alternatives);
    }

    private static Regex<Character> noneOf(String chars) {
        final List<Regex<Character>> alternatives = new ArrayList<>();
        for (Character c : CHARACTERS) {
            if (chars.indexOf(c) < 0) {
                alternatives.add(Regexes.literal(c));
            }
        }
        return Regexes.union(alternatives);
    }

    private static Regex<Character> plus(Regex<Character> regex) {
        return Regexes.concat(regex, Regexes.star(regex));
    }

    private static Regex<Character> optional(Regex<Character> regex) {
        return Regexes.union(Regexes.epsilon(), regex);
    }
}
