package nl.nfi.djlearn.constraint;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static nl.nfi.djlearn.constraint.Values.asLong;
import static nl.nfi.djlearn.constraint.Values.asString;

/**
 * Registry of pure functions that constraints may call by name.
 */
public final class Functions {

    private static final BigInteger NINETY_SEVEN = BigInteger.valueOf(97);

    private static final Map<String, Function> REGISTRY = new ConcurrentHashMap<>();

    static {
        register("abs", arguments -> Math.abs(asLong(single("abs", arguments))));
        register("lower", arguments -> asString(single("lower", arguments)).toLowerCase());
        register("upper", arguments -> asString(single("upper", arguments)).toUpperCase());
        register("digit_sum", arguments -> asString(single("digit_sum", arguments)).chars()
                .filter(Character::isDigit)
                .mapToLong(c -> c - '0')
                .sum());
        register("count", arguments -> {
            if (arguments.size() != 2) {
                throw new ConstraintEvaluationException("count expects 2 arguments, got %d".formatted(arguments.size()));
            }
            return (long) count(asString(arguments.get(0)), asString(arguments.get(1)));
        });
        // ISO 13616 check digits computed over the given country code and account number
        register("iban_checksum", arguments -> {
            if (arguments.size() != 2) {
                throw new ConstraintEvaluationException("iban_checksum expects 2 arguments, got %d".formatted(arguments.size()));
            }
            return ibanChecksum(asString(arguments.get(0)), asString(arguments.get(1)));
        });
    }

    private Functions() {
    }

    public static void register(final String name, final Function function) {
        REGISTRY.put(name, function);
    }

    public static boolean isRegistered(final String name) {
        return REGISTRY.containsKey(name);
    }

    public static Set<String> names() {
        return Set.copyOf(REGISTRY.keySet());
    }

    static Object apply(final String name, final List<Object> arguments) {
        final Function function = REGISTRY.get(name);
        if (function == null) {
            throw new ConstraintEvaluationException("Unknown function: %s".formatted(name));
        }
        return function.apply(arguments);
    }

    private static Object single(final String name, final List<Object> arguments) {
        if (arguments.size() != 1) {
            throw new ConstraintEvaluationException("%s expects 1 argument, got %d".formatted(name, arguments.size()));
        }
        return arguments.get(0);
    }

    private static int count(final String text, final String part) {
        if (part.isEmpty()) {
            return 0;
        }
        int count = 0;
        for (int index = text.indexOf(part); index >= 0; index = text.indexOf(part, index + part.length())) {
            count++;
        }
        return count;
    }

    static long ibanChecksum(final String countryCode, final String account) {
        final StringBuilder digits = new StringBuilder();
        for (final char c : (account + countryCode + "00").toUpperCase().toCharArray()) {
            if (Character.isDigit(c)) {
                digits.append(c);
            } else if (c >= 'A' && c <= 'Z') {
                digits.append(c - 'A' + 10);
            } else {
                throw new ConstraintEvaluationException("Invalid IBAN character: %s".formatted(c));
            }
        }
        return 98 - new BigInteger(digits.toString()).mod(NINETY_SEVEN).longValue();
    }

    @FunctionalInterface
    public interface Function {
        Object apply(List<Object> arguments);
    }
}
