package com.circuitchallenge.generator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Random;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.circuitchallenge.difficulty.DifficultySettings;
import com.circuitchallenge.difficulty.OperationWeights;

/**
 * Builds two-operand arithmetic expressions that evaluate exactly to a target, and evaluates them back.
 */
public final class ExpressionGenerator {

    static final int MAX_WEIGHTED_ATTEMPTS = 10;
    static final int MAX_DIVISOR = 12;
    static final int MAX_DIVIDEND = 1000;
    static final double DIVISION_PRIORITY_PROBABILITY = 0.8;

    private static final List<Operation> RELAXED_ORDER =
            List.of(Operation.ADDITION, Operation.SUBTRACTION, Operation.DIVISION, Operation.MULTIPLICATION);

    private static final Pattern BINARY_EXPRESSION = Pattern.compile("^\\s*(\\d+)\\s*([+\\-*/−×÷])\\s*(\\d+)\\s*$");

    private ExpressionGenerator() {
    }

    public static Optional<Expression> generateAddition(int target, int maxOperand, Random random) {
        if (target < 2) {
            return Optional.empty();
        }
        int low = Math.max(1, target - maxOperand);
        int high = Math.min(maxOperand, target - 1);
        if (low > high) {
            return Optional.empty();
        }
        int a = low + random.nextInt(high - low + 1);
        return Optional.of(Expression.of(Operation.ADDITION, a, target - a, target));
    }

    public static Optional<Expression> generateSubtraction(int target, int maxOperand, Random random) {
        if (target < 1) {
            return Optional.empty();
        }
        int maxSubtrahend = maxOperand - target;
        if (maxSubtrahend < 1) {
            return Optional.empty();
        }
        int b = 1 + random.nextInt(maxSubtrahend);
        return Optional.of(Expression.of(Operation.SUBTRACTION, target + b, b, target));
    }

    public static Optional<Expression> generateMultiplication(int target, int maxFactor, Random random) {
        List<int[]> pairs = factorPairs(target, maxFactor);
        if (pairs.isEmpty()) {
            return Optional.empty();
        }
        int[] pair = pairs.get(random.nextInt(pairs.size()));
        boolean swap = random.nextBoolean();
        int a = swap ? pair[1] : pair[0];
        int b = swap ? pair[0] : pair[1];
        return Optional.of(Expression.of(Operation.MULTIPLICATION, a, b, target));
    }

    public static Optional<Expression> generateDivision(int target, int maxDivisor, Random random) {
        if (target < 1) {
            return Optional.empty();
        }
        int divisorLimit = Math.min(maxDivisor, MAX_DIVISOR);
        List<Integer> divisors = new ArrayList<>();
        for (int b = 2; b <= divisorLimit; b++) {
            if ((long) target * b <= MAX_DIVIDEND) {
                divisors.add(b);
            }
        }
        if (divisors.isEmpty()) {
            return Optional.empty();
        }
        int b = divisors.get(random.nextInt(divisors.size()));
        return Optional.of(Expression.of(Operation.DIVISION, target * b, b, target));
    }

    /**
     * Weighted pick among operations that are both enabled and carry a positive weight.
     */
    public static Optional<Operation> selectOperation(OperationWeights weights, DifficultySettings settings, Random random) {
        Objects.requireNonNull(weights, "weights");
        Objects.requireNonNull(settings, "settings");
        int total = 0;
        for (Operation operation : Operation.values()) {
            if (settings.isEnabled(operation)) {
                total += weights.weightOf(operation);
            }
        }
        if (total <= 0) {
            return Optional.empty();
        }
        int roll = random.nextInt(total);
        for (Operation operation : Operation.values()) {
            if (!settings.isEnabled(operation)) {
                continue;
            }
            roll -= weights.weightOf(operation);
            if (roll < 0) {
                return Optional.of(operation);
            }
        }
        return Optional.empty();
    }

    public static Optional<Expression> generateExpression(int target, DifficultySettings settings, Random random) {
        return generateExpression(target, settings, false, random);
    }

    public static Optional<Expression> generateExpression(
            int target,
            DifficultySettings settings,
            boolean prioritizeDivision,
            Random random) {
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(random, "random");
        if (target < 1 || settings.enabledOperations().isEmpty()) {
            return Optional.empty();
        }

        if (prioritizeDivision && settings.divisionEnabled() && target <= settings.multDivRange()
                && random.nextDouble() < DIVISION_PRIORITY_PROBABILITY) {
            Optional<Expression> division = generateDivision(target, settings.multDivRange(), random);
            if (division.isPresent()) {
                return division;
            }
        }

        if (settings.multiplicationEnabled() && !factorPairs(target, settings.multDivRange()).isEmpty()
                && random.nextDouble() < multiplicationBoostProbability(target)) {
            Optional<Expression> product = generateMultiplication(target, settings.multDivRange(), random);
            if (product.isPresent()) {
                return product;
            }
        }

        for (int attempt = 0; attempt < MAX_WEIGHTED_ATTEMPTS; attempt++) {
            Optional<Operation> operation = selectOperation(settings.weights(), settings, random);
            if (operation.isEmpty()) {
                break;
            }
            Optional<Expression> expression = generateFor(operation.get(), target, settings, random);
            if (expression.isPresent()) {
                return expression;
            }
        }

        for (Operation operation : settings.enabledOperations()) {
            Optional<Expression> expression = generateFor(operation, target, settings, random);
            if (expression.isPresent()) {
                return expression;
            }
        }

        if (target == 1) {
            return Optional.of(Expression.of(Operation.SUBTRACTION, 2, 1, 1));
        }
        for (Operation operation : RELAXED_ORDER) {
            if (settings.isEnabled(operation)) {
                return Optional.of(relaxed(operation, target));
            }
        }
        return Optional.empty();
    }

    /**
     * Parses "A op B" with a single operator (Unicode or ASCII) and returns its exact value.
     * Placeholder labels, malformed text, division by zero and inexact division yield empty.
     */
    public static OptionalInt evaluateExpression(String expression) {
        if (expression == null) {
            return OptionalInt.empty();
        }
        Matcher matcher = BINARY_EXPRESSION.matcher(expression);
        if (!matcher.matches()) {
            return OptionalInt.empty();
        }
        Optional<Operation> operation = Operation.fromSymbol(matcher.group(2));
        if (operation.isEmpty()) {
            return OptionalInt.empty();
        }
        int a;
        int b;
        try {
            a = Integer.parseInt(matcher.group(1));
            b = Integer.parseInt(matcher.group(3));
        } catch (NumberFormatException ex) {
            return OptionalInt.empty();
        }
        return operation.get().apply(a, b);
    }

    static double multiplicationBoostProbability(int target) {
        if (target <= 25) {
            return 0.40;
        }
        if (target >= 50) {
            return 0.60;
        }
        return 0.40 + (target - 25) * 0.008;
    }

    private static Optional<Expression> generateFor(Operation operation, int target, DifficultySettings settings, Random random) {
        return switch (operation) {
            case ADDITION -> generateAddition(target, settings.addSubRange(), random);
            case SUBTRACTION -> generateSubtraction(target, settings.addSubRange(), random);
            case MULTIPLICATION -> generateMultiplication(target, settings.multDivRange(), random);
            case DIVISION -> target <= settings.multDivRange()
                    ? generateDivision(target, settings.multDivRange(), random)
                    : Optional.empty();
        };
    }

    // Ignores operand limits; used only once every limited form has been tried. Targets are at least 2 here.
    private static Expression relaxed(Operation operation, int target) {
        return switch (operation) {
            case ADDITION -> Expression.of(Operation.ADDITION, target / 2, target - target / 2, target);
            case SUBTRACTION -> Expression.of(Operation.SUBTRACTION, target + 1, 1, target);
            case DIVISION -> Expression.of(Operation.DIVISION, target * 2, 2, target);
            case MULTIPLICATION -> Expression.of(Operation.MULTIPLICATION, target, 1, target);
        };
    }

    private static List<int[]> factorPairs(int target, int maxFactor) {
        List<int[]> pairs = new ArrayList<>();
        if (target < 4) {
            return pairs;
        }
        for (int a = 2; a <= maxFactor && a * a <= target; a++) {
            if (target % a == 0) {
                int b = target / a;
                if (b <= maxFactor) {
                    pairs.add(new int[] {a, b});
                }
            }
        }
        return pairs;
    }
}
