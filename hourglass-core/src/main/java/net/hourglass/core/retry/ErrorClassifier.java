package net.hourglass.core.retry;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * 예외 → RetryReason 매핑.
 * (predicate, reason) 규칙을 순서대로 평가하고 처음 맞는 규칙을 채택한다.
 */
public final class ErrorClassifier {

    public record Rule(Predicate<Throwable> predicate, RetryReason reason) {
    }

    private final List<Rule> rules;

    private ErrorClassifier(List<Rule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static ErrorClassifier of(List<Rule> rules) {
        return new ErrorClassifier(rules);
    }

    public static ErrorClassifier defaults() {
        List<Rule> r = new ArrayList<>();
        r.add(new Rule(messageContains("429", "rate limit", "too many requests"), RetryReason.RATE_LIMIT_429));
        r.add(new Rule(messageContains("403", "forbidden"), RetryReason.FORBIDDEN_403));
        r.add(new Rule(messageContains("500", "502", "503", "504"), RetryReason.SERVER_ERROR_5XX));
        r.add(new Rule(messageContains("timeout", "timed out"), RetryReason.TIMEOUT));
        r.add(new Rule(typeNameContains("connect", "network", "socket", "unknownhost"), RetryReason.NETWORK_ERROR));
        return new ErrorClassifier(r);
    }

    public RetryReason classify(Throwable error) {
        if (error == null) return RetryReason.UNKNOWN;
        for (Rule rule : rules) {
            if (rule.predicate().test(error)) return rule.reason();
        }
        return RetryReason.UNKNOWN;
    }

    public List<Rule> rules() {
        return rules;
    }

    /** 대소문자 무시 메시지 부분 일치 */
    public static Predicate<Throwable> messageContains(String... keywords) {
        return t -> {
            String msg = textOf(t);
            for (String k : keywords) {
                if (msg.contains(k.toLowerCase(Locale.ROOT))) return true;
            }
            return false;
        };
    }

    /** 예외 타입 이름 부분 일치 (java.net.ConnectException, SocketException 등) */
    public static Predicate<Throwable> typeNameContains(String... keywords) {
        return t -> {
            String type = t.getClass().getSimpleName().toLowerCase(Locale.ROOT);
            for (String k : keywords) {
                if (type.contains(k.toLowerCase(Locale.ROOT))) return true;
            }
            return false;
        };
    }

    static String textOf(Throwable t) {
        String m = t.getMessage();
        return m == null ? "" : m.toLowerCase(Locale.ROOT);
    }
}
