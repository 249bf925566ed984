package com.openforge.aacsecurity.auth;

import com.openforge.aacsecurity.error.ValidationException;
import com.openforge.aacsecurity.error.WeakPasswordException;
import org.springframework.stereotype.Component;

import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Strength rules shared by registration, admin account creation and password change.
 * Rules are checked in declaration order; the first one broken is reported.
 */
@Component
public class PasswordPolicy {

    public static final int MIN_LENGTH = 8;

    private static final Pattern EMAIL = Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");

    public enum PasswordRule {
        REQUIRED("Password is required", p -> p != null && !p.isBlank()),
        MIN_LENGTH("Password must be at least " + PasswordPolicy.MIN_LENGTH + " characters long",
                p -> p.length() >= PasswordPolicy.MIN_LENGTH),
        UPPERCASE("Password must contain at least one uppercase letter", p -> p.chars().anyMatch(c -> c >= 'A' && c <= 'Z')),
        LOWERCASE("Password must contain at least one lowercase letter", p -> p.chars().anyMatch(c -> c >= 'a' && c <= 'z')),
        DIGIT("Password must contain at least one number", p -> p.chars().anyMatch(c -> c >= '0' && c <= '9'));

        private final String message;
        private final Predicate<String> check;

        PasswordRule(String message, Predicate<String> check) {
            this.message = message;
            this.check   = check;
        }

        public String message() {
            return message;
        }
    }

    /**
     * @throws WeakPasswordException naming the first rule the password breaks
     */
    public void validatePassword(String password) {
        for (PasswordRule rule : PasswordRule.values()) {
            if (!rule.check.test(password)) {
                throw new WeakPasswordException(rule);
            }
        }
    }

    /** A null or blank email is allowed; anything else must look like an address. */
    public void validateEmail(String email) {
        if (email == null || email.isBlank()) return;
        if (!EMAIL.matcher(email.trim()).matches()) {
            throw new ValidationException("Invalid email format");
        }
    }
}
