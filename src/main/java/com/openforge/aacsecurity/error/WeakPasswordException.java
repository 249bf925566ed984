package com.openforge.aacsecurity.error;

import com.openforge.aacsecurity.auth.PasswordPolicy.PasswordRule;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class WeakPasswordException extends AccountSecurityException {

    private final PasswordRule rule;

    public WeakPasswordException(PasswordRule rule) {
        super(HttpStatus.BAD_REQUEST, rule.message());
        this.rule = rule;
    }
}
