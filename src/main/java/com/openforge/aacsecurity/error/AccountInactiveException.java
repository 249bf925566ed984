package com.openforge.aacsecurity.error;

import org.springframework.http.HttpStatus;

public class AccountInactiveException extends AccountSecurityException {

    public AccountInactiveException() {
        super(HttpStatus.FORBIDDEN, "Account is inactive. Please contact an administrator.");
    }
}
