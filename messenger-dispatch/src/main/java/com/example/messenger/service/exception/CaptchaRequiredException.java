package com.example.messenger.service.exception;

import org.springframework.http.HttpStatus;

/**
 * Raised when a widget send needs a solved captcha. Carries a fresh challenge when one was issued.
 */
public class CaptchaRequiredException extends ServiceException {

    private final String captchaToken;
    private final String captchaQuestion;

    public CaptchaRequiredException(String captchaToken, String captchaQuestion) {
        super(HttpStatus.BAD_REQUEST, "Captcha verification required", "captcha_required");
        this.captchaToken = captchaToken;
        this.captchaQuestion = captchaQuestion;
    }

    public String getCaptchaToken() {
        return captchaToken;
    }

    public String getCaptchaQuestion() {
        return captchaQuestion;
    }
}
