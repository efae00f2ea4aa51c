package com.example.messenger.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CaptchaChallenge {

    String token;
    String question;
    String answer;
}
