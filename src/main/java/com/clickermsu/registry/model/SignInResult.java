package com.clickermsu.registry.model;

import lombok.Value;

@Value
public class SignInResult {
    boolean registered;
    boolean passwordMatches;

    public static SignInResult notRegistered() {
        return new SignInResult(false, false);
    }
}
