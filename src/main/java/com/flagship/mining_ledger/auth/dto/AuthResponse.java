package com.flagship.mining_ledger.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.mining_ledger.account.dto.ProfileResponse;
import lombok.Value;

@Value
public class AuthResponse {

    @JsonProperty("success")
    boolean success;

    @JsonProperty("token")
    String token;

    @JsonProperty("user")
    ProfileResponse user;
}
