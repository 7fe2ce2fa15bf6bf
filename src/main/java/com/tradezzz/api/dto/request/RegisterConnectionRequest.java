package com.tradezzz.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Exchange API credentials to encrypt and store. Only the connection id is returned; the
 * credentials are never echoed back.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterConnectionRequest {

    /** Venue code, e.g. "binance". */
    @NotBlank
    private String exchange;

    @NotBlank
    private String apiKey;

    @NotBlank
    private String apiSecret;

    private String passphrase;

    private boolean sandbox;

    @Override
    public String toString() {
        return "RegisterConnectionRequest{exchange=" + exchange + ", sandbox=" + sandbox + "}";
    }
}
